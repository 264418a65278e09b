package com.example.shotforge_backend.repository;

import com.example.shotforge_backend.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {
    Optional<Account> findByExternalSubject(String externalSubject);

    @Query("select a.creditBalance from Account a where a.id = :id")
    Optional<Long> findCreditBalance(@Param("id") UUID id);

    /**
     * Atomic conditional debit.
     *
     * @return 1 when the balance covered the amount and was debited, 0 otherwise.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Account a set a.creditBalance = a.creditBalance - :amount " +
            "where a.id = :id and a.creditBalance >= :amount")
    int debitIfSufficient(@Param("id") UUID id, @Param("amount") long amount);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Account a set a.creditBalance = a.creditBalance + :amount where a.id = :id")
    int credit(@Param("id") UUID id, @Param("amount") long amount);
}
