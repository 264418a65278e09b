package com.example.shotforge_backend.repository;

import com.example.shotforge_backend.model.CreditTransaction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {
    boolean existsByProjectIdAndShotId(UUID projectId, String shotId);

    List<CreditTransaction> findByProjectIdOrderByCreatedAtAsc(UUID projectId);
}
