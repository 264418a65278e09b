package com.example.shotforge_backend.service;

import com.example.shotforge_backend.model.Account;
import com.example.shotforge_backend.repository.AccountRepository;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@Service
public class AccountService {
    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepo;

    public AccountService(AccountRepository accountRepo) {
        this.accountRepo = accountRepo;
    }

    @Transactional
    public Account ensureByExternalSubject(String externalSubject, @Nullable String displayName) {
        var normalized = externalSubject.trim();
        return accountRepo.findByExternalSubject(normalized)
                .orElseGet(() -> {
                    log.info("Creating new Account for externalSubject={}", normalized);
                    return accountRepo.save(new Account(normalized, displayName != null ? displayName : "User"));
                });
    }

    @Transactional(readOnly = true)
    public Account getByExternalSubjectOrThrow(String externalSubject) {
        return accountRepo.findByExternalSubject(externalSubject)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "OWNER_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Account getByIdOrThrow(UUID id) {
        return accountRepo.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "OWNER_NOT_FOUND"));
    }

    /**
     * Adds credits to the account, creating it on first use.
     *
     * @return the balance after the top-up
     */
    @Transactional
    public long topUp(String externalSubject, long amount) {
        if (amount <= 0) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_AMOUNT");
        Account account = ensureByExternalSubject(externalSubject, null);
        accountRepo.credit(account.getId(), amount);
        long balance = accountRepo.findCreditBalance(account.getId()).orElse(0L);
        log.info("Credits topped up externalSubject={} amount={} balance={}", externalSubject, amount, balance);
        return balance;
    }
}
