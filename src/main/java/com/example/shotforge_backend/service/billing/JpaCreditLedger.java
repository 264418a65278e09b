package com.example.shotforge_backend.service.billing;

import com.example.shotforge_backend.engine.Interfaces.CreditLedger;
import com.example.shotforge_backend.model.CreditTransaction;
import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.repository.AccountRepository;
import com.example.shotforge_backend.repository.CreditTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * Credit ledger backed by {@code account.credit_balance} and the {@code credit_transaction} table.
 */
@Service
public class JpaCreditLedger implements CreditLedger {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaCreditLedger.class);

    private final AccountRepository accountRepository;
    private final CreditTransactionRepository transactionRepository;

    public JpaCreditLedger(AccountRepository accountRepository, CreditTransactionRepository transactionRepository) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public long balance(UUID accountId) {
        return accountRepository.findCreditBalance(accountId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCOUNT_NOT_FOUND"));
    }

    @Override
    @Transactional
    public boolean debit(UUID accountId, UUID projectId, String shotId, QualityTier tier, long amount) {
        if (transactionRepository.existsByProjectIdAndShotId(projectId, shotId)) {
            LOGGER.debug("LEDGER debit skipped, already charged projectId={} shotId={}", projectId, shotId);
            return true;
        }
        if (accountRepository.debitIfSufficient(accountId, amount) == 0) {
            LOGGER.warn("LEDGER debit refused accountId={} projectId={} shotId={} amount={}", accountId, projectId, shotId, amount);
            return false;
        }
        transactionRepository.saveAndFlush(new CreditTransaction(accountId, projectId, shotId, tier, amount));
        LOGGER.info("LEDGER debit accountId={} projectId={} shotId={} tier={} amount={}", accountId, projectId, shotId, tier, amount);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isCharged(UUID projectId, String shotId) {
        return transactionRepository.existsByProjectIdAndShotId(projectId, shotId);
    }
}
