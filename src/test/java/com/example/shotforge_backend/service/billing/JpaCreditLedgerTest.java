package com.example.shotforge_backend.service.billing;

import com.example.shotforge_backend.model.CreditTransaction;
import com.example.shotforge_backend.model.QualityTier;
import com.example.shotforge_backend.repository.AccountRepository;
import com.example.shotforge_backend.repository.CreditTransactionRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaCreditLedgerTest {

    @Mock
    private AccountRepository accountRepository;
    @Mock
    private CreditTransactionRepository transactionRepository;
    @InjectMocks
    private JpaCreditLedger ledger;

    private final UUID accountId = UUID.randomUUID();
    private final UUID projectId = UUID.randomUUID();

    @Test
    void debitIsIdempotentPerShot() {
        when(transactionRepository.existsByProjectIdAndShotId(projectId, "S01")).thenReturn(true);

        assertThat(ledger.debit(accountId, projectId, "S01", QualityTier.STANDARD, 25)).isTrue();

        verify(accountRepository, never()).debitIfSufficient(any(), anyLong());
        verify(transactionRepository, never()).saveAndFlush(any());
    }

    @Test
    void debitRecordsTransactionWhenBalanceSuffices() {
        when(transactionRepository.existsByProjectIdAndShotId(projectId, "S02")).thenReturn(false);
        when(accountRepository.debitIfSufficient(accountId, 25)).thenReturn(1);

        assertThat(ledger.debit(accountId, projectId, "S02", QualityTier.STANDARD, 25)).isTrue();

        verify(transactionRepository).saveAndFlush(any(CreditTransaction.class));
    }

    @Test
    void refusedDebitWritesNothing() {
        when(transactionRepository.existsByProjectIdAndShotId(projectId, "S03")).thenReturn(false);
        when(accountRepository.debitIfSufficient(accountId, 25)).thenReturn(0);

        assertThat(ledger.debit(accountId, projectId, "S03", QualityTier.STANDARD, 25)).isFalse();

        verify(transactionRepository, never()).saveAndFlush(any());
    }

    @Test
    void balanceOfUnknownAccountIsNotFound() {
        when(accountRepository.findCreditBalance(accountId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledger.balance(accountId))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(e -> assertThat(((ResponseStatusException) e).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }
}
