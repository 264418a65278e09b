package com.example.shotforge_backend.service.billing;

import com.example.shotforge_backend.config.BillingProperties;
import com.example.shotforge_backend.engine.Interfaces.CreditLedger;
import com.example.shotforge_backend.exception.InsufficientCreditsException;
import com.example.shotforge_backend.model.Project;
import com.example.shotforge_backend.model.QualityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-shot billing: the first attempt at a shot checks the balance and reserves the tier cost,
 * retries of the same shot reuse that reservation, and the shot is charged exactly once when it
 * completes. A shot that ends failed or cancelled is released and never charged.
 * <p>
 * Admission counts the owner's outstanding reservations against the balance, so concurrent
 * projects of one owner cannot be admitted twice against the same credits.
 */
@Service
public class CreditBillingGuard {
    private static final Logger LOGGER = LoggerFactory.getLogger(CreditBillingGuard.class);

    record Reservation(UUID accountId, QualityTier tier, long amount) {}

    private final CreditLedger ledger;
    private final BillingProperties properties;
    private final Map<String, Reservation> reservations = new ConcurrentHashMap<>();

    public CreditBillingGuard(CreditLedger ledger, BillingProperties properties) {
        this.ledger = ledger;
        this.properties = properties;
    }

    public long costFor(QualityTier tier) {
        return properties.costFor(tier);
    }

    public long balance(Project project) {
        return balance(project.getOwner().getId());
    }

    public long balance(UUID accountId) {
        return ledger.balance(accountId);
    }

    /**
     * Balance minus the credits reserved for shots still in flight.
     */
    public long available(UUID accountId) {
        long reserved = reservations.values().stream()
                .filter(r -> r.accountId().equals(accountId))
                .mapToLong(Reservation::amount)
                .sum();
        return ledger.balance(accountId) - reserved;
    }

    /**
     * Admission check for one shot.
     *
     * @return {@code true} when the shot may be generated: a reservation exists already, the shot
     *         was charged before, or the available balance covers the tier cost (a reservation is
     *         then taken).
     */
    public synchronized boolean checkAndReserve(Project project, String shotId, QualityTier tier) {
        String key = key(project.getId(), shotId);
        if (reservations.containsKey(key) || ledger.isCharged(project.getId(), shotId)) {
            return true;
        }
        long cost = costFor(tier);
        long available = available(project.getOwner().getId());
        if (available < cost) {
            LOGGER.info("BILLING admission refused projectId={} shotId={} cost={} available={}", project.getId(), shotId, cost, available);
            return false;
        }
        reservations.put(key, new Reservation(project.getOwner().getId(), tier, cost));
        LOGGER.debug("BILLING reserved projectId={} shotId={} cost={}", project.getId(), shotId, cost);
        return true;
    }

    /**
     * Fails fast with {@link InsufficientCreditsException} when the next shot could not be admitted.
     * Takes no reservation.
     */
    public void ensureAffordable(Project project, String shotId, QualityTier tier) {
        if (reservations.containsKey(key(project.getId(), shotId)) || ledger.isCharged(project.getId(), shotId)) {
            return;
        }
        long cost = costFor(tier);
        long available = available(project.getOwner().getId());
        if (available < cost) {
            throw new InsufficientCreditsException(cost, available);
        }
    }

    /**
     * Charges the shot. No-op when the shot was charged already.
     *
     * @throws InsufficientCreditsException when the ledger refuses the debit
     */
    public void commit(Project project, String shotId) {
        String key = key(project.getId(), shotId);
        Reservation reservation = reservations.get(key);
        QualityTier tier = reservation != null ? reservation.tier() : project.getQualityTier();
        long amount = reservation != null ? reservation.amount() : costFor(tier);
        UUID accountId = reservation != null ? reservation.accountId() : project.getOwner().getId();

        if (!ledger.debit(accountId, project.getId(), shotId, tier, amount)) {
            throw new InsufficientCreditsException(amount, ledger.balance(accountId));
        }
        reservations.remove(key);
    }

    public void release(UUID projectId, String shotId) {
        if (reservations.remove(key(projectId, shotId)) != null) {
            LOGGER.debug("BILLING released projectId={} shotId={}", projectId, shotId);
        }
    }

    public boolean isReserved(UUID projectId, String shotId) {
        return reservations.containsKey(key(projectId, shotId));
    }

    private static String key(UUID projectId, String shotId) {
        return projectId + ":" + shotId;
    }
}
