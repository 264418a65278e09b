package com.example.shotforge_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Balance is below the cost of the shot about to be generated, or the debit was refused
 * by the ledger at commit time.
 */
public class InsufficientCreditsException extends PipelineException {

    private final long required;
    private final long available;

    public InsufficientCreditsException(long required, long available) {
        super(HttpStatus.PAYMENT_REQUIRED, "INSUFFICIENT_CREDITS",
                "required=" + required + " available=" + available);
        this.required = required;
        this.available = available;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }
}
