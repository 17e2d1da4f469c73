package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for wallet operations.
 *
 * Metrics exposed:
 * - wallet.operations: counter tagged by operation and outcome
 * - wallet.insufficient_funds: counter of rejected debits, tagged by operation
 * - wallet.operation.latency: timer tagged by operation
 */
@Component
public class WalletMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_INSUFFICIENT_FUNDS = "insufficient_funds";
    public static final String OUTCOME_STORAGE_UNAVAILABLE = "storage_unavailable";
    public static final String OUTCOME_INVARIANT_VIOLATION = "invariant_violation";
    public static final String OUTCOME_REJECTED = "rejected";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public WalletMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("wallet.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordInsufficientFunds(String operation) {
        registry.counter("wallet.insufficient_funds",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("wallet.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and alphanumeric to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
