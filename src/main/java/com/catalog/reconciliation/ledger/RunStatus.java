package com.catalog.reconciliation.ledger;

import java.util.Locale;

/**
 * Lifecycle of a reconciliation run: {@code IN_PROGRESS} until finished,
 * then exactly one terminal status.
 */
public enum RunStatus {
    IN_PROGRESS,
    SUCCESS,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
