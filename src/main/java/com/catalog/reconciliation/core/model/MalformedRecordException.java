package com.catalog.reconciliation.core.model;

/**
 * Thrown when a raw record does not have the required identifier or name shape.
 * The engine skips such records and reports them as errors for their collection.
 */
public class MalformedRecordException extends Exception {

    private final transient Object rawRecord;

    public MalformedRecordException(String message, Object rawRecord) {
        super(message);
        this.rawRecord = rawRecord;
    }

    public Object getRawRecord() {
        return rawRecord;
    }
}
