package com.mouse.betinfo.exception;

/**
 * Stored data no longer satisfies an integrity guarantee. Never auto-repaired.
 */
public class IntegrityException extends LedgerException {
    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable e) {
        super(message, e);
    }
}
