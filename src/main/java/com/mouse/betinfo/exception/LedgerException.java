package com.mouse.betinfo.exception;

/**
 * Root of every error raised by the ledger core.
 */
public class LedgerException extends RuntimeException {
    public LedgerException() {
        super();
    }

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable e) {
        super(message, e);
    }
}
