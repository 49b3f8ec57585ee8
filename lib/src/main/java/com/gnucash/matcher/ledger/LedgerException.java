package com.gnucash.matcher.ledger;

/**
 * Checked exception signalling that the underlying book could not be opened, read, written or
 * saved. Wraps the storage failure as its cause.
 */
public final class LedgerException extends Exception {
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
