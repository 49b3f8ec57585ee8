package com.gnucash.matcher.ledger;

/**
 * An exclusively locked, open book. Changes made through {@link #getBook()} become durable only
 * when {@link #save()} succeeds; {@link #close()} releases the lock and discards unsaved changes.
 */
public interface LedgerSession extends AutoCloseable {

    LedgerBook getBook();

    DocumentQuery getDocumentQuery();

    void save() throws LedgerException;

    @Override
    void close() throws LedgerException;
}
