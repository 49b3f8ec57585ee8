package com.gnucash.matcher.ledger;

import java.util.List;

public interface DocumentQuery {

    /** Returns the matching documents in storage order. */
    List<Document> find(DocumentCriteria criteria) throws LedgerException;
}
