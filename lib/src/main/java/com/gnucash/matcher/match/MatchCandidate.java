package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.Document;
import com.gnucash.matcher.ledger.Posting;
import com.gnucash.matcher.ledger.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;

/** A proposed pairing of a payment posting with an open document, awaiting confirmation. */
public final class MatchCandidate {
    private final Transaction transaction;
    private final Posting posting;
    private final Document document;

    public MatchCandidate(Transaction transaction, Posting posting, Document document) {
        this.transaction = transaction;
        this.posting = posting;
        this.document = document;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public Posting getPosting() {
        return posting;
    }

    public Document getDocument() {
        return document;
    }

    public BigDecimal getPaymentAmount() {
        return posting.getValue().abs();
    }

    public LocalDate getPaymentDate() {
        return transaction.getDate();
    }
}
