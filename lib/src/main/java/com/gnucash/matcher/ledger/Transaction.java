package com.gnucash.matcher.ledger;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

public final class Transaction {
    private final String guid;
    private final String description;
    private final LocalDate date;
    private final List<Posting> postings;

    public Transaction(String guid, String description, LocalDate date, List<Posting> postings) {
        this.guid = Objects.requireNonNull(guid, "guid");
        this.description = description == null ? "" : description;
        this.date = Objects.requireNonNull(date, "date");
        this.postings = List.copyOf(postings);
    }

    public String getGuid() {
        return guid;
    }

    public String getDescription() {
        return description;
    }

    public LocalDate getDate() {
        return date;
    }

    /** Postings in storage order. */
    public List<Posting> getPostings() {
        return postings;
    }
}
