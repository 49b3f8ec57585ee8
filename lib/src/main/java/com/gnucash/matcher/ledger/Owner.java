package com.gnucash.matcher.ledger;

/** Counterparty of a document: the customer of an invoice or the vendor of a bill. */
public final class Owner {
    private final String guid;
    private final String name;

    public Owner(String guid, String name) {
        this.guid = guid;
        this.name = name;
    }

    public String getGuid() {
        return guid;
    }

    public String getName() {
        return name;
    }
}
