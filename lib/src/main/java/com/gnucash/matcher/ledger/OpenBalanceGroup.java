package com.gnucash.matcher.ledger;

import java.util.Objects;

/**
 * A lot: the set of postings, all drawn from one account, that together track the open balance
 * of a document.
 */
public final class OpenBalanceGroup {
    private final String guid;
    private final String accountGuid;

    public OpenBalanceGroup(String guid, String accountGuid) {
        this.guid = Objects.requireNonNull(guid, "guid");
        this.accountGuid = Objects.requireNonNull(accountGuid, "accountGuid");
    }

    public String getGuid() {
        return guid;
    }

    public String getAccountGuid() {
        return accountGuid;
    }
}
