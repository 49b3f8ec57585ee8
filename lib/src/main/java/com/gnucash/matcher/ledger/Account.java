package com.gnucash.matcher.ledger;

import java.util.Objects;

/**
 * Handle to an account of the book. Two handles denote the same account when their GUIDs are
 * equal; names are not unique across the account tree.
 */
public final class Account {
    private final String guid;
    private final String name;
    private final String parentGuid;

    public Account(String guid, String name, String parentGuid) {
        this.guid = Objects.requireNonNull(guid, "guid");
        this.name = Objects.requireNonNull(name, "name");
        this.parentGuid = parentGuid;
    }

    public String getGuid() {
        return guid;
    }

    public String getName() {
        return name;
    }

    public String getParentGuid() {
        return parentGuid;
    }

    public boolean isSameAccount(String accountGuid) {
        return guid.equals(accountGuid);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Account)) {
            return false;
        }
        return guid.equals(((Account) other).guid);
    }

    @Override
    public int hashCode() {
        return guid.hashCode();
    }

    @Override
    public String toString() {
        return name + " (" + guid + ")";
    }
}
