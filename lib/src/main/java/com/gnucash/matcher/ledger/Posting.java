package com.gnucash.matcher.ledger;

import java.math.BigDecimal;
import java.util.Objects;

/** One leg (split) of a transaction, booked against a single account. */
public final class Posting {
    private final String guid;
    private final String transactionGuid;
    private final String accountGuid;
    private final BigDecimal value;
    private final String groupGuid;

    public Posting(
            String guid, String transactionGuid, String accountGuid, BigDecimal value, String groupGuid) {
        this.guid = Objects.requireNonNull(guid, "guid");
        this.transactionGuid = Objects.requireNonNull(transactionGuid, "transactionGuid");
        this.accountGuid = Objects.requireNonNull(accountGuid, "accountGuid");
        this.value = Objects.requireNonNull(value, "value");
        this.groupGuid = groupGuid;
    }

    public String getGuid() {
        return guid;
    }

    public String getTransactionGuid() {
        return transactionGuid;
    }

    public String getAccountGuid() {
        return accountGuid;
    }

    /** Signed value in the transaction currency. */
    public BigDecimal getValue() {
        return value;
    }

    /** GUID of the open-balance group (lot) this posting belongs to, or {@code null}. */
    public String getGroupGuid() {
        return groupGuid;
    }

    public boolean isAssigned() {
        return groupGuid != null;
    }

    public Posting withGroup(String newGroupGuid) {
        return new Posting(guid, transactionGuid, accountGuid, value, newGroupGuid);
    }
}
