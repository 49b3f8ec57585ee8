package com.gnucash.matcher.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A posted invoice or bill. The total and posted date are read from the book; the document's
 * open balance is tracked by its posted {@link OpenBalanceGroup}.
 */
public final class Document {
    private final String guid;
    private final DocumentKind kind;
    private final String id;
    private final String billingId;
    private final Owner owner;
    private final BigDecimal total;
    private final LocalDate postedDate;
    private final boolean paid;
    private final boolean active;
    private final OpenBalanceGroup postedGroup;

    public Document(
            String guid,
            DocumentKind kind,
            String id,
            String billingId,
            Owner owner,
            BigDecimal total,
            LocalDate postedDate,
            boolean paid,
            boolean active,
            OpenBalanceGroup postedGroup) {
        this.guid = Objects.requireNonNull(guid, "guid");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
        this.billingId = billingId;
        this.owner = owner;
        this.total = Objects.requireNonNull(total, "total");
        this.postedDate = Objects.requireNonNull(postedDate, "postedDate");
        this.paid = paid;
        this.active = active;
        this.postedGroup = Objects.requireNonNull(postedGroup, "postedGroup");
    }

    public String getGuid() {
        return guid;
    }

    public DocumentKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public String getBillingId() {
        return billingId;
    }

    public Owner getOwner() {
        return owner;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public LocalDate getPostedDate() {
        return postedDate;
    }

    public boolean isPaid() {
        return paid;
    }

    public boolean isActive() {
        return active;
    }

    public OpenBalanceGroup getPostedGroup() {
        return postedGroup;
    }
}
