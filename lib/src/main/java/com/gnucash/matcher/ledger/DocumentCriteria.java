package com.gnucash.matcher.ledger;

import java.util.Objects;

/**
 * Filter for {@link DocumentQuery}. A {@code null} paid or active flag means the flag is not
 * constrained.
 */
public final class DocumentCriteria {
    private final DocumentKind kind;
    private final Boolean paid;
    private final Boolean active;

    public DocumentCriteria(DocumentKind kind, Boolean paid, Boolean active) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.paid = paid;
        this.active = active;
    }

    public static DocumentCriteria unpaid(DocumentKind kind) {
        return new DocumentCriteria(kind, Boolean.FALSE, null);
    }

    public DocumentKind getKind() {
        return kind;
    }

    public Boolean getPaid() {
        return paid;
    }

    public Boolean getActive() {
        return active;
    }

    public boolean accepts(Document document) {
        return document.getKind() == kind
                && (paid == null || document.isPaid() == paid)
                && (active == null || document.isActive() == active);
    }
}
