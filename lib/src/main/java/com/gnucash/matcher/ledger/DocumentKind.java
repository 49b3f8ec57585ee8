package com.gnucash.matcher.ledger;

import java.util.Locale;

/** Receivable invoices are matched in {@code ar} mode, payable bills in {@code ap} mode. */
public enum DocumentKind {
    INVOICE("ar", "Invoice", "invoices"),
    BILL("ap", "Bill", "bills");

    private final String mode;
    private final String label;
    private final String pluralLabel;

    DocumentKind(String mode, String label, String pluralLabel) {
        this.mode = mode;
        this.label = label;
        this.pluralLabel = pluralLabel;
    }

    public String getLabel() {
        return label;
    }

    public String getPluralLabel() {
        return pluralLabel;
    }

    public static DocumentKind fromMode(String mode) {
        if (mode != null) {
            String normalized = mode.trim().toLowerCase(Locale.ROOT);
            for (DocumentKind kind : values()) {
                if (kind.mode.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown mode: " + mode + " (expected 'ar' or 'ap')");
    }
}
