package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.DocumentKind;
import java.util.Objects;

/** Immutable settings of a single matching run. */
public final class MatchOptions {
    private final String paymentAccountPath;
    private final String controlAccountPath;
    private final DocumentKind documentKind;
    private final DateWindow dateWindow;
    private final boolean dryRun;
    private final boolean confirm;

    private MatchOptions(Builder builder) {
        this.paymentAccountPath = builder.paymentAccountPath;
        this.controlAccountPath = builder.controlAccountPath;
        this.documentKind = builder.documentKind;
        this.dateWindow = builder.dateWindow;
        this.dryRun = builder.dryRun;
        this.confirm = builder.confirm;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getPaymentAccountPath() {
        return paymentAccountPath;
    }

    public String getControlAccountPath() {
        return controlAccountPath;
    }

    public DocumentKind getDocumentKind() {
        return documentKind;
    }

    public DateWindow getDateWindow() {
        return dateWindow;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isConfirm() {
        return confirm;
    }

    public static final class Builder {
        private String paymentAccountPath;
        private String controlAccountPath;
        private DocumentKind documentKind;
        private DateWindow dateWindow = DateWindow.unbounded();
        private boolean dryRun;
        private boolean confirm;

        private Builder() {}

        public Builder paymentAccountPath(String value) {
            this.paymentAccountPath = value;
            return this;
        }

        public Builder controlAccountPath(String value) {
            this.controlAccountPath = value;
            return this;
        }

        public Builder documentKind(DocumentKind value) {
            this.documentKind = value;
            return this;
        }

        public Builder dateWindow(DateWindow value) {
            this.dateWindow = Objects.requireNonNull(value, "dateWindow");
            return this;
        }

        public Builder dryRun(boolean value) {
            this.dryRun = value;
            return this;
        }

        public Builder confirm(boolean value) {
            this.confirm = value;
            return this;
        }

        public MatchOptions build() {
            requireText(paymentAccountPath, "payment account path");
            requireText(controlAccountPath, "A/R or A/P account path");
            if (documentKind == null) {
                throw new IllegalArgumentException("Document kind is required");
            }
            return new MatchOptions(this);
        }

        private static void requireText(String value, String what) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Missing " + what);
            }
        }
    }
}
