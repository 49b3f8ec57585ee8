package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.DocumentKind;
import java.math.BigDecimal;
import java.time.LocalDate;

/** Audit entry for one accepted pairing. */
public final class MatchRecord {
    private final int sequence;
    private final LocalDate paymentDate;
    private final BigDecimal paymentAmount;
    private final DocumentKind documentKind;
    private final String documentId;
    private final BigDecimal documentAmount;
    private final LocalDate documentDate;

    public MatchRecord(int sequence, MatchCandidate candidate) {
        this.sequence = sequence;
        this.paymentDate = candidate.getPaymentDate();
        this.paymentAmount = candidate.getPaymentAmount();
        this.documentKind = candidate.getDocument().getKind();
        this.documentId = candidate.getDocument().getId();
        this.documentAmount = candidate.getDocument().getTotal();
        this.documentDate = candidate.getDocument().getPostedDate();
    }

    public int getSequence() {
        return sequence;
    }

    public LocalDate getPaymentDate() {
        return paymentDate;
    }

    public BigDecimal getPaymentAmount() {
        return paymentAmount;
    }

    public DocumentKind getDocumentKind() {
        return documentKind;
    }

    public String getDocumentId() {
        return documentId;
    }

    public BigDecimal getDocumentAmount() {
        return documentAmount;
    }

    public LocalDate getDocumentDate() {
        return documentDate;
    }

    public String toAuditLine() {
        return "[%d] Matching payment on %s (%s) to %s %s (%s) from %s"
                .formatted(
                        sequence,
                        paymentDate,
                        paymentAmount.toPlainString(),
                        documentKind.getLabel(),
                        documentId,
                        documentAmount.toPlainString(),
                        documentDate);
    }
}
