package com.gnucash.matcher.match;

import static com.gnucash.matcher.testing.InMemoryLedger.leg;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gnucash.matcher.ledger.Account;
import com.gnucash.matcher.ledger.Document;
import com.gnucash.matcher.ledger.DocumentKind;
import com.gnucash.matcher.ledger.LedgerException;
import com.gnucash.matcher.testing.InMemoryLedger;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;

final class PaymentMatcherTest {

    private final InMemoryLedger ledger = new InMemoryLedger();
    private final Account checking = ledger.account("Assets:Current Assets:Checking");
    private final Account receivable = ledger.account("Assets:Accounts Receivable");
    private final Account payable = ledger.account("Liabilities:Accounts Payable");
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void matchesPaymentToFirstInvoiceAndSaves() throws Exception {
        Document i1 = invoice("I1", "250.00", LocalDate.of(2024, 1, 1));
        invoice("I2", "250.00", LocalDate.of(2024, 1, 10));
        String tx =
                ledger.transaction(
                        "Customer payment", LocalDate.of(2024, 1, 5), leg(checking, "-250.00"), leg(receivable, "250.00"));

        MatchRunSummary summary = matcher(arOptions().dateWindow(DateWindow.of(10, 30))).run(ledger);

        assertEquals(2, summary.getDocumentsFound());
        assertEquals(1, summary.getMatchCount());
        MatchRecord record = summary.getMatches().get(0);
        assertEquals(1, record.getSequence());
        assertEquals("I1", record.getDocumentId());
        assertEquals(DocumentKind.INVOICE, record.getDocumentKind());
        assertEquals(LocalDate.of(2024, 1, 5), record.getPaymentDate());
        assertEquals(new BigDecimal("250.00"), record.getPaymentAmount());
        assertEquals(LocalDate.of(2024, 1, 1), record.getDocumentDate());
        assertEquals(new BigDecimal("250.00"), record.getDocumentAmount());
        assertEquals(i1.getPostedGroup().getGuid(), ledger.posting(tx, receivable).getGroupGuid());
        assertTrue(summary.isSaved());
        assertEquals(1, ledger.getSaveCount());
        assertEquals(
                List.of(
                        "Found 2 unpaid invoices.",
                        "[1] Matching payment on 2024-01-05 (250.00) to Invoice I1 (250.00) from 2024-01-01",
                        "1 Matches found.",
                        "Saving changes..."),
                lines());
    }

    @Test
    void dryRunReportsButDoesNotAssignOrSave() throws Exception {
        invoice("I1", "250.00", LocalDate.of(2024, 1, 1));
        String tx =
                ledger.transaction(
                        "Customer payment", LocalDate.of(2024, 1, 5), leg(checking, "-250.00"), leg(receivable, "250.00"));

        MatchRunSummary summary = matcher(arOptions().dryRun(true)).run(ledger);

        assertEquals(1, summary.getMatchCount());
        assertTrue(summary.isDryRun());
        assertFalse(summary.isSaved());
        assertNull(ledger.posting(tx, receivable).getGroupGuid());
        assertEquals(0, ledger.getSaveCount());
        assertEquals("DRY RUN: Found 1 potential matches. No changes will be saved.", lines().get(2));
    }

    @Test
    void dryRunStillConsumesMatchedDocuments() throws Exception {
        invoice("I1", "80.00", LocalDate.of(2024, 1, 1));
        ledger.transaction("First", LocalDate.of(2024, 1, 5), leg(checking, "-80.00"), leg(receivable, "80.00"));
        ledger.transaction("Second", LocalDate.of(2024, 1, 6), leg(checking, "-80.00"), leg(receivable, "80.00"));

        MatchRunSummary summary = matcher(arOptions().dryRun(true)).run(ledger);

        assertEquals(1, summary.getMatchCount());
    }

    @Test
    void documentIsMatchedAtMostOnce() throws Exception {
        Document only = invoice("I1", "80.00", LocalDate.of(2024, 1, 1));
        String first =
                ledger.transaction("First", LocalDate.of(2024, 1, 5), leg(checking, "-80.00"), leg(receivable, "80.00"));
        String second =
                ledger.transaction("Second", LocalDate.of(2024, 1, 6), leg(checking, "-80.00"), leg(receivable, "80.00"));

        MatchRunSummary summary = matcher(arOptions()).run(ledger);

        assertEquals(1, summary.getMatchCount());
        assertEquals(only.getPostedGroup().getGuid(), ledger.posting(first, receivable).getGroupGuid());
        assertNull(ledger.posting(second, receivable).getGroupGuid());
    }

    @Test
    void reportsNoChangesWithoutSaving() throws Exception {
        invoice("I1", "100.00", LocalDate.of(2024, 1, 1));
        ledger.transaction("Payment", LocalDate.of(2024, 1, 5), leg(checking, "-100.01"), leg(receivable, "100.01"));

        MatchRunSummary summary = matcher(arOptions()).run(ledger);

        assertEquals(0, summary.getMatchCount());
        assertFalse(summary.isSaved());
        assertEquals(0, ledger.getSaveCount());
        assertEquals(List.of("Found 1 unpaid invoices.", "No new matches found."), lines());
    }

    @Test
    void paidDocumentsAreNotCandidates() throws Exception {
        ledger.document(DocumentKind.INVOICE, "PAID", "100.00", LocalDate.of(2024, 1, 1), receivable, true);
        ledger.transaction("Payment", LocalDate.of(2024, 1, 5), leg(checking, "-100.00"), leg(receivable, "100.00"));

        MatchRunSummary summary = matcher(arOptions()).run(ledger);

        assertEquals(0, summary.getDocumentsFound());
        assertEquals(0, summary.getMatchCount());
    }

    @Test
    void matchesBillsAgainstPayableInApMode() throws Exception {
        Document bill = ledger.document(DocumentKind.BILL, "B7", "42.50", LocalDate.of(2024, 3, 1), payable);
        invoice("I1", "42.50", LocalDate.of(2024, 3, 1));
        String tx =
                ledger.transaction("Vendor payment", LocalDate.of(2024, 3, 3), leg(checking, "42.50"), leg(payable, "-42.50"));

        MatchOptions.Builder options =
                MatchOptions.builder()
                        .paymentAccountPath("Assets:Current Assets:Checking")
                        .controlAccountPath("Liabilities:Accounts Payable")
                        .documentKind(DocumentKind.BILL);
        MatchRunSummary summary = matcher(options).run(ledger);

        assertEquals(1, summary.getDocumentsFound());
        assertEquals(bill.getPostedGroup().getGuid(), ledger.posting(tx, payable).getGroupGuid());
        assertEquals("Found 1 unpaid bills.", lines().get(0));
        assertEquals(
                "[1] Matching payment on 2024-03-03 (42.50) to Bill B7 (42.50) from 2024-03-01", lines().get(1));
    }

    @Test
    void transactionWithSeveralPaymentLegsIsEvaluatedOnce() throws Exception {
        invoice("I1", "30.00", LocalDate.of(2024, 1, 1));
        String tx =
                ledger.transaction(
                        "Two deposits",
                        LocalDate.of(2024, 1, 5),
                        leg(checking, "-10.00"),
                        leg(checking, "-20.00"),
                        leg(receivable, "30.00"));

        MatchRunSummary summary = matcher(arOptions()).run(ledger);

        assertEquals(1, summary.getTransactionsEvaluated());
        assertEquals(1, ledger.lookupsOf(tx));
        assertEquals(0, summary.getMatchCount());
    }

    @Test
    void rejectedPairingKeepsDocumentForLaterPayments() throws Exception {
        Document i1 = invoice("I1", "60.00", LocalDate.of(2024, 1, 1));
        invoice("I2", "60.00", LocalDate.of(2024, 1, 2));
        String first =
                ledger.transaction("First", LocalDate.of(2024, 1, 5), leg(checking, "-60.00"), leg(receivable, "60.00"));
        String second =
                ledger.transaction("Second", LocalDate.of(2024, 1, 6), leg(checking, "-60.00"), leg(receivable, "60.00"));
        List<String> offered = new ArrayList<>();
        Deque<Boolean> answers = new ArrayDeque<>(List.of(false, true));

        ConfirmationGate scripted =
                candidate -> {
                    offered.add(candidate.getDocument().getId());
                    return answers.removeFirst();
                };
        MatchRunSummary summary = new PaymentMatcher(arOptions().confirm(true).build(), scripted, out).run(ledger);

        assertEquals(List.of("I1", "I1"), offered);
        assertEquals(1, summary.getMatchCount());
        assertNull(ledger.posting(first, receivable).getGroupGuid());
        assertEquals(i1.getPostedGroup().getGuid(), ledger.posting(second, receivable).getGroupGuid());
    }

    @Test
    void unknownPaymentAccountIsAConfigurationError() {
        MatchOptions.Builder options = arOptions().paymentAccountPath("Assets:Nope");

        MatchRunException ex = assertThrows(MatchRunException.class, () -> matcher(options).run(ledger));

        assertEquals(MatchRunException.Kind.CONFIGURATION, ex.getKind());
        assertEquals("Could not find payment account 'Assets:Nope'", ex.getMessage());
        assertEquals("", buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void unknownControlAccountIsAConfigurationError() {
        MatchOptions.Builder options = arOptions().controlAccountPath("Assets:Receivables");

        MatchRunException ex = assertThrows(MatchRunException.class, () -> matcher(options).run(ledger));

        assertEquals(MatchRunException.Kind.CONFIGURATION, ex.getKind());
        assertEquals("Could not find A/R or A/P account 'Assets:Receivables'", ex.getMessage());
    }

    @Test
    void saveFailureIsASessionError() {
        invoice("I1", "250.00", LocalDate.of(2024, 1, 1));
        ledger.transaction("Payment", LocalDate.of(2024, 1, 5), leg(checking, "-250.00"), leg(receivable, "250.00"));
        LedgerException failure = new LedgerException("disk full");
        ledger.failSaveWith(failure);

        MatchRunException ex = assertThrows(MatchRunException.class, () -> matcher(arOptions()).run(ledger));

        assertEquals(MatchRunException.Kind.SESSION, ex.getKind());
        assertSame(failure, ex.getCause());
    }

    @Test
    void optionsRequireAccountsAndMode() {
        assertThrows(IllegalArgumentException.class, () -> arOptions().paymentAccountPath(" ").build());
        assertThrows(IllegalArgumentException.class, () -> arOptions().controlAccountPath(null).build());
        assertThrows(IllegalArgumentException.class, () -> arOptions().documentKind(null).build());
    }

    private Document invoice(String id, String total, LocalDate posted) {
        return ledger.document(DocumentKind.INVOICE, id, total, posted, receivable);
    }

    private MatchOptions.Builder arOptions() {
        return MatchOptions.builder()
                .paymentAccountPath("Assets:Current Assets:Checking")
                .controlAccountPath("Assets:Accounts Receivable")
                .documentKind(DocumentKind.INVOICE);
    }

    private PaymentMatcher matcher(MatchOptions.Builder options) {
        return new PaymentMatcher(options.build(), ConfirmationGate.alwaysAccept(), out);
    }

    private List<String> lines() {
        return List.of(buffer.toString(StandardCharsets.UTF_8).split("\\R"));
    }
}
