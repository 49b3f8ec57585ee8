package com.gnucash.matcher.sqlite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gnucash.matcher.ledger.LedgerException;
import com.gnucash.matcher.ledger.OpenBalanceGroup;
import com.gnucash.matcher.ledger.Posting;
import com.gnucash.matcher.testing.GnuCashBookFixture;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

final class SqliteLedgerSessionTest {

    @Test
    void openingTakesAndClosingReleasesTheLock() throws Exception {
        GnuCashBookFixture fixture = GnuCashBookFixture.create();

        SqliteLedgerSession session = SqliteLedgerSession.open(fixture.path().toString());
        assertEquals(1, fixture.lockCount());
        session.close();
        session.close();

        assertEquals(0, fixture.lockCount());
    }

    @Test
    void refusesALockedBook() throws Exception {
        GnuCashBookFixture fixture = GnuCashBookFixture.create();
        fixture.lockBy("other-host", 4242);

        LedgerException ex =
                assertThrows(LedgerException.class, () -> SqliteLedgerSession.open(fixture.path().toString()));

        assertTrue(ex.getMessage().contains("locked by other-host"));
        assertEquals(1, fixture.lockCount());
    }

    @Test
    void acceptsGnuCashAndFileUris() throws Exception {
        GnuCashBookFixture fixture = GnuCashBookFixture.create();

        try (SqliteLedgerSession session = SqliteLedgerSession.open("sqlite3://" + fixture.path())) {
            assertEquals(fixture.path().toAbsolutePath().normalize(), session.getBookPath());
        }
        try (SqliteLedgerSession session = SqliteLedgerSession.open(fixture.path().toUri().toString())) {
            assertEquals(fixture.path().toAbsolutePath().normalize(), session.getBookPath());
        }
    }

    @Test
    void rejectsMissingAndNonSqliteFiles() throws Exception {
        Path missing = Files.createTempDirectory("gnucash-matcher").resolve("missing.gnucash");
        assertThrows(LedgerException.class, () -> SqliteLedgerSession.open(missing.toString()));

        Path xml = Files.createTempFile("gnucash-matcher", ".gnucash");
        xml.toFile().deleteOnExit();
        Files.writeString(xml, "<?xml version=\"1.0\" encoding=\"utf-8\" ?>\n<gnc-v2/>\n");
        LedgerException ex = assertThrows(LedgerException.class, () -> SqliteLedgerSession.open(xml.toString()));
        assertTrue(ex.getMessage().startsWith("Not a GnuCash SQLite book"));

        assertThrows(LedgerException.class, () -> SqliteLedgerSession.open("xml://" + xml));
    }

    @Test
    void unsavedChangesAreDiscardedOnClose() throws Exception {
        GnuCashBookFixture fixture = GnuCashBookFixture.create();
        BookSetup setup = BookSetup.create(fixture);

        try (SqliteLedgerSession session = SqliteLedgerSession.open(fixture.path().toString())) {
            session.getBook().assignToGroup(setup.paymentPosting(), setup.lot());
        }

        assertNull(fixture.splitLot(setup.paymentTx, setup.receivable));
    }

    @Test
    void savedChangesAreDurable() throws Exception {
        GnuCashBookFixture fixture = GnuCashBookFixture.create();
        BookSetup setup = BookSetup.create(fixture);

        try (SqliteLedgerSession session = SqliteLedgerSession.open(fixture.path().toString())) {
            session.getBook().assignToGroup(setup.paymentPosting(), setup.lot());
            session.save();
        }

        assertEquals(setup.lotGuid, fixture.splitLot(setup.paymentTx, setup.receivable));
        assertTrue(fixture.isLotClosed(setup.lotGuid));
    }

    @Test
    void saveAfterCloseFails() throws Exception {
        GnuCashBookFixture fixture = GnuCashBookFixture.create();
        SqliteLedgerSession session = SqliteLedgerSession.open(fixture.path().toString());
        session.close();

        assertThrows(LedgerException.class, session::save);
    }

    private static final class BookSetup {
        private final GnuCashBookFixture fixture;
        private final String receivable;
        private final String paymentTx;
        private final String lotGuid;

        private BookSetup(GnuCashBookFixture fixture, String receivable, String paymentTx, String lotGuid) {
            this.fixture = fixture;
            this.receivable = receivable;
            this.paymentTx = paymentTx;
            this.lotGuid = lotGuid;
        }

        static BookSetup create(GnuCashBookFixture fixture) throws Exception {
            String checking = fixture.account("Assets:Checking", "BANK");
            String receivable = fixture.account("Assets:Accounts Receivable", "RECEIVABLE");
            String income = fixture.account("Income:Sales", "INCOME");
            String customer = fixture.customer("ACME");
            String invoice =
                    fixture.postedDocument(
                            "I1", GnuCashBookFixture.OWNER_CUSTOMER, customer, receivable, income, "250.00", "2024-01-01");
            String paymentTx =
                    fixture.transaction("Payment", "2024-01-05", checking, "250.00", receivable, "-250.00");
            return new BookSetup(fixture, receivable, paymentTx, fixture.lotOf(invoice));
        }

        Posting paymentPosting() throws Exception {
            return new Posting(
                    fixture.splitGuid(paymentTx, receivable), paymentTx, receivable, new BigDecimal("-250.00"), null);
        }

        OpenBalanceGroup lot() {
            return new OpenBalanceGroup(lotGuid, receivable);
        }
    }
}
