package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.Account;
import com.gnucash.matcher.ledger.AccountPaths;
import com.gnucash.matcher.ledger.Document;
import com.gnucash.matcher.ledger.DocumentCriteria;
import com.gnucash.matcher.ledger.DocumentKind;
import com.gnucash.matcher.ledger.LedgerBook;
import com.gnucash.matcher.ledger.LedgerException;
import com.gnucash.matcher.ledger.LedgerSession;
import com.gnucash.matcher.ledger.Posting;
import com.gnucash.matcher.ledger.Transaction;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches the payments of one account against the open invoices or bills of an open session.
 *
 * <p>Each distinct transaction of the payment account is evaluated once: the eligible posting into
 * the control account is paired with the first open document of equal total whose posted date
 * fits the date window. Accepted pairings add the posting to the document's lot (unless dry-run)
 * and take the document out of the pool. Report lines go to the supplied stream; the session is
 * saved at the end only when postings were actually assigned.</p>
 */
public final class PaymentMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(PaymentMatcher.class);

    private final MatchOptions options;
    private final ConfirmationGate gate;
    private final PrintStream out;

    public PaymentMatcher(MatchOptions options, ConfirmationGate gate, PrintStream out) {
        this.options = Objects.requireNonNull(options, "options");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.out = Objects.requireNonNull(out, "out");
    }

    public MatchRunSummary run(LedgerSession session) throws MatchRunException {
        LedgerBook book = session.getBook();
        Account paymentAccount = resolve(book, options.getPaymentAccountPath(), "payment account");
        Account controlAccount = resolve(book, options.getControlAccountPath(), "A/R or A/P account");
        if (options.getDateWindow().isEmpty()) {
            LOG.warn("Date window {} cannot match any document", options.getDateWindow());
        }

        DocumentKind kind = options.getDocumentKind();
        Run run;
        try {
            List<Document> unpaid = session.getDocumentQuery().find(DocumentCriteria.unpaid(kind));
            run = new Run(book, controlAccount, new CandidatePool(unpaid));
        } catch (LedgerException ex) {
            throw new MatchRunException(
                    MatchRunException.Kind.SESSION, "Unable to query unpaid " + kind.getPluralLabel(), ex);
        }
        out.println("Found " + run.pool.getInitialSize() + " unpaid " + kind.getPluralLabel() + ".");
        LOG.info(
                "Matching payments of {} against {} unpaid {} on {} (window {}, dryRun={})",
                paymentAccount.getName(),
                run.pool.getInitialSize(),
                kind.getPluralLabel(),
                controlAccount.getName(),
                options.getDateWindow(),
                options.isDryRun());

        TransactionWalker walker = new TransactionWalker(book, paymentAccount);
        try {
            walker.walk(run::evaluate);
        } catch (LedgerException ex) {
            throw new MatchRunException(
                    MatchRunException.Kind.SESSION, "Unable to match payments: " + ex.getMessage(), ex);
        }

        boolean saved = report(session, run);
        return new MatchRunSummary(
                run.pool.getInitialSize(), walker.getProcessedCount(), run.matches, options.isDryRun(), saved);
    }

    private boolean report(LedgerSession session, Run run) throws MatchRunException {
        int matchCount = run.matches.size();
        if (options.isDryRun()) {
            out.println("DRY RUN: Found " + matchCount + " potential matches. No changes will be saved.");
            return false;
        }
        if (!run.changesMade) {
            out.println("No new matches found.");
            return false;
        }
        out.println(matchCount + " Matches found.");
        out.println("Saving changes...");
        try {
            session.save();
        } catch (LedgerException ex) {
            throw new MatchRunException(
                    MatchRunException.Kind.SESSION, "Unable to save changes: " + ex.getMessage(), ex);
        }
        LOG.info("Saved {} matches", matchCount);
        return true;
    }

    private static Account resolve(LedgerBook book, String path, String role) throws MatchRunException {
        Optional<Account> account;
        try {
            account = AccountPaths.resolve(book, path);
        } catch (LedgerException ex) {
            throw new MatchRunException(
                    MatchRunException.Kind.SESSION, "Unable to look up " + role + " '" + path + "'", ex);
        }
        return account.orElseThrow(
                () -> new MatchRunException(
                        MatchRunException.Kind.CONFIGURATION, "Could not find " + role + " '" + path + "'"));
    }

    /** Mutable state of a single pass. */
    private final class Run {
        private final LedgerBook book;
        private final EligibilityFilter filter;
        private final MatchResolver resolver;
        private final CandidatePool pool;
        private final List<MatchRecord> matches = new ArrayList<>();
        private boolean changesMade;

        private Run(LedgerBook book, Account controlAccount, CandidatePool pool) {
            this.book = book;
            this.filter = new EligibilityFilter(controlAccount);
            this.resolver = new MatchResolver(controlAccount, options.getDateWindow());
            this.pool = pool;
        }

        private void evaluate(Transaction transaction) throws LedgerException {
            Optional<Posting> eligible = filter.select(transaction);
            if (eligible.isEmpty()) {
                return;
            }
            Posting posting = eligible.get();
            Optional<Document> document =
                    resolver.resolve(posting.getValue().abs(), transaction.getDate(), pool);
            if (document.isEmpty()) {
                LOG.debug(
                        "No open document for payment {} of {} on {}",
                        transaction.getGuid(),
                        posting.getValue().abs(),
                        transaction.getDate());
                return;
            }
            MatchCandidate candidate = new MatchCandidate(transaction, posting, document.get());
            if (!gate.confirm(candidate)) {
                LOG.info("Pairing of payment {} with {} rejected", transaction.getGuid(), document.get().getId());
                return;
            }
            commit(candidate);
        }

        private void commit(MatchCandidate candidate) throws LedgerException {
            Document document = candidate.getDocument();
            MatchRecord record = new MatchRecord(matches.size() + 1, candidate);
            out.println(record.toAuditLine());
            if (!options.isDryRun()) {
                book.assignToGroup(candidate.getPosting(), document.getPostedGroup());
                changesMade = true;
            }
            pool.remove(document);
            matches.add(record);
            LOG.info(record.toAuditLine());
        }
    }
}
