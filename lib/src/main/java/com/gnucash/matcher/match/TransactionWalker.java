package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.Account;
import com.gnucash.matcher.ledger.LedgerBook;
import com.gnucash.matcher.ledger.LedgerException;
import com.gnucash.matcher.ledger.Posting;
import com.gnucash.matcher.ledger.Transaction;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Visits every distinct transaction that touches the payment account, in the account's ledger
 * order. A transaction with several postings into the account is visited once. A walker can only
 * be used for a single pass.
 */
public final class TransactionWalker {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionWalker.class);

    @FunctionalInterface
    public interface Visitor {
        void visit(Transaction transaction) throws LedgerException;
    }

    private final LedgerBook book;
    private final Account paymentAccount;
    private final Set<String> processed = new HashSet<>();
    private boolean walked;

    public TransactionWalker(LedgerBook book, Account paymentAccount) {
        this.book = book;
        this.paymentAccount = paymentAccount;
    }

    public void walk(Visitor visitor) throws LedgerException {
        if (walked) {
            throw new IllegalStateException("Transaction walker has already been used");
        }
        walked = true;
        for (Posting posting : book.getPostings(paymentAccount)) {
            String transactionGuid = posting.getTransactionGuid();
            if (processed.contains(transactionGuid)) {
                LOG.debug("Transaction {} already evaluated, skipping posting {}", transactionGuid, posting.getGuid());
                continue;
            }
            visitor.visit(book.getTransaction(transactionGuid));
            processed.add(transactionGuid);
        }
    }

    public int getProcessedCount() {
        return processed.size();
    }
}
