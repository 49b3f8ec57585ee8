package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.Account;
import com.gnucash.matcher.ledger.Posting;
import com.gnucash.matcher.ledger.Transaction;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the posting of a payment transaction that could settle a document: the transaction must
 * have exactly two postings, and the candidate is the first one booked to the control account
 * that is not yet in a lot.
 */
public final class EligibilityFilter {

    private static final Logger LOG = LoggerFactory.getLogger(EligibilityFilter.class);

    private final Account controlAccount;

    public EligibilityFilter(Account controlAccount) {
        this.controlAccount = controlAccount;
    }

    public Optional<Posting> select(Transaction transaction) {
        List<Posting> postings = transaction.getPostings();
        if (postings.size() != 2) {
            LOG.debug(
                    "Skipping transaction {} ({}): {} postings",
                    transaction.getGuid(),
                    transaction.getDescription(),
                    postings.size());
            return Optional.empty();
        }
        for (Posting posting : postings) {
            if (controlAccount.isSameAccount(posting.getAccountGuid()) && !posting.isAssigned()) {
                return Optional.of(posting);
            }
        }
        LOG.debug(
                "Skipping transaction {} ({}): no unassigned posting to {}",
                transaction.getGuid(),
                transaction.getDescription(),
                controlAccount.getName());
        return Optional.empty();
    }
}
