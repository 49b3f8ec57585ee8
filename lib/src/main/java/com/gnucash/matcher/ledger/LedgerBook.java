package com.gnucash.matcher.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the account tree and transactions of an open book, plus the single mutation the
 * matcher performs: adding a posting to a lot.
 */
public interface LedgerBook {

    Account getRootAccount() throws LedgerException;

    Optional<Account> findChildAccount(Account parent, String name) throws LedgerException;

    /** Postings booked against {@code account}, in ledger order. */
    List<Posting> getPostings(Account account) throws LedgerException;

    Transaction getTransaction(String transactionGuid) throws LedgerException;

    void assignToGroup(Posting posting, OpenBalanceGroup group) throws LedgerException;
}
