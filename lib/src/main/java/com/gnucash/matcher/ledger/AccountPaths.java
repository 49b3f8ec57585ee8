package com.gnucash.matcher.ledger;

import java.util.Optional;

/** Resolves colon-delimited account paths such as {@code Assets:Current Assets:Checking}. */
public final class AccountPaths {

    public static final String SEPARATOR = ":";

    private AccountPaths() {}

    public static Optional<Account> resolve(LedgerBook book, String path) throws LedgerException {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        Account current = book.getRootAccount();
        for (String segment : path.split(SEPARATOR, -1)) {
            if (segment.isEmpty()) {
                return Optional.empty();
            }
            Optional<Account> child = book.findChildAccount(current, segment);
            if (child.isEmpty()) {
                return Optional.empty();
            }
            current = child.get();
        }
        return Optional.of(current);
    }
}
