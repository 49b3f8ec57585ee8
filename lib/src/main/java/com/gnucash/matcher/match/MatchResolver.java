package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.Account;
import com.gnucash.matcher.ledger.Document;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-fit search of the candidate pool. A document matches a payment when its total equals the
 * payment amount exactly, its posted date lies inside the {@link DateWindow}, and its posted lot
 * belongs to the control account. The earliest such document in pool order wins, even if a later
 * one is closer in date.
 */
public final class MatchResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MatchResolver.class);

    private final Account controlAccount;
    private final DateWindow dateWindow;

    public MatchResolver(Account controlAccount, DateWindow dateWindow) {
        this.controlAccount = controlAccount;
        this.dateWindow = dateWindow;
    }

    public Optional<Document> resolve(BigDecimal paymentAmount, LocalDate paymentDate, CandidatePool pool) {
        for (Document document : pool.snapshot()) {
            if (document.getTotal().compareTo(paymentAmount) != 0) {
                continue;
            }
            if (!dateWindow.contains(paymentDate, document.getPostedDate())) {
                continue;
            }
            if (!controlAccount.isSameAccount(document.getPostedGroup().getAccountGuid())) {
                LOG.debug(
                        "{} {} posts to account {}, not {}; ignoring",
                        document.getKind().getLabel(),
                        document.getId(),
                        document.getPostedGroup().getAccountGuid(),
                        controlAccount.getName());
                continue;
            }
            return Optional.of(document);
        }
        return Optional.empty();
    }
}
