package com.gnucash.matcher.match;

import java.util.List;

public final class MatchRunSummary {
    private final int documentsFound;
    private final int transactionsEvaluated;
    private final List<MatchRecord> matches;
    private final boolean dryRun;
    private final boolean saved;

    public MatchRunSummary(
            int documentsFound,
            int transactionsEvaluated,
            List<MatchRecord> matches,
            boolean dryRun,
            boolean saved) {
        this.documentsFound = documentsFound;
        this.transactionsEvaluated = transactionsEvaluated;
        this.matches = List.copyOf(matches);
        this.dryRun = dryRun;
        this.saved = saved;
    }

    public int getDocumentsFound() {
        return documentsFound;
    }

    public int getTransactionsEvaluated() {
        return transactionsEvaluated;
    }

    public List<MatchRecord> getMatches() {
        return matches;
    }

    public int getMatchCount() {
        return matches.size();
    }

    public boolean isDryRun() {
        return dryRun;
    }

    /** True when the session was saved at the end of the run. */
    public boolean isSaved() {
        return saved;
    }
}
