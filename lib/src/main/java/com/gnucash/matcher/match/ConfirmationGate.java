package com.gnucash.matcher.match;

/** Decides whether a proposed pairing is committed. Called synchronously, once per candidate. */
@FunctionalInterface
public interface ConfirmationGate {

    boolean confirm(MatchCandidate candidate);

    static ConfirmationGate alwaysAccept() {
        return candidate -> true;
    }
}
