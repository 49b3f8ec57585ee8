package com.gnucash.matcher.match;

/** Fatal outcome of a matching run. */
public final class MatchRunException extends Exception {

    public enum Kind {
        /** An account path could not be resolved; nothing was matched. */
        CONFIGURATION,
        /** The book could not be read, updated or saved. */
        SESSION
    }

    private final Kind kind;

    public MatchRunException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MatchRunException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
