package com.gnucash.matcher;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 1;
    static final int PATCH = 0;

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH;
    public static final String RUNTIME = "gnucash-matcher " + FULL;

    private Version() {}
}
