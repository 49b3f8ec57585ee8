package com.gnucash.matcher.sqlite;

import com.gnucash.matcher.ledger.LedgerException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;

/**
 * Turns the book location given on the command line into a SQLite file path. Accepts a plain
 * path, a {@code file:} URI, or a GnuCash {@code sqlite3://} URI.
 */
final class SessionLocation {

    private static final String SQLITE_SCHEME = "sqlite3://";
    private static final byte[] SQLITE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

    private SessionLocation() {}

    static Path resolve(String location) throws LedgerException {
        if (location == null || location.isBlank()) {
            throw new LedgerException("Book location missing.");
        }
        String lower = location.toLowerCase(Locale.ROOT);
        Path path;
        if (lower.startsWith(SQLITE_SCHEME)) {
            path = Paths.get(location.substring(SQLITE_SCHEME.length()));
        } else if (lower.startsWith("xml://")) {
            throw new LedgerException("XML books are not supported, save the book in SQLite format: " + location);
        } else if (lower.startsWith("file:")) {
            try {
                path = Paths.get(URI.create(location));
            } catch (IllegalArgumentException ex) {
                throw new LedgerException("Invalid file URI: " + location, ex);
            }
        } else {
            path = Paths.get(location);
        }
        path = path.toAbsolutePath().normalize();

        if (!Files.exists(path)) {
            throw new LedgerException("Book file not found: " + path);
        }
        if (!Files.isReadable(path) || !Files.isWritable(path)) {
            throw new LedgerException("Book file is not readable and writable: " + path);
        }
        requireSqliteHeader(path);
        return path;
    }

    private static void requireSqliteHeader(Path path) throws LedgerException {
        byte[] header = new byte[SQLITE_HEADER.length];
        int read;
        try (InputStream in = Files.newInputStream(path)) {
            read = in.readNBytes(header, 0, header.length);
        } catch (IOException ex) {
            throw new LedgerException("Unable to read book file: " + path, ex);
        }
        if (read != header.length || !Arrays.equals(header, SQLITE_HEADER)) {
            throw new LedgerException("Not a GnuCash SQLite book (XML books are not supported): " + path);
        }
    }
}
