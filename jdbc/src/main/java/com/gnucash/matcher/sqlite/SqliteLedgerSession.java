package com.gnucash.matcher.sqlite;

import com.gnucash.matcher.ledger.DocumentQuery;
import com.gnucash.matcher.ledger.LedgerBook;
import com.gnucash.matcher.ledger.LedgerException;
import com.gnucash.matcher.ledger.LedgerSession;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session on a GnuCash book stored in SQLite.
 *
 * <p>Opening takes the book lock the same way GnuCash does, by writing a row to {@code gnclock};
 * a book that is already locked is refused. All changes run inside one JDBC transaction that
 * {@link #save()} commits and {@link #close()} rolls back before releasing the lock.</p>
 */
public final class SqliteLedgerSession implements LedgerSession {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteLedgerSession.class);

    private final Path bookPath;
    private final Connection connection;
    private final String hostname;
    private final long pid;
    private final SqliteLedgerBook book;
    private final SqliteDocumentQuery documentQuery;
    private boolean closed;

    private SqliteLedgerSession(Path bookPath, Connection connection, String hostname, long pid) {
        this.bookPath = bookPath;
        this.connection = connection;
        this.hostname = hostname;
        this.pid = pid;
        this.book = new SqliteLedgerBook(connection);
        this.documentQuery = new SqliteDocumentQuery(connection);
    }

    public static SqliteLedgerSession open(String location) throws LedgerException {
        Path path = SessionLocation.resolve(location);
        Connection connection;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + path);
        } catch (SQLException ex) {
            throw new LedgerException("Unable to open book " + path + ": " + ex.getMessage(), ex);
        }
        String hostname = localHostname();
        long pid = ProcessHandle.current().pid();
        try {
            connection.setAutoCommit(false);
            acquireLock(connection, path, hostname, pid);
        } catch (SQLException | LedgerException ex) {
            closeQuietly(connection, ex);
            if (ex instanceof LedgerException) {
                throw (LedgerException) ex;
            }
            throw new LedgerException("Unable to lock book " + path + ": " + ex.getMessage(), ex);
        }
        LOG.info("Opened book {} (lock {}:{})", path, hostname, pid);
        return new SqliteLedgerSession(path, connection, hostname, pid);
    }

    public Path getBookPath() {
        return bookPath;
    }

    @Override
    public LedgerBook getBook() {
        return book;
    }

    @Override
    public DocumentQuery getDocumentQuery() {
        return documentQuery;
    }

    @Override
    public void save() throws LedgerException {
        ensureOpen();
        try {
            connection.commit();
        } catch (SQLException ex) {
            throw new LedgerException("Unable to save book " + bookPath + ": " + ex.getMessage(), ex);
        }
        LOG.info("Saved book {}", bookPath);
    }

    @Override
    public void close() throws LedgerException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.rollback();
            try (PreparedStatement unlock =
                    connection.prepareStatement("DELETE FROM gnclock WHERE hostname = ? AND pid = ?")) {
                unlock.setString(1, hostname);
                unlock.setLong(2, pid);
                unlock.executeUpdate();
            }
            connection.commit();
        } catch (SQLException ex) {
            closeQuietly(connection, ex);
            throw new LedgerException("Unable to release lock on " + bookPath + ": " + ex.getMessage(), ex);
        }
        try {
            connection.close();
        } catch (SQLException ex) {
            throw new LedgerException("Unable to close book " + bookPath + ": " + ex.getMessage(), ex);
        }
        LOG.info("Closed book {}", bookPath);
    }

    private void ensureOpen() throws LedgerException {
        if (closed) {
            throw new LedgerException("Session on " + bookPath + " is closed");
        }
    }

    private static void acquireLock(Connection connection, Path path, String hostname, long pid)
            throws SQLException, LedgerException {
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT hostname, pid FROM gnclock")) {
            if (rs.next()) {
                throw new LedgerException(
                        "Book " + path + " is locked by " + rs.getString(1) + " (pid " + rs.getLong(2) + ")");
            }
        }
        try (PreparedStatement lock =
                connection.prepareStatement("INSERT INTO gnclock (hostname, pid) VALUES (?, ?)")) {
            lock.setString(1, hostname);
            lock.setLong(2, pid);
            lock.executeUpdate();
        }
        connection.commit();
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            LOG.debug("Unable to determine host name, using localhost", ex);
            return "localhost";
        }
    }

    private static void closeQuietly(Connection connection, Exception primary) {
        try {
            connection.close();
        } catch (SQLException ex) {
            primary.addSuppressed(ex);
        }
    }
}
