package com.gnucash.matcher.sqlite;

import com.gnucash.matcher.ledger.Account;
import com.gnucash.matcher.ledger.LedgerBook;
import com.gnucash.matcher.ledger.LedgerException;
import com.gnucash.matcher.ledger.OpenBalanceGroup;
import com.gnucash.matcher.ledger.Posting;
import com.gnucash.matcher.ledger.Transaction;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link LedgerBook} over the {@code accounts}, {@code transactions}, {@code splits} and {@code lots} tables. */
final class SqliteLedgerBook implements LedgerBook {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteLedgerBook.class);

    private static final String SPLIT_COLUMNS =
            "s.guid, s.tx_guid, s.account_guid, s.value_num, s.value_denom, s.lot_guid";

    private final Connection connection;
    private Account root;

    SqliteLedgerBook(Connection connection) {
        this.connection = connection;
    }

    @Override
    public Account getRootAccount() throws LedgerException {
        if (root != null) {
            return root;
        }
        try (PreparedStatement statement =
                        connection.prepareStatement(
                                "SELECT a.guid, a.name, a.parent_guid FROM books b"
                                        + " JOIN accounts a ON a.guid = b.root_account_guid");
                ResultSet rs = statement.executeQuery()) {
            if (!rs.next()) {
                throw new LedgerException("Book has no root account");
            }
            root = readAccount(rs);
            return root;
        } catch (SQLException ex) {
            throw new LedgerException("Unable to read root account: " + ex.getMessage(), ex);
        }
    }

    @Override
    public Optional<Account> findChildAccount(Account parent, String name) throws LedgerException {
        try (PreparedStatement statement =
                connection.prepareStatement(
                        "SELECT guid, name, parent_guid FROM accounts WHERE parent_guid = ? AND name = ?"
                                + " ORDER BY rowid LIMIT 1")) {
            statement.setString(1, parent.getGuid());
            statement.setString(2, name);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(readAccount(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw new LedgerException("Unable to look up account " + name + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<Posting> getPostings(Account account) throws LedgerException {
        try (PreparedStatement statement =
                connection.prepareStatement(
                        "SELECT " + SPLIT_COLUMNS + " FROM splits s JOIN transactions t ON t.guid = s.tx_guid"
                                + " WHERE s.account_guid = ?"
                                + " ORDER BY t.post_date, t.num, t.enter_date, t.rowid, s.rowid")) {
            statement.setString(1, account.getGuid());
            return readPostings(statement);
        } catch (SQLException ex) {
            throw new LedgerException(
                    "Unable to read postings of " + account.getName() + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public Transaction getTransaction(String transactionGuid) throws LedgerException {
        try {
            String description;
            LocalDate date;
            try (PreparedStatement statement =
                    connection.prepareStatement(
                            "SELECT description, post_date FROM transactions WHERE guid = ?")) {
                statement.setString(1, transactionGuid);
                try (ResultSet rs = statement.executeQuery()) {
                    if (!rs.next()) {
                        throw new LedgerException("Transaction not found: " + transactionGuid);
                    }
                    description = rs.getString(1);
                    date = GncTimestamps.toLocalDate(rs.getString(2));
                }
            }
            if (date == null) {
                throw new LedgerException("Transaction " + transactionGuid + " has no post date");
            }
            try (PreparedStatement statement =
                    connection.prepareStatement(
                            "SELECT " + SPLIT_COLUMNS + " FROM splits s WHERE s.tx_guid = ? ORDER BY s.rowid")) {
                statement.setString(1, transactionGuid);
                return new Transaction(transactionGuid, description, date, readPostings(statement));
            }
        } catch (SQLException ex) {
            throw new LedgerException(
                    "Unable to read transaction " + transactionGuid + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void assignToGroup(Posting posting, OpenBalanceGroup group) throws LedgerException {
        if (!posting.getAccountGuid().equals(group.getAccountGuid())) {
            throw new LedgerException(
                    "Split " + posting.getGuid() + " and lot " + group.getGuid() + " belong to different accounts");
        }
        try {
            try (PreparedStatement update =
                    connection.prepareStatement("UPDATE splits SET lot_guid = ? WHERE guid = ?")) {
                update.setString(1, group.getGuid());
                update.setString(2, posting.getGuid());
                if (update.executeUpdate() != 1) {
                    throw new LedgerException("Split not found: " + posting.getGuid());
                }
            }
            boolean closed = lotBalance(group.getGuid()).signum() == 0;
            try (PreparedStatement update =
                    connection.prepareStatement("UPDATE lots SET is_closed = ? WHERE guid = ?")) {
                update.setInt(1, closed ? 1 : 0);
                update.setString(2, group.getGuid());
                update.executeUpdate();
            }
            LOG.debug("Assigned split {} to lot {} (closed={})", posting.getGuid(), group.getGuid(), closed);
        } catch (SQLException ex) {
            throw new LedgerException(
                    "Unable to assign split " + posting.getGuid() + " to lot " + group.getGuid() + ": "
                            + ex.getMessage(),
                    ex);
        }
    }

    private BigDecimal lotBalance(String lotGuid) throws SQLException {
        BigDecimal balance = BigDecimal.ZERO;
        try (PreparedStatement statement =
                connection.prepareStatement("SELECT quantity_num, quantity_denom FROM splits WHERE lot_guid = ?")) {
            statement.setString(1, lotGuid);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    balance = balance.add(GncNumeric.toBigDecimal(rs.getLong(1), rs.getLong(2)));
                }
            }
        }
        return balance;
    }

    private static List<Posting> readPostings(PreparedStatement statement) throws SQLException {
        List<Posting> postings = new ArrayList<>();
        try (ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                postings.add(
                        new Posting(
                                rs.getString(1),
                                rs.getString(2),
                                rs.getString(3),
                                GncNumeric.toBigDecimal(rs.getLong(4), rs.getLong(5)),
                                emptyToNull(rs.getString(6))));
            }
        }
        return postings;
    }

    private static Account readAccount(ResultSet rs) throws SQLException {
        return new Account(rs.getString(1), rs.getString(2), emptyToNull(rs.getString(3)));
    }

    static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
