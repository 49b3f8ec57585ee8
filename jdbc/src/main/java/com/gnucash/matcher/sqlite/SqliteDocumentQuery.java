package com.gnucash.matcher.sqlite;

import com.gnucash.matcher.ledger.Document;
import com.gnucash.matcher.ledger.DocumentCriteria;
import com.gnucash.matcher.ledger.DocumentKind;
import com.gnucash.matcher.ledger.DocumentQuery;
import com.gnucash.matcher.ledger.LedgerException;
import com.gnucash.matcher.ledger.OpenBalanceGroup;
import com.gnucash.matcher.ledger.Owner;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds posted invoices and bills in the {@code invoices} table.
 *
 * <p>GnuCash keeps one table for every business document and tells them apart by owner: customer
 * documents are invoices, vendor documents are bills, and job documents take the kind of the
 * job's owner. Employee vouchers are never returned. A document counts as paid once its posted
 * lot is closed. Unposted documents have no lot and no total, so they are left out.</p>
 */
final class SqliteDocumentQuery implements DocumentQuery {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDocumentQuery.class);

    static final int OWNER_CUSTOMER = 2;
    static final int OWNER_JOB = 3;
    static final int OWNER_VENDOR = 4;

    private static final String BASE_QUERY =
            "SELECT i.guid, i.id, i.billing_id, i.active, i.owner_type, i.owner_guid, i.date_posted,"
                    + " i.post_lot, l.account_guid, l.is_closed, s.value_num, s.value_denom"
                    + " FROM invoices i"
                    + " JOIN lots l ON l.guid = i.post_lot"
                    + " JOIN splits s ON s.tx_guid = i.post_txn AND s.lot_guid = i.post_lot";

    private final Connection connection;

    SqliteDocumentQuery(Connection connection) {
        this.connection = connection;
    }

    @Override
    public List<Document> find(DocumentCriteria criteria) throws LedgerException {
        StringBuilder sql = new StringBuilder(BASE_QUERY).append(" WHERE 1 = 1");
        List<Integer> parameters = new ArrayList<>();
        if (criteria.getPaid() != null) {
            sql.append(" AND l.is_closed = ?");
            parameters.add(criteria.getPaid() ? 1 : 0);
        }
        if (criteria.getActive() != null) {
            sql.append(" AND i.active = ?");
            parameters.add(criteria.getActive() ? 1 : 0);
        }
        sql.append(" ORDER BY i.rowid, s.rowid");

        // one row per posted split in the lot; a document posted without accumulated splits has several
        Map<String, Document> documents = new LinkedHashMap<>();
        Map<String, BigDecimal> totals = new HashMap<>();
        Set<String> skipped = new HashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
            for (int i = 0; i < parameters.size(); i++) {
                statement.setInt(i + 1, parameters.get(i));
            }
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String guid = rs.getString(1);
                    if (skipped.contains(guid)) {
                        continue;
                    }
                    BigDecimal value = GncNumeric.toBigDecimal(rs.getLong(11), rs.getLong(12));
                    if (documents.containsKey(guid)) {
                        totals.merge(guid, value, BigDecimal::add);
                        continue;
                    }
                    Document document = readDocument(rs, criteria.getKind(), value);
                    if (document == null) {
                        skipped.add(guid);
                    } else {
                        documents.put(guid, document);
                        totals.put(guid, value);
                    }
                }
            }
        } catch (SQLException ex) {
            throw new LedgerException(
                    "Unable to query " + criteria.getKind().getPluralLabel() + ": " + ex.getMessage(), ex);
        }
        List<Document> result = new ArrayList<>(documents.size());
        for (Document document : documents.values()) {
            result.add(withTotal(document, totals.get(document.getGuid()).abs()));
        }
        return result;
    }

    private static Document withTotal(Document document, BigDecimal total) {
        return new Document(
                document.getGuid(),
                document.getKind(),
                document.getId(),
                document.getBillingId(),
                document.getOwner(),
                total,
                document.getPostedDate(),
                document.isPaid(),
                document.isActive(),
                document.getPostedGroup());
    }

    private Document readDocument(ResultSet rs, DocumentKind wanted, BigDecimal total) throws SQLException {
        String guid = rs.getString(1);
        String id = rs.getString(2);
        OwnerRef owner = resolveOwner(rs.getInt(5), rs.getString(6));
        if (owner.kind != wanted) {
            return null;
        }
        LocalDate posted = GncTimestamps.toLocalDate(rs.getString(7));
        if (posted == null) {
            LOG.debug("Skipping {} {}: no posted date", wanted.getLabel(), id);
            return null;
        }
        return new Document(
                guid,
                wanted,
                id,
                SqliteLedgerBook.emptyToNull(rs.getString(3)),
                owner.owner,
                total.abs(),
                posted,
                rs.getInt(10) != 0,
                rs.getInt(4) != 0,
                new OpenBalanceGroup(rs.getString(8), rs.getString(9)));
    }

    private OwnerRef resolveOwner(int ownerType, String ownerGuid) throws SQLException {
        switch (ownerType) {
            case OWNER_CUSTOMER:
                return new OwnerRef(DocumentKind.INVOICE, new Owner(ownerGuid, lookupName("customers", ownerGuid)));
            case OWNER_VENDOR:
                return new OwnerRef(DocumentKind.BILL, new Owner(ownerGuid, lookupName("vendors", ownerGuid)));
            case OWNER_JOB:
                try (PreparedStatement statement =
                        connection.prepareStatement("SELECT owner_type, owner_guid FROM jobs WHERE guid = ?")) {
                    statement.setString(1, ownerGuid);
                    try (ResultSet rs = statement.executeQuery()) {
                        if (rs.next() && rs.getInt(1) != OWNER_JOB) {
                            return resolveOwner(rs.getInt(1), rs.getString(2));
                        }
                    }
                }
                return new OwnerRef(null, null);
            default:
                return new OwnerRef(null, null);
        }
    }

    private String lookupName(String table, String guid) throws SQLException {
        if (guid == null) {
            return null;
        }
        try (PreparedStatement statement =
                connection.prepareStatement("SELECT name FROM " + table + " WHERE guid = ?")) {
            statement.setString(1, guid);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private static final class OwnerRef {
        private final DocumentKind kind;
        private final Owner owner;

        private OwnerRef(DocumentKind kind, Owner owner) {
            this.kind = kind;
            this.owner = owner;
        }
    }
}
