package com.gnucash.matcher.match;

import com.gnucash.matcher.ledger.Document;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unmatched documents of the current run, keyed by GUID and kept in query order. A document is
 * removed at most once, when a pairing for it is accepted.
 */
public final class CandidatePool {

    private final Map<String, Document> documents = new LinkedHashMap<>();
    private final int initialSize;

    public CandidatePool(List<Document> seed) {
        for (Document document : seed) {
            documents.putIfAbsent(document.getGuid(), document);
        }
        this.initialSize = documents.size();
    }

    public int getInitialSize() {
        return initialSize;
    }

    public int size() {
        return documents.size();
    }

    public boolean contains(Document document) {
        return documents.containsKey(document.getGuid());
    }

    /** Stable copy of the current members for scanning. */
    public List<Document> snapshot() {
        return List.copyOf(documents.values());
    }

    public void remove(Document document) {
        if (documents.remove(document.getGuid()) == null) {
            throw new IllegalStateException("Document " + document.getId() + " is not in the candidate pool");
        }
    }
}
