package com.dosify.node.query;

import com.dosify.node.record.Document;

import java.util.List;

/**
 * Documents returned by a collection query, in result order.
 */
public record QueryResult(List<Document> documents) {

    public QueryResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of());
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
