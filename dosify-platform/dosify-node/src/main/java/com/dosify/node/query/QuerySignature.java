package com.dosify.node.query;

import com.dosify.node.record.Document;
import com.dosify.node.record.FieldValue;
import com.dosify.node.remote.QueryFilter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Parameters of a collection query, reduced to a deterministic cache key.
 *
 * @param collection collection name, must not contain ':'
 * @param filters    field predicates; their order does not affect the cache key
 * @param orderBy    field to sort by, or null for store order
 * @param descending sort direction when {@code orderBy} is set
 * @param limit      maximum number of documents, 0 for no limit
 */
public record QuerySignature(String collection, List<QueryFilter> filters, String orderBy,
                             boolean descending, int limit) {

    public static final String KEY_PREFIX = "query:";

    public QuerySignature {
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Collection cannot be null or blank");
        }
        if (collection.contains(":")) {
            throw new IllegalArgumentException("Collection name cannot contain ':'");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static QuerySignature all(String collection) {
        return new QuerySignature(collection, List.of(), null, false, 0);
    }

    public static QuerySignature where(String collection, List<QueryFilter> filters) {
        return new QuerySignature(collection, filters, null, false, 0);
    }

    public QuerySignature orderedBy(String field, boolean descending) {
        return new QuerySignature(collection, filters, field, descending, limit);
    }

    public QuerySignature limitedTo(int limit) {
        return new QuerySignature(collection, filters, orderBy, descending, limit);
    }

    /**
     * Applies filters, ordering and limit to {@code documents}.
     */
    public QueryResult applyTo(Collection<Document> documents) {
        Stream<Document> stream = documents.stream()
                .filter(doc -> filters.stream().allMatch(filter -> filter.matches(doc.fields())));
        if (orderBy != null) {
            Comparator<Document> order = Comparator.comparing(
                    doc -> doc.fields().getOrDefault(orderBy, FieldValue.nullValue()), QueryFilter::compare);
            stream = stream.sorted(descending ? order.reversed() : order);
        }
        if (limit > 0) {
            stream = stream.limit(limit);
        }
        return new QueryResult(stream.toList());
    }

    /**
     * Canonical text: filters sorted, then ordering and pagination.
     */
    public String canonical() {
        String filterPart = filters.stream()
                .map(QueryFilter::canonical)
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.joining("&"));
        return collection + "|" + filterPart + "|" + (orderBy == null ? "" : orderBy)
                + "|" + (descending ? "desc" : "asc") + "|" + limit;
    }

    /**
     * {@code query:<collection>:<sha256 of canonical form>}.
     */
    public String cacheKey() {
        return collectionPrefix(collection) + sha256(canonical());
    }

    public static String collectionPrefix(String collection) {
        return KEY_PREFIX + collection + ":";
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
