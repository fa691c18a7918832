package com.dosify.node.remote;

import com.dosify.node.record.Document;
import com.dosify.node.record.FieldValue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Narrow view of the authoritative remote document database.
 * Every call is network I/O and completes asynchronously; failures complete the future
 * exceptionally with a {@link RemoteStoreException}.
 */
public interface RemoteStore {

    /**
     * Reads one document. Completes with NOT_FOUND when it does not exist.
     */
    CompletableFuture<Document> getById(String collection, String id);

    /**
     * Reads the documents of a collection that match every filter.
     */
    CompletableFuture<Stream<Document>> streamCollection(String collection, List<QueryFilter> filters);

    /**
     * Writes a whole document, replacing any previous content.
     * Completes with PRECONDITION_FAILED when the stored version does not satisfy {@code precondition}.
     */
    CompletableFuture<Void> setDocument(String collection, String id, Map<String, FieldValue> fields,
                                        WritePrecondition precondition);

    CompletableFuture<Void> deleteDocument(String collection, String id);
}
