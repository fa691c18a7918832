package com.dosify.node.sync;

import com.dosify.node.record.FieldValue;
import com.dosify.node.record.Records;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Field-level divergence between the local and the remote copy of one record.
 *
 * {@code conflictingFields} holds exactly the names, from the union of both key sets, whose
 * values differ; a field present on only one side differs.
 */
public record ConflictData(
        Map<String, FieldValue> localData,
        Map<String, FieldValue> remoteData,
        Instant localTimestamp,
        Instant remoteTimestamp,
        SortedSet<String> conflictingFields
) {

    public ConflictData {
        localData = Records.copyOf(localData);
        remoteData = Records.copyOf(remoteData);
        conflictingFields = Collections.unmodifiableSortedSet(new TreeSet<>(
                conflictingFields != null ? conflictingFields : diff(localData, remoteData)));
    }

    /**
     * Builds the conflict between two copies, or returns null when they hold the same values.
     */
    public static ConflictData between(Map<String, FieldValue> local, Instant localTimestamp,
                                       Map<String, FieldValue> remote, Instant remoteTimestamp) {
        SortedSet<String> fields = diff(local, remote);
        if (fields.isEmpty()) {
            return null;
        }
        return new ConflictData(local, remote, localTimestamp, remoteTimestamp, fields);
    }

    static SortedSet<String> diff(Map<String, FieldValue> local, Map<String, FieldValue> remote) {
        Map<String, FieldValue> l = local != null ? local : Map.of();
        Map<String, FieldValue> r = remote != null ? remote : Map.of();
        Set<String> union = new HashSet<>(l.keySet());
        union.addAll(r.keySet());

        SortedSet<String> differing = new TreeSet<>();
        for (String field : union) {
            if (!l.containsKey(field) || !r.containsKey(field)
                    || !Objects.equals(l.get(field), r.get(field))) {
                differing.add(field);
            }
        }
        return differing;
    }
}
