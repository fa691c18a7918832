package com.dosify.node.sync;

import com.dosify.node.record.FieldValue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Detects field-level conflicts and builds the record chosen by a resolution strategy.
 *
 * Detection compares values only; timestamps are carried along for presentation and policies.
 */
public class SyncConflictResolver {

    public Optional<ConflictData> detectConflict(Map<String, FieldValue> local, Map<String, FieldValue> remote) {
        return detectConflict(local, null, remote, null);
    }

    public Optional<ConflictData> detectConflict(Map<String, FieldValue> local, Instant localTimestamp,
                                                 Map<String, FieldValue> remote, Instant remoteTimestamp) {
        return Optional.ofNullable(ConflictData.between(local, localTimestamp, remote, remoteTimestamp));
    }

    public Map<String, FieldValue> resolve(ConflictResolutionItem item, ResolutionStrategy strategy) {
        return resolve(item, strategy, Map.of());
    }

    /**
     * Builds the resolved record.
     *
     * For {@link ResolutionStrategy#MERGE} every conflicting field needs a choice; a choice
     * pointing at a side that lacks the field leaves the field out. Fields outside the conflict
     * set are equal on both sides and are taken as they are.
     *
     * @throws MissingFieldChoiceException if a merge lacks a choice for a conflicting field
     */
    public Map<String, FieldValue> resolve(ConflictResolutionItem item, ResolutionStrategy strategy,
                                           Map<String, FieldChoice> fieldChoices) {
        if (item == null) {
            throw new IllegalArgumentException("Conflict item cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("Strategy cannot be null");
        }
        ConflictData data = item.conflictData();

        return switch (strategy) {
            case USE_LOCAL -> data.localData();
            case USE_REMOTE -> data.remoteData();
            case MERGE -> merge(data, fieldChoices != null ? fieldChoices : Map.of());
        };
    }

    private Map<String, FieldValue> merge(ConflictData data, Map<String, FieldChoice> choices) {
        SortedSet<String> missing = new TreeSet<>(data.conflictingFields());
        missing.removeAll(choices.keySet());
        if (!missing.isEmpty()) {
            throw new MissingFieldChoiceException(missing);
        }

        Set<String> union = new LinkedHashSet<>(data.localData().keySet());
        union.addAll(data.remoteData().keySet());

        Map<String, FieldValue> merged = new LinkedHashMap<>();
        for (String field : union) {
            Map<String, FieldValue> source;
            if (data.conflictingFields().contains(field)) {
                source = choices.get(field) == FieldChoice.REMOTE ? data.remoteData() : data.localData();
            } else {
                source = data.localData().containsKey(field) ? data.localData() : data.remoteData();
            }
            if (source.containsKey(field)) {
                merged.put(field, source.get(field));
            }
        }
        return Collections.unmodifiableMap(merged);
    }

    // ==================== Exceptions ====================

    /**
     * A merge was requested without a choice for every conflicting field.
     */
    public static class MissingFieldChoiceException extends RuntimeException {
        private final Set<String> missingFields;

        public MissingFieldChoiceException(Set<String> missingFields) {
            super("Missing field choices for: " + missingFields);
            this.missingFields = Set.copyOf(missingFields);
        }

        public Set<String> getMissingFields() {
            return missingFields;
        }
    }
}
