package com.dosify.node.sync;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Automatic choice of a resolution for a conflict. The chosen resolution still goes through
 * the presented state so it is attributable in the audit history.
 */
@FunctionalInterface
public interface ResolutionPolicy {

    Decision decide(ConflictData conflict);

    record Decision(ResolutionStrategy strategy, Map<String, FieldChoice> fieldChoices) {
        public Decision {
            if (strategy == null) {
                throw new IllegalArgumentException("Strategy cannot be null");
            }
            fieldChoices = fieldChoices == null ? Map.of() : Map.copyOf(fieldChoices);
        }

        public static Decision of(ResolutionStrategy strategy) {
            return new Decision(strategy, Map.of());
        }
    }

    static ResolutionPolicy preferLocal() {
        return conflict -> Decision.of(ResolutionStrategy.USE_LOCAL);
    }

    static ResolutionPolicy preferRemote() {
        return conflict -> Decision.of(ResolutionStrategy.USE_REMOTE);
    }

    /**
     * Merges field by field, taking every conflicting field from the side with the later
     * timestamp. Local wins ties and missing timestamps.
     */
    static ResolutionPolicy newestWins() {
        return conflict -> {
            boolean remoteNewer = conflict.remoteTimestamp() != null
                    && (conflict.localTimestamp() == null
                    || conflict.remoteTimestamp().isAfter(conflict.localTimestamp()));
            FieldChoice side = remoteNewer ? FieldChoice.REMOTE : FieldChoice.LOCAL;
            Map<String, FieldChoice> choices = new LinkedHashMap<>();
            for (String field : conflict.conflictingFields()) {
                choices.put(field, side);
            }
            return new Decision(ResolutionStrategy.MERGE, choices);
        };
    }
}
