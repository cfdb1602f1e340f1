package com.pricegraph.validator;

import java.util.Set;

/**
 * Nodes and edges being brought back from DELETED. Restored entities are
 * validated as if they were ENABLED.
 *
 * @param restoredNodeIds Node ids to restore
 * @param restoredEdgeIds Edge ids to restore
 */
public record RestoreChangeSet(Set<String> restoredNodeIds, Set<String> restoredEdgeIds) {

    public RestoreChangeSet {
        restoredNodeIds = restoredNodeIds == null ? Set.of() : Set.copyOf(restoredNodeIds);
        restoredEdgeIds = restoredEdgeIds == null ? Set.of() : Set.copyOf(restoredEdgeIds);
    }

    public static RestoreChangeSet of(Set<String> nodeIds, Set<String> edgeIds) {
        return new RestoreChangeSet(nodeIds, edgeIds);
    }

    public boolean isEmpty() {
        return restoredNodeIds.isEmpty() && restoredEdgeIds.isEmpty();
    }
}
