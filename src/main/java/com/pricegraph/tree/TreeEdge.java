package com.pricegraph.tree;

import com.pricegraph.expression.ConditionRule;

/**
 * Directed, optionally conditional edge.
 *
 * @param id           Edge id
 * @param status       Lifecycle status
 * @param fromNodeId   Source node id, null when missing
 * @param toNodeId     Target node id, null when missing
 * @param priority     Non-negative integer priority, null when the declared value is invalid
 * @param rawPriority  Priority as written, for diagnostics
 * @param condition    Guard, null means unconditional
 */
public record TreeEdge(
        String id,
        EntityStatus status,
        String fromNodeId,
        String toNodeId,
        Integer priority,
        Object rawPriority,
        ConditionRule condition
) {

    public boolean isEnabled() {
        return status == EntityStatus.ENABLED;
    }

    /**
     * Priority used by traversal; invalid priorities sort as 0.
     */
    public int effectivePriority() {
        return priority != null ? priority : 0;
    }

    public TreeEdge withStatus(EntityStatus newStatus) {
        return new TreeEdge(id, newStatus, fromNodeId, toNodeId, priority, rawPriority, condition);
    }
}
