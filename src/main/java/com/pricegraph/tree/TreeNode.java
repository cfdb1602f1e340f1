package com.pricegraph.tree;

/**
 * A graph node. Exactly the payload matching {@link #type()} is populated;
 * the others are null.
 *
 * @param id      Node id
 * @param type    Node type, null when the declared type is unknown
 * @param rawType Declared type as written
 * @param status  Lifecycle status
 * @param key     Optional editor key, unique among live nodes
 * @param input   INPUT payload
 * @param compute COMPUTE payload
 * @param price   PRICE payload
 * @param effect  EFFECT payload
 */
public record TreeNode(
        String id,
        NodeType type,
        String rawType,
        EntityStatus status,
        String key,
        InputSpec input,
        ComputeSpec compute,
        PriceSpec price,
        EffectSpec effect
) {

    public boolean is(NodeType nodeType) {
        return type == nodeType;
    }

    public boolean isEnabled() {
        return status == EntityStatus.ENABLED;
    }

    public boolean isDeleted() {
        return status == EntityStatus.DELETED;
    }

    /**
     * ENABLED and not GROUP: the node can take part in evaluation.
     */
    public boolean isRuntime() {
        return isEnabled() && type != NodeType.GROUP;
    }

    public TreeNode withStatus(EntityStatus newStatus) {
        return new TreeNode(id, type, rawType, newStatus, key, input, compute, price, effect);
    }
}
