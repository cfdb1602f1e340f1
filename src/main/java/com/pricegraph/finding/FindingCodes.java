package com.pricegraph.finding;

/**
 * Stable finding codes. The E/W/I infix reflects the default severity; a few
 * codes are raised or lowered by validation policy.
 */
public final class FindingCodes {

    private FindingCodes() {
    }

    // Tree structure
    public static final String TREE_INVALID = "PBV2_E_TREE_INVALID";
    public static final String TREE_STATUS_INVALID = "PBV2_E_TREE_STATUS_INVALID";
    public static final String TREE_NO_ROOTS = "PBV2_E_TREE_NO_ROOTS";
    public static final String TREE_ROOT_INVALID = "PBV2_E_TREE_ROOT_INVALID";
    public static final String TREE_DUPLICATE_IDS = "PBV2_E_TREE_DUPLICATE_IDS";
    public static final String TREE_KEY_COLLISION = "PBV2_E_TREE_KEY_COLLISION";
    public static final String TREE_NODE_TYPE_UNKNOWN = "PBV2_E_TREE_NODE_TYPE_UNKNOWN";

    // Inputs and compute symbols
    public static final String INPUT_TYPE_UNKNOWN = "PBV2_E_INPUT_TYPE_UNKNOWN";
    public static final String INPUT_MISSING_SELECTION_KEY = "PBV2_E_INPUT_MISSING_SELECTION_KEY";
    public static final String SELECTION_KEY_COLLISION = "PBV2_E_SELECTION_KEY_COLLISION";
    public static final String INPUT_CONSTRAINT_INVALID = "PBV2_E_INPUT_CONSTRAINT_INVALID";
    public static final String DEFAULT_OUT_OF_RANGE = "PBV2_W_DEFAULT_OUT_OF_RANGE";
    public static final String COMPUTE_OUTPUT_INVALID = "PBV2_E_COMPUTE_OUTPUT_INVALID";

    // Edges
    public static final String EDGE_MISSING_ENDPOINT = "PBV2_E_EDGE_MISSING_ENDPOINT";
    public static final String EDGE_SELF_LOOP = "PBV2_E_EDGE_SELF_LOOP";
    public static final String EDGE_INVALID_PRIORITY = "PBV2_E_EDGE_INVALID_PRIORITY";
    public static final String EDGE_STATUS_INVALID = "PBV2_E_EDGE_STATUS_INVALID";
    public static final String EDGE_CONDITION_INVALID = "PBV2_E_EDGE_CONDITION_INVALID";
    public static final String EDGE_AMBIGUOUS_MATCH = "PBV2_W_EDGE_AMBIGUOUS_MATCH";

    // Graph
    public static final String GRAPH_CYCLE = "PBV2_E_GRAPH_CYCLE";
    public static final String EXPR_COMPUTE_DEP_CYCLE = "PBV2_E_EXPR_COMPUTE_DEP_CYCLE";
    public static final String REQUIRED_INPUT_UNREACHABLE = "PBV2_E_REQUIRED_INPUT_UNREACHABLE";
    public static final String REQUIRED_INPUT_CIRCULAR_VISIBILITY = "PBV2_E_REQUIRED_INPUT_CIRCULAR_VISIBILITY";
    public static final String NODE_UNREACHABLE = "PBV2_W_NODE_UNREACHABLE";
    public static final String GROUP_NODE_IGNORED = "PBV2_I_GROUP_NODE_IGNORED";

    // Refs and expressions
    public static final String PRICEBOOK_REF_FORBIDDEN_CONTEXT = "PBV2_E_PRICEBOOK_REF_FORBIDDEN_CONTEXT";
    public static final String REF_FORBIDDEN_CONTEXT = "PBV2_E_REF_FORBIDDEN_CONTEXT";
    public static final String EXPR_REF_UNRESOLVED = "PBV2_E_EXPR_REF_UNRESOLVED";
    public static final String GROUP_NODE_REFERENCED = "PBV2_E_GROUP_NODE_REFERENCED";
    public static final String EFFECT_REF_FORBIDDEN = "PBV2_E_EFFECT_REF_FORBIDDEN";
    public static final String NODE_OUTPUT_REF_INVALID_TARGET = "PBV2_E_NODE_OUTPUT_REF_INVALID_TARGET";
    public static final String EXPR_TYPE_MISMATCH = "PBV2_E_EXPR_TYPE_MISMATCH";
    public static final String EXPR_PARSE_FAIL = "PBV2_E_EXPR_PARSE_FAIL";
    public static final String EXPR_DIV_BY_ZERO_UNGUARDED = "PBV2_E_EXPR_DIV_BY_ZERO_UNGUARDED";

    // Pricing payloads
    public static final String PRICE_COMPONENT_INVALID = "PBV2_E_PRICE_COMPONENT_INVALID";
    public static final String PRICE_REF_UNRESOLVED = "PBV2_E_PRICE_REF_UNRESOLVED";
    public static final String PRICE_NEGATIVE_QUANTITY = "PBV2_E_PRICE_NEGATIVE_QUANTITY";
    public static final String MATERIAL_EFFECT_INVALID = "PBV2_E_MATERIAL_EFFECT_INVALID";
    public static final String MATERIAL_QTY_REF_INVALID = "PBV2_E_MATERIAL_QTY_REF_INVALID";
    public static final String MATERIAL_NEGATIVE_QUANTITY = "PBV2_E_MATERIAL_NEGATIVE_QUANTITY";
    public static final String MATERIAL_EFFECT_UNREACHABLE = "PBV2_W_MATERIAL_EFFECT_UNREACHABLE";
    public static final String CHILD_ITEM_EFFECT_INVALID = "PBV2_E_CHILD_ITEM_EFFECT_INVALID";
    public static final String CHILD_ITEM_QTY_REF_INVALID = "PBV2_E_CHILD_ITEM_QTY_REF_INVALID";
    public static final String CHILD_ITEM_NEGATIVE_QUANTITY = "PBV2_E_CHILD_ITEM_NEGATIVE_QUANTITY";
    public static final String CHILD_ITEM_UNIT_PRICE_REF_INVALID = "PBV2_E_CHILD_ITEM_UNIT_PRICE_REF_INVALID";
    public static final String CHILD_ITEM_EFFECT_UNREACHABLE = "PBV2_W_CHILD_ITEM_EFFECT_UNREACHABLE";
    public static final String EFFECT_OUTPUT_INVALID = "PBV2_E_EFFECT_OUTPUT_INVALID";
    public static final String BASE_PRICE_MISSING = "PBV2_E_BASE_PRICE_MISSING";

    // Restore
    public static final String RESTORE_NOT_IN_DRAFT = "PBV2_E_RESTORE_NOT_IN_DRAFT";
    public static final String RESTORE_KEY_COLLISION = "PBV2_E_RESTORE_KEY_COLLISION";
    public static final String RESTORE_SELECTION_KEY_COLLISION = "PBV2_E_RESTORE_SELECTION_KEY_COLLISION";
    public static final String RESTORE_EDGE_TO_DELETED = "PBV2_E_RESTORE_EDGE_TO_DELETED";
    public static final String RESTORE_EMPTY_CHANGESET = "PBV2_W_RESTORE_EMPTY_CHANGESET";

    // Evaluation gate
    public static final String EVAL_TREE_NOT_ACTIVE = "PBV2_E_EVAL_TREE_NOT_ACTIVE";
    public static final String EVAL_TREE_DRAFT = "PBV2_W_EVAL_TREE_DRAFT";
}
