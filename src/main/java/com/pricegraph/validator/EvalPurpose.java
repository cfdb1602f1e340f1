package com.pricegraph.validator;

/**
 * Why an evaluation is being run.
 */
public enum EvalPurpose {
    /** Interactive preview; draft trees are allowed with a warning. */
    PREVIEW,
    /** Result will be stored on a quote or order; the tree must be ACTIVE. */
    PERSIST
}
