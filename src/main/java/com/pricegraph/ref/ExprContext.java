package com.pricegraph.ref;

/**
 * Evaluation context an expression is checked in. Ref legality depends on it.
 */
public enum ExprContext {
    INPUT,
    COMPUTE,
    PRICE,
    CONDITION,
    EFFECT
}
