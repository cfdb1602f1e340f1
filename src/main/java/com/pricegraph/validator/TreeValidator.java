package com.pricegraph.validator;

import com.pricegraph.finding.ValidationResult;
import com.pricegraph.tree.PricingTree;

/**
 * Validates a tree for one lifecycle transition.
 * Implementations are stateless and safe to share.
 */
public interface TreeValidator {

    /**
     * @param tree Ingested tree
     * @return sorted findings; {@code ok} is false when any finding is an ERROR
     */
    ValidationResult validate(PricingTree tree);
}
