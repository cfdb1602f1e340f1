package com.pricegraph.engine;

import com.pricegraph.evaluator.ChildItemProposal;
import com.pricegraph.evaluator.MaterialLine;
import com.pricegraph.evaluator.PricingOptions;
import com.pricegraph.evaluator.PricingResult;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.validator.ValidationMode;

import java.util.List;
import java.util.Map;

/**
 * Entry point for validating and evaluating pricing trees.
 * <p>
 * Selections may be passed directly or wrapped as {@code {explicitSelections: {...}}}.
 * Implementations are stateless and safe to share between threads.
 */
public interface PriceGraphEngine {

    /**
     * Ingest a raw tree (JSON text, Jackson node or decoded map).
     *
     * @throws com.pricegraph.exception.TreeIngestException if the value is not a tree object
     */
    PricingTree ingest(Object rawTree);

    /**
     * Validate an ingested tree.
     */
    ValidationResult validate(PricingTree tree, ValidationMode mode);

    /**
     * Ingest and validate a raw tree. A value that is not a tree object yields
     * a failed result instead of an exception.
     */
    ValidationResult validate(Object rawTree, ValidationMode mode);

    /**
     * Price a tree for the given selections and environment.
     */
    PricingResult price(PricingTree tree, Map<String, ?> selections, Map<String, ?> env, PricingOptions options);

    List<MaterialLine> materials(PricingTree tree, Map<String, ?> selections, Map<String, ?> env,
                                 PricingOptions options);

    List<ChildItemProposal> childItemProposals(PricingTree tree, Map<String, ?> selections, Map<String, ?> env,
                                               PricingOptions options);

    /**
     * Input signature of a pricing call, used to detect stale stored prices.
     */
    String signature(String treeVersionId, Map<String, ?> selections, Map<String, ?> env);
}
