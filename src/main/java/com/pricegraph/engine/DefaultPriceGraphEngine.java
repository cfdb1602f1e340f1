package com.pricegraph.engine;

import com.pricegraph.config.EngineSettings;
import com.pricegraph.evaluator.ChildItemProposal;
import com.pricegraph.evaluator.EvaluationContext;
import com.pricegraph.evaluator.MaterialLine;
import com.pricegraph.evaluator.PricingEngine;
import com.pricegraph.evaluator.PricingOptions;
import com.pricegraph.evaluator.PricingResult;
import com.pricegraph.exception.TreeIngestException;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.ingest.TreeParser;
import com.pricegraph.signature.InputSignature;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.validator.TreeValidatorFactory;
import com.pricegraph.validator.ValidationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default engine: ingest, validators and evaluator wired from {@link EngineSettings}.
 */
public class DefaultPriceGraphEngine implements PriceGraphEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPriceGraphEngine.class);

    private final EngineSettings settings;
    private final PricingEngine pricingEngine;

    public DefaultPriceGraphEngine(EngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.pricingEngine = new PricingEngine(settings.envKeys());
        log.info("Created PriceGraphEngine '{}' with env keys {}", settings.name(), settings.envKeys().keys());
    }

    @Override
    public PricingTree ingest(Object rawTree) {
        return TreeParser.parseValue(rawTree);
    }

    @Override
    public ValidationResult validate(PricingTree tree, ValidationMode mode) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(mode, "mode");
        ValidationResult result = TreeValidatorFactory
                .create(mode, settings.validationPolicy(), settings.envKeys())
                .validate(tree);
        log.debug("Validated tree {} in {} mode: ok={}, {} error(s), {} warning(s)",
                tree.id(), mode, result.ok(), result.errors().size(), result.warnings().size());
        return result;
    }

    @Override
    public ValidationResult validate(Object rawTree, ValidationMode mode) {
        if (rawTree instanceof PricingTree tree) {
            return validate(tree, mode);
        }
        PricingTree tree;
        try {
            tree = ingest(rawTree);
        } catch (TreeIngestException e) {
            log.debug("Tree rejected at ingest: {}", e.getMessage());
            if (e.getFindings().isEmpty()) {
                return ValidationResult.of(List.of(
                        Finding.error(FindingCodes.TREE_INVALID, e.getMessage(), "tree")));
            }
            return ValidationResult.of(e.getFindings());
        }
        return validate(tree, mode);
    }

    @Override
    public PricingResult price(PricingTree tree, Map<String, ?> selections, Map<String, ?> env,
                               PricingOptions options) {
        return pricingEngine.price(tree, selections, env, options);
    }

    @Override
    public List<MaterialLine> materials(PricingTree tree, Map<String, ?> selections, Map<String, ?> env,
                                        PricingOptions options) {
        return pricingEngine.materials(tree, selections, env, options);
    }

    @Override
    public List<ChildItemProposal> childItemProposals(PricingTree tree, Map<String, ?> selections,
                                                      Map<String, ?> env, PricingOptions options) {
        return pricingEngine.childItemProposals(tree, selections, env, options);
    }

    @Override
    public String signature(String treeVersionId, Map<String, ?> selections, Map<String, ?> env) {
        return InputSignature.compute(treeVersionId, EvaluationContext.explicitSelections(selections),
                env == null ? Map.of() : env);
    }

    public EngineSettings getSettings() {
        return settings;
    }
}
