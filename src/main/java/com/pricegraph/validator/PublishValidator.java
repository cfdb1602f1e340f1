package com.pricegraph.validator;

import com.pricegraph.finding.Finding;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.tree.PricingTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Full readiness check run before a DRAFT tree is published.
 */
public class PublishValidator implements TreeValidator {

    private static final Logger log = LoggerFactory.getLogger(PublishValidator.class);

    private final ValidationPolicy policy;
    private final EnvKeys envKeys;

    public PublishValidator(ValidationPolicy policy, EnvKeys envKeys) {
        this.policy = policy;
        this.envKeys = envKeys;
    }

    @Override
    public ValidationResult validate(PricingTree tree) {
        PublishChecks.Report report = new PublishChecks(tree, policy, envKeys).run();
        List<Finding> findings = new ArrayList<>(report.structural());
        findings.addAll(report.publishOnly());

        ValidationResult result = ValidationResult.of(findings);
        log.debug("Publish validation of tree {}: ok={}, {} error(s), {} warning(s)",
                tree.id(), result.ok(), result.errors().size(), result.warnings().size());
        return result;
    }
}
