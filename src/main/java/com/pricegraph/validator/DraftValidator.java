package com.pricegraph.validator;

import com.pricegraph.finding.Finding;
import com.pricegraph.finding.Severity;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.tree.PricingTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Loose check for saving work in progress.
 * <p>
 * Structural problems and type errors stay ERRORs. Publish readiness rules
 * (roots, status, collisions, cycles, reachability, payload shape) are
 * reported as WARNINGs so an incomplete draft can still be saved.
 */
public class DraftValidator implements TreeValidator {

    private static final Logger log = LoggerFactory.getLogger(DraftValidator.class);

    private final ValidationPolicy policy;
    private final EnvKeys envKeys;

    public DraftValidator(ValidationPolicy policy, EnvKeys envKeys) {
        this.policy = policy;
        this.envKeys = envKeys;
    }

    @Override
    public ValidationResult validate(PricingTree tree) {
        PublishChecks.Report report = new PublishChecks(tree, policy, envKeys).run();
        List<Finding> findings = new ArrayList<>(report.structural());
        for (Finding finding : report.publishOnly()) {
            findings.add(finding.isError() ? finding.withSeverity(Severity.WARNING) : finding);
        }

        ValidationResult result = ValidationResult.of(findings);
        log.debug("Draft validation of tree {}: ok={}, {} error(s), {} warning(s)",
                tree.id(), result.ok(), result.errors().size(), result.warnings().size());
        return result;
    }
}
