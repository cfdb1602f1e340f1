package com.pricegraph.validator;

import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.ingest.JsonValues;
import com.pricegraph.tree.PricingTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree status gate before an evaluation. Persisted results need an ACTIVE
 * tree; previews may run against a DRAFT with a warning.
 */
public class EvalGateValidator implements TreeValidator {

    private final EvalPurpose purpose;

    public EvalGateValidator(EvalPurpose purpose) {
        this.purpose = purpose;
    }

    @Override
    public ValidationResult validate(PricingTree tree) {
        String status = JsonValues.upper(tree.status());
        List<Finding> findings = new ArrayList<>();
        if (purpose == EvalPurpose.PERSIST && !"ACTIVE".equals(status)) {
            findings.add(Finding.error(FindingCodes.EVAL_TREE_NOT_ACTIVE,
                    "Evaluation results can only be persisted against an ACTIVE tree", "tree.status", null,
                    Finding.context("status", tree.status(), "purpose", purpose.name())));
        } else if (purpose == EvalPurpose.PREVIEW && "DRAFT".equals(status)) {
            findings.add(Finding.warning(FindingCodes.EVAL_TREE_DRAFT,
                    "Previewing against a DRAFT tree", "tree.status", null,
                    Finding.context("status", tree.status(), "purpose", purpose.name())));
        }
        return ValidationResult.of(findings);
    }
}
