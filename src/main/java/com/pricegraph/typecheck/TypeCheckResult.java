package com.pricegraph.typecheck;

import com.pricegraph.finding.Finding;
import com.pricegraph.ref.InferredType;

import java.util.List;

/**
 * Inferred type of a checked expression plus the findings produced along the way.
 * Conditions always infer non-null BOOLEAN.
 */
public record TypeCheckResult(InferredType inferred, List<Finding> findings) {

    public TypeCheckResult {
        findings = List.copyOf(findings);
    }

    public boolean hasErrors() {
        return findings.stream().anyMatch(Finding::isError);
    }
}
