package com.pricegraph.exception;

import com.pricegraph.finding.Finding;

import java.util.List;

/**
 * Exception thrown when a tree snapshot cannot be ingested, or when a tree
 * carrying ingest errors is handed to the evaluator.
 */
public class TreeIngestException extends PriceGraphException {

    private final List<Finding> findings;

    public TreeIngestException(String message) {
        super(message);
        this.findings = List.of();
    }

    public TreeIngestException(String message, Throwable cause) {
        super(message, cause);
        this.findings = List.of();
    }

    public TreeIngestException(String message, List<Finding> findings) {
        super(message);
        this.findings = List.copyOf(findings);
    }

    public List<Finding> getFindings() {
        return findings;
    }
}
