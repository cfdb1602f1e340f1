package com.pricegraph.symbol;

import com.pricegraph.finding.Finding;

import java.util.List;

/**
 * Symbol table plus the findings raised while building it.
 */
public record SymbolTableResult(SymbolTable table, List<Finding> findings) {
}
