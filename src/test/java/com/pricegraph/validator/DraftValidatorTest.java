package com.pricegraph.validator;

import com.pricegraph.TestJson;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.ref.EnvKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DraftValidator.
 */
class DraftValidatorTest {

    private TreeValidator validator;

    @BeforeEach
    void setUp() {
        validator = TreeValidatorFactory.create(ValidationMode.draft(), ValidationPolicy.defaults(),
                EnvKeys.defaults());
    }

    @Test
    @DisplayName("Should downgrade publish readiness errors to warnings")
    void shouldDowngradeReadinessErrors() {
        ValidationResult result = validator.validate(TestJson.tree("""
                {'status': 'DRAFT', 'rootNodeIds': [],
                 'nodes': [{'id': 'p', 'type': 'PRICE', 'price': {'components': [{'kind': 'FLAT'}]}}],
                 'edges': []}
                """));

        assertTrue(result.ok());
        assertTrue(result.hasWarning(FindingCodes.TREE_NO_ROOTS));
        assertTrue(result.hasWarning(FindingCodes.PRICE_COMPONENT_INVALID));
    }

    @Test
    @DisplayName("Should keep type errors as errors")
    void shouldKeepTypeErrors() {
        ValidationResult result = validator.validate(TestJson.tree("""
                {'status': 'DRAFT', 'rootNodeIds': ['c'],
                 'nodes': [{'id': 'c', 'type': 'COMPUTE', 'compute': {
                   'expression': {'op': 'add',
                     'left': {'op': 'literal', 'value': 'one'}, 'right': {'op': 'literal', 'value': 1}},
                   'outputs': {'v': {'type': 'NUMBER'}}}}],
                 'edges': []}
                """));

        assertFalse(result.ok());
        assertTrue(result.hasError(FindingCodes.EXPR_TYPE_MISMATCH));
        assertEquals("tree.nodes[c].compute.expression.left", result.errors().get(0).path());
    }

    @Test
    @DisplayName("Should keep ingest errors as errors")
    void shouldKeepIngestErrors() {
        ValidationResult result = validator.validate(TestJson.tree("""
                {'status': 'DRAFT', 'rootNodeIds': ['c'],
                 'nodes': [{'id': 'c', 'type': 'COMPUTE', 'compute': {
                   'expression': {'op': 'pow'}, 'outputs': {'v': {'type': 'NUMBER'}}}}],
                 'edges': []}
                """));

        assertTrue(result.hasError(FindingCodes.EXPR_PARSE_FAIL));
        assertEquals(1, result.errors().size());
    }

    @Test
    @DisplayName("Should accept an empty draft")
    void shouldAcceptEmptyDraft() {
        ValidationResult result = validator.validate(TestJson.tree("{'status': 'DRAFT', 'nodes': [], 'edges': []}"));

        assertTrue(result.ok());
    }
}
