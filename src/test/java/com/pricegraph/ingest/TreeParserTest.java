package com.pricegraph.ingest;

import com.pricegraph.TestJson;
import com.pricegraph.exception.TreeIngestException;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.ref.ValueType;
import com.pricegraph.tree.EntityStatus;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeEdge;
import com.pricegraph.tree.TreeNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TreeParser.
 */
class TreeParserTest {

    // ========================================================================
    // Shapes
    // ========================================================================

    @Test
    @DisplayName("Should accept nodes and edges as arrays")
    void shouldParseArrays() {
        PricingTree tree = TestJson.fixture("grommet");

        assertEquals("tree-grommet-v1", tree.id());
        assertEquals("DRAFT", tree.status());
        assertEquals(List.of("grommets"), tree.rootNodeIds());
        assertEquals(4, tree.nodes().size());
        assertEquals(3, tree.edges().size());
        assertTrue(tree.ingestFindings().isEmpty());
    }

    @Test
    @DisplayName("Should accept id-keyed node and edge maps")
    void shouldParseIdKeyedMaps() {
        PricingTree tree = TestJson.tree("""
                {
                  'treeVersionId': 'tv-1',
                  'rootNodeIds': ['a'],
                  'nodes': {
                    'a': {'type': 'INPUT', 'input': {'selectionKey': 'a', 'valueType': 'BOOLEAN'}},
                    'b': {'type': 'INPUT', 'input': {'selectionKey': 'b', 'valueType': 'BOOLEAN'}}
                  },
                  'edges': {
                    'e1': {'fromNodeId': 'a', 'toNodeId': 'b'}
                  }
                }
                """);

        assertEquals("tv-1", tree.id());
        assertEquals(2, tree.nodes().size());
        assertEquals("a", tree.nodes().get(0).id());
        TreeEdge edge = tree.edges().get(0);
        assertEquals("e1", edge.id());
        assertEquals(EntityStatus.ENABLED, edge.status());
        assertEquals(0, edge.priority());
    }

    @Test
    @DisplayName("Should read legacy aliases for type, payload and input fields")
    void shouldReadLegacyAliases() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['q'],
                  'nodes': [
                    {'nodeId': 'q', 'kind': 'question', 'data': {'key': 'size', 'inputKind': 'string', 'default': 'M'}},
                    {'id': 'c', 'nodeType': 'computed', 'data': {'expr': {'op': 'literal', 'value': 1}, 'outputType': 'NUMBER'}}
                  ],
                  'edges': []
                }
                """);

        TreeNode question = tree.nodes().get(0);
        assertEquals(NodeType.INPUT, question.type());
        assertEquals("size", question.input().selectionKey());
        assertEquals(ValueType.TEXT, question.input().valueType());
        assertTrue(question.input().hasDefault());
        assertEquals("M", question.input().defaultValue());

        TreeNode compute = tree.nodes().get(1);
        assertEquals(NodeType.COMPUTE, compute.type());
        assertEquals("value", compute.compute().singleOutputKey());
        assertNotNull(compute.compute().expression());
    }

    @Test
    @DisplayName("Should map ENUM inputs to TEXT and keep their options")
    void shouldMapEnumToText() {
        PricingTree tree = TestJson.fixture("banner");

        TreeNode weight = tree.nodesById().get("weight");
        assertEquals(ValueType.TEXT, weight.input().valueType());
        assertTrue(weight.input().enumInput());
        assertEquals(2, weight.input().enumOptions().size());
    }

    // ========================================================================
    // Edge priority
    // ========================================================================

    @Test
    @DisplayName("Should keep integral priorities and null out invalid ones")
    void shouldParsePriorities() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': [],
                  'nodes': [],
                  'edges': [
                    {'id': 'absent'},
                    {'id': 'two', 'priority': 2},
                    {'id': 'twoPointZero', 'priority': 2.0},
                    {'id': 'fraction', 'priority': 1.5},
                    {'id': 'negative', 'priority': -1},
                    {'id': 'text', 'priority': '1'}
                  ]
                }
                """);

        assertEquals(0, tree.edges().get(0).priority());
        assertEquals(2, tree.edges().get(1).priority());
        assertEquals(2, tree.edges().get(2).priority());
        assertNull(tree.edges().get(3).priority());
        assertNull(tree.edges().get(4).priority());
        assertNull(tree.edges().get(5).priority());
        assertEquals(0, tree.edges().get(5).effectivePriority());
    }

    // ========================================================================
    // Findings
    // ========================================================================

    @Test
    @DisplayName("Should report malformed expressions at their exact path")
    void shouldReportMalformedExpression() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['c'],
                  'nodes': [
                    {'id': 'c', 'type': 'COMPUTE',
                     'compute': {'outputs': {'v': {'type': 'NUMBER'}},
                                 'expression': {'op': 'add', 'left': {'op': 'literal', 'value': 1}, 'right': {'op': 'nope'}}}}
                  ],
                  'edges': []
                }
                """);

        assertTrue(tree.hasIngestErrors());
        Finding finding = tree.ingestFindings().get(0);
        assertEquals(FindingCodes.EXPR_PARSE_FAIL, finding.code());
        assertEquals("tree.nodes[c].compute.expression.right", finding.path());
        assertEquals("c", finding.entityId());
        assertNull(tree.nodes().get(0).compute().expression());
    }

    @Test
    @DisplayName("Should report malformed edge conditions")
    void shouldReportMalformedCondition() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': [],
                  'nodes': [],
                  'edges': [{'id': 'e1', 'fromNodeId': 'a', 'toNodeId': 'b', 'condition': {'op': 'XOR'}}]
                }
                """);

        assertEquals(FindingCodes.EDGE_CONDITION_INVALID, tree.ingestFindings().get(0).code());
        assertEquals("tree.edges[e1].condition", tree.ingestFindings().get(0).path());
    }

    @Test
    @DisplayName("Should not report problems inside DELETED nodes")
    void shouldIgnoreDeletedNodeProblems() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': [],
                  'nodes': [
                    {'id': 'c', 'type': 'COMPUTE', 'status': 'DELETED', 'compute': {'expression': 42}}
                  ],
                  'edges': []
                }
                """);

        assertTrue(tree.ingestFindings().isEmpty());
        assertEquals(EntityStatus.DELETED, tree.nodes().get(0).status());
    }

    @Test
    @DisplayName("Should report non-object price components")
    void shouldReportNonObjectComponent() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['p'],
                  'nodes': [{'id': 'p', 'type': 'PRICE', 'price': {'components': [7]}}],
                  'edges': []
                }
                """);

        assertEquals(FindingCodes.PRICE_COMPONENT_INVALID, tree.ingestFindings().get(0).code());
        assertEquals("tree.nodes[p].price.components[0]", tree.ingestFindings().get(0).path());
    }

    @Test
    @DisplayName("Should reject a tree that is not an object")
    void shouldRejectNonObject() {
        TreeIngestException ex = assertThrows(TreeIngestException.class, () -> TreeParser.parseValue(List.of(1, 2)));

        assertEquals(1, ex.getFindings().size());
        assertEquals(FindingCodes.TREE_INVALID, ex.getFindings().get(0).code());
        assertEquals("Tree must be an object", ex.getFindings().get(0).message());
    }

    @Test
    @DisplayName("Should reject invalid JSON text")
    void shouldRejectInvalidJson() {
        assertThrows(TreeIngestException.class, () -> TreeParser.parse("{not json"));
    }

    // ========================================================================
    // Meta
    // ========================================================================

    @Test
    @DisplayName("Should parse base rates and tiers from meta.pricingV2")
    void shouldParseMeta() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': [],
                  'nodes': [],
                  'edges': [],
                  'meta': {'pricingV2': {
                    'base': {'perSqftCents': 150, 'perPieceCents': 0},
                    'qtyTiers': [{'minQty': 10, 'perPieceCents': 50}],
                    'sqftTiers': [{'minSqft': 20, 'perSqftCents': 120}]
                  }}
                }
                """);

        assertTrue(tree.meta().metaPresent());
        assertTrue(tree.meta().pricingV2Present());
        assertEquals(150, tree.meta().base().perSqftCents());
        assertEquals(0, tree.meta().base().minimumChargeCents());
        assertEquals(10, tree.meta().qtyTiers().get(0).threshold());
        assertNull(tree.meta().qtyTiers().get(0).perSqftCents());
        assertEquals(120, tree.meta().sqftTiers().get(0).perSqftCents());
    }
}
