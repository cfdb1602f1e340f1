package com.pricegraph.validator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CycleDetector.
 */
class CycleDetectorTest {

    @Test
    @DisplayName("Should return empty for an acyclic graph")
    void shouldReturnEmptyForDag() {
        Optional<List<String>> cycle = CycleDetector.findCycle(List.of("a", "b", "c"),
                Map.of("a", List.of("b", "c"), "b", List.of("c")));

        assertTrue(cycle.isEmpty());
    }

    @Test
    @DisplayName("Should report the cycle path closed on its first node")
    void shouldReportCyclePath() {
        Optional<List<String>> cycle = CycleDetector.findCycle(List.of("c", "b", "a"),
                Map.of("a", List.of("b"), "b", List.of("c"), "c", List.of("a")));

        assertEquals(List.of("a", "b", "c", "a"), cycle.orElseThrow());
    }

    @Test
    @DisplayName("Should report self edges")
    void shouldReportSelfEdge() {
        Optional<List<String>> cycle = CycleDetector.findCycle(List.of("a"), Map.of("a", List.of("a")));

        assertEquals(List.of("a", "a"), cycle.orElseThrow());
    }

    @Test
    @DisplayName("Should pick the lexicographically first cycle")
    void shouldBeDeterministic() {
        Map<String, List<String>> edges = Map.of(
                "start", List.of("y", "x"),
                "x", List.of("start"),
                "y", List.of("start"));

        assertEquals(List.of("start", "x", "start"),
                CycleDetector.findCycle(List.of("y", "start", "x"), edges).orElseThrow());
    }

    @Test
    @DisplayName("Should walk long chains without exhausting the thread stack")
    void shouldHandleLongChains() {
        int length = 20_000;
        List<String> ids = new ArrayList<>();
        Map<String, List<String>> edges = new HashMap<>();
        for (int i = 0; i < length; i++) {
            ids.add(String.format("n%05d", i));
        }
        for (int i = 0; i + 1 < length; i++) {
            edges.put(ids.get(i), List.of(ids.get(i + 1)));
        }

        assertTrue(CycleDetector.findCycle(ids, edges).isEmpty());

        edges.put(ids.get(length - 1), List.of(ids.get(0)));
        List<String> cycle = CycleDetector.findCycle(ids, edges).orElseThrow();

        assertEquals(length + 1, cycle.size());
        assertEquals("n00000", cycle.get(0));
        assertEquals("n19999", cycle.get(length - 1));
        assertEquals("n00000", cycle.get(length));
    }
}
