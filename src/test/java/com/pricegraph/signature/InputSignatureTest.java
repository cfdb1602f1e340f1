package com.pricegraph.signature;

import com.pricegraph.exception.CanonicalizationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputSignature.
 */
class InputSignatureTest {

    @Test
    @DisplayName("Should hash with SHA-256 hex")
    void shouldHashSha256() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                InputSignature.sha256Hex("abc"));
    }

    @Test
    @DisplayName("Should not depend on key order")
    void shouldIgnoreKeyOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("size", "L");
        first.put("qty", 5);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("qty", 5.0);
        second.put("size", "L");

        String a = InputSignature.compute("tv1", first, Map.of("widthIn", 24));
        String b = InputSignature.compute("tv1", second, Map.of("widthIn", 24.0));

        assertEquals(a, b);
        assertEquals(64, a.length());
    }

    @Test
    @DisplayName("Should change when any input changes")
    void shouldDetectChanges() {
        String base = InputSignature.compute("tv1", Map.of("size", "L"), Map.of("widthIn", 24));

        assertNotEquals(base, InputSignature.compute("tv2", Map.of("size", "L"), Map.of("widthIn", 24)));
        assertNotEquals(base, InputSignature.compute("tv1", Map.of("size", "M"), Map.of("widthIn", 24)));
        assertNotEquals(base, InputSignature.compute("tv1", Map.of("size", "L"), Map.of("widthIn", 36)));
    }

    @Test
    @DisplayName("Should treat a null tree version as empty")
    void shouldTreatNullVersionAsEmpty() {
        assertEquals(InputSignature.compute("", Map.of(), Map.of()), InputSignature.compute(null, Map.of(), Map.of()));
    }

    @Test
    @DisplayName("Should reject non-finite selections")
    void shouldRejectNonFinite() {
        assertThrows(CanonicalizationException.class,
                () -> InputSignature.compute("tv1", Map.of("qty", Double.NaN), Map.of()));
    }

    @Test
    @DisplayName("Should keep only non-derived JSON-safe env extras")
    void shouldPickEnvExtras() {
        Map<String, Object> env = new HashMap<>();
        env.put("widthIn", 24);
        env.put("quantity", 5);
        env.put("shipZone", "EU");
        env.put("rush", true);
        env.put("factor", 1.5);
        env.put("bad", Double.NaN);
        env.put("handle", new Object());
        env.put("missing", null);

        Map<String, Object> extras = InputSignature.pickEnvExtras(env);

        assertEquals(4, extras.size());
        assertEquals("EU", extras.get("shipZone"));
        assertEquals(true, extras.get("rush"));
        assertEquals(1.5, extras.get("factor"));
        assertTrue(extras.containsKey("missing"));
        assertTrue(InputSignature.pickEnvExtras(null).isEmpty());
    }
}
