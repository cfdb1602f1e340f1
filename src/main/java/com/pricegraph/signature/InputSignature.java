package com.pricegraph.signature;

import com.pricegraph.exception.CanonicalizationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Staleness fingerprint of a pricing call's inputs. Not a security boundary.
 */
public final class InputSignature {

    /** Env keys derived from line item fields; excluded from the stored extras. */
    public static final Set<String> DERIVED_ENV_KEYS =
            Set.of("widthIn", "heightIn", "qty", "quantity", "sqft", "perimeterIn");

    private InputSignature() {
    }

    /**
     * SHA-256 hex digest of the canonical {@code {treeVersionId, explicitSelections, env}}.
     *
     * @throws CanonicalizationException if selections or env are not plain finite JSON
     */
    public static String compute(String treeVersionId, Object explicitSelections, Object env) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("treeVersionId", treeVersionId == null ? "" : treeVersionId);
        payload.put("explicitSelections", explicitSelections);
        payload.put("env", env);
        return sha256Hex(Canonicalizer.canonicalize(payload));
    }

    /**
     * Keep the env entries that are not derived dimensions and are JSON-safe.
     */
    public static Map<String, Object> pickEnvExtras(Map<String, ?> env) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (env == null) {
            return out;
        }
        for (Map.Entry<String, ?> entry : env.entrySet()) {
            if (DERIVED_ENV_KEYS.contains(entry.getKey())) {
                continue;
            }
            Object v = entry.getValue();
            if (v == null || v instanceof Boolean || v instanceof String
                    || v instanceof List<?> || v instanceof Map<?, ?>) {
                out.put(entry.getKey(), v);
            } else if (v instanceof Number n && Double.isFinite(n.doubleValue())) {
                out.put(entry.getKey(), v);
            }
        }
        return out;
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
