package com.pricegraph.evaluator;

import com.pricegraph.ingest.JsonValues;
import com.pricegraph.tree.InputSpec;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single evaluation: caller inputs, declared defaults and
 * the COMPUTE outputs produced so far. Not thread-safe; one instance per call.
 */
public class EvaluationContext {

    private final Map<String, Object> selections;
    private final Map<String, Object> defaults;
    private final Map<String, List<Object>> enumOptions;
    private final Map<String, Map<String, Object>> computeOutputs = new HashMap<>();
    private final Map<String, Object> env;
    private final Map<String, Object> pricebook;

    EvaluationContext(Map<String, Object> selections, Map<String, Object> defaults,
                      Map<String, List<Object>> enumOptions, Map<String, Object> env,
                      Map<String, Object> pricebook) {
        this.selections = selections;
        this.defaults = defaults;
        this.enumOptions = enumOptions;
        this.env = env;
        this.pricebook = pricebook;
    }

    /**
     * Build a context for a tree. Defaults and ENUM options come from ENABLED
     * INPUT nodes. Caller maps are normalized to plain JSON values.
     *
     * @param selections explicit selections, either flat or wrapped as {@code {explicitSelections: {...}}}
     * @param env        environment values (widthIn, quantity, ...), may be null
     * @param pricebook  pricebook values, may be null
     */
    public static EvaluationContext create(PricingTree tree, Map<String, ?> selections, Map<String, ?> env,
                                           Map<String, ?> pricebook) {
        Map<String, Object> defaults = new HashMap<>();
        Map<String, List<Object>> enumOptions = new HashMap<>();
        for (TreeNode node : tree.nodes()) {
            if (!node.isEnabled() || !node.is(NodeType.INPUT) || node.input() == null) {
                continue;
            }
            InputSpec input = node.input();
            if (input.selectionKey() == null) {
                continue;
            }
            if (input.hasDefault()) {
                defaults.put(input.selectionKey(), input.defaultValue());
            }
            if (input.enumInput() && input.enumOptions() != null) {
                enumOptions.put(input.selectionKey(), input.enumOptions());
            }
        }

        Map<String, Object> pricebookValues = pricebook == null ? null : normalizedMap(pricebook);
        return new EvaluationContext(explicitSelections(selections), defaults, enumOptions,
                normalizedMap(env), pricebookValues);
    }

    /**
     * Unwrap {@code {explicitSelections: {...}}} when present.
     */
    public static Map<String, Object> explicitSelections(Map<String, ?> selections) {
        if (selections == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> wrapped = JsonValues.asMap(JsonValues.normalize(selections.get("explicitSelections")));
        if (wrapped != null) {
            return wrapped;
        }
        return normalizedMap(selections);
    }

    private static Map<String, Object> normalizedMap(Map<String, ?> raw) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> map = JsonValues.asMap(JsonValues.normalize(raw));
        return map != null ? map : new LinkedHashMap<>();
    }

    public boolean hasSelection(String selectionKey) {
        return selections.containsKey(selectionKey);
    }

    public Object selection(String selectionKey) {
        return selections.get(selectionKey);
    }

    /**
     * Explicit selection, falling back to the declared default, else null.
     */
    public Object effective(String selectionKey) {
        if (selections.containsKey(selectionKey)) {
            return selections.get(selectionKey);
        }
        return defaults.get(selectionKey);
    }

    public List<Object> enumOptions(String selectionKey) {
        return enumOptions.get(selectionKey);
    }

    public Object computeOutput(String nodeId, String outputKey) {
        Map<String, Object> outputs = computeOutputs.get(nodeId);
        return outputs == null ? null : outputs.get(outputKey);
    }

    void putComputeOutput(String nodeId, String outputKey, Object value) {
        Map<String, Object> outputs = new HashMap<>();
        outputs.put(outputKey, value);
        computeOutputs.put(nodeId, outputs);
    }

    public Object env(String envKey) {
        return env.get(envKey);
    }

    public Map<String, Object> env() {
        return Collections.unmodifiableMap(env);
    }

    /**
     * Pricebook value, or null when there is no pricebook or no such key.
     */
    public Object pricebook(String key) {
        return pricebook == null ? null : pricebook.get(key);
    }

    public Map<String, Object> selections() {
        return Collections.unmodifiableMap(selections);
    }
}
