package com.pricegraph.ref;

/**
 * Reference kinds with their wire names.
 */
public enum RefKind {
    CONSTANT("constant"),
    SELECTION("selectionRef"),
    EFFECTIVE("effectiveRef"),
    NODE_OUTPUT("nodeOutputRef"),
    ENV("envRef"),
    PRICEBOOK("pricebookRef"),
    OPTION_VALUE_PARAM("optionValueParamRef"),
    OPTION_VALUE_PARAM_JSON("optionValueParamJsonRef");

    private final String wireName;

    RefKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the kind for a wire name, or null when unknown
     */
    public static RefKind fromWire(String name) {
        if (name == null) {
            return null;
        }
        for (RefKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
