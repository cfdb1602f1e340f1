package com.pricegraph.validator;

import java.util.Objects;

/**
 * Lifecycle transition a tree is being validated for.
 */
public sealed interface ValidationMode {

    /** Loose checks so work in progress can be saved. */
    record Draft() implements ValidationMode {
    }

    /** Full checks before a DRAFT tree is published. */
    record Publish() implements ValidationMode {
    }

    /** Checks for bringing DELETED nodes or edges back. */
    record Restore(RestoreChangeSet changeSet) implements ValidationMode {
        public Restore {
            Objects.requireNonNull(changeSet, "changeSet");
        }
    }

    /** Tree status gate before evaluation. */
    record EvalGate(EvalPurpose purpose) implements ValidationMode {
        public EvalGate {
            Objects.requireNonNull(purpose, "purpose");
        }
    }

    /** Base pricing must be configured before activation. */
    record BasePrice() implements ValidationMode {
    }

    static ValidationMode draft() {
        return new Draft();
    }

    static ValidationMode publish() {
        return new Publish();
    }

    static ValidationMode restore(RestoreChangeSet changeSet) {
        return new Restore(changeSet);
    }

    static ValidationMode evalGate(EvalPurpose purpose) {
        return new EvalGate(purpose);
    }

    static ValidationMode basePrice() {
        return new BasePrice();
    }
}
