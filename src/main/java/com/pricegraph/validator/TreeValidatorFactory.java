package com.pricegraph.validator;

import com.pricegraph.ref.EnvKeys;

/**
 * Factory for the validator matching a {@link ValidationMode}.
 */
public final class TreeValidatorFactory {

    private TreeValidatorFactory() {
    }

    public static TreeValidator create(ValidationMode mode, ValidationPolicy policy, EnvKeys envKeys) {
        if (mode instanceof ValidationMode.Publish) {
            return new PublishValidator(policy, envKeys);
        }
        if (mode instanceof ValidationMode.Draft) {
            return new DraftValidator(policy, envKeys);
        }
        if (mode instanceof ValidationMode.Restore restore) {
            return new RestoreValidator(restore.changeSet(), policy, envKeys);
        }
        if (mode instanceof ValidationMode.EvalGate gate) {
            return new EvalGateValidator(gate.purpose());
        }
        if (mode instanceof ValidationMode.BasePrice) {
            return new BasePriceValidator();
        }
        throw new IllegalArgumentException("Unsupported validation mode: " + mode);
    }
}
