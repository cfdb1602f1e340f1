package com.pricegraph.validator;

import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.tree.BaseRates;
import com.pricegraph.tree.PricingMeta;
import com.pricegraph.tree.PricingTree;

import java.util.List;

/**
 * Activation readiness: {@code meta.pricingV2.base} must carry at least one
 * non-zero rate.
 */
public class BasePriceValidator implements TreeValidator {

    private static final String SET_ONE_OF =
            " must be configured before activation. Set at least one of: perSqftCents, perPieceCents, or minimumChargeCents.";

    @Override
    public ValidationResult validate(PricingTree tree) {
        PricingMeta meta = tree.meta();
        if (meta == null || !meta.metaPresent()) {
            return missing("Tree metadata is missing. Cannot validate base pricing.", "tree.meta");
        }
        if (!meta.pricingV2Present()) {
            return missing("Base pricing (meta.pricingV2)" + SET_ONE_OF, "tree.meta.pricingV2");
        }
        BaseRates base = meta.base();
        if (base == null) {
            return missing("Base pricing (meta.pricingV2.base)" + SET_ONE_OF, "tree.meta.pricingV2.base");
        }
        if (base.allZero()) {
            return ValidationResult.of(List.of(Finding.error(FindingCodes.BASE_PRICE_MISSING,
                    "Base pricing requires at least one non-zero value: perSqftCents, perPieceCents, or minimumChargeCents.",
                    "tree.meta.pricingV2.base", null,
                    Finding.context("perSqftCents", base.perSqftCents(), "perPieceCents", base.perPieceCents(),
                            "minimumChargeCents", base.minimumChargeCents()))));
        }
        return ValidationResult.of(List.of());
    }

    private static ValidationResult missing(String message, String path) {
        return ValidationResult.of(List.of(Finding.error(FindingCodes.BASE_PRICE_MISSING, message, path)));
    }
}
