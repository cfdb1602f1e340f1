package com.pricegraph.ref;

/**
 * Exhaustive visitor over {@link Ref} variants.
 */
public interface RefVisitor<R> {

    R visitConstant(Ref.Constant ref);

    R visitSelection(Ref.Selection ref);

    R visitEffective(Ref.Effective ref);

    R visitNodeOutput(Ref.NodeOutput ref);

    R visitEnv(Ref.Env ref);

    R visitPricebook(Ref.Pricebook ref);

    R visitOptionValueParam(Ref.OptionValueParam ref);

    R visitOptionValueParamJson(Ref.OptionValueParamJson ref);
}
