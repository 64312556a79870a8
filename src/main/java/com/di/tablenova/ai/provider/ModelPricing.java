package com.di.tablenova.ai.provider;

import com.di.tablenova.ai.config.AiProperties;

/** Token-based USD pricing. */
public final class ModelPricing {

    private final double inputPer1kTokens;
    private final double outputPer1kTokens;

    public ModelPricing(double inputPer1kTokens, double outputPer1kTokens) {
        this.inputPer1kTokens = inputPer1kTokens;
        this.outputPer1kTokens = outputPer1kTokens;
    }

    public static ModelPricing from(AiProperties.PricingConfig pricing) {
        return new ModelPricing(pricing.getInputPer1kTokens(), pricing.getOutputPer1kTokens());
    }

    public double cost(TokenUsage usage) {
        return usage.getInputTokens() / 1000.0 * inputPer1kTokens
                + usage.getOutputTokens() / 1000.0 * outputPer1kTokens;
    }
}
