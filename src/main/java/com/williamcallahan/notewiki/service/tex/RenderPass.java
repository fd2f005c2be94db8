package com.williamcallahan.notewiki.service.tex;

import java.util.Objects;

/**
 * One named step of the rendering pipeline.
 *
 * @param name short name used in logs
 * @param step rewrites the text, recording any side results into the context
 */
public record RenderPass(String name, Step step) {

    /**
     * Text rewrite performed by a pass.
     */
    @FunctionalInterface
    public interface Step {
        String apply(String text, ConversionContext context);
    }

    public RenderPass {
        Objects.requireNonNull(name, "Pass name cannot be null");
        Objects.requireNonNull(step, "Pass step cannot be null");
    }

    public String apply(String text, ConversionContext context) {
        return step.apply(text, context);
    }
}
