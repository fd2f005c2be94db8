package com.williamcallahan.notewiki.domain.render;

import java.util.Objects;

/**
 * One macro for the browser-side math renderer.
 *
 * @param name macro name without the leading backslash
 * @param arity number of positional parameters ({@code #1}..{@code #9}) in the body
 * @param body TeX expansion
 */
public record MacroEntry(String name, int arity, String body) {

    public MacroEntry {
        Objects.requireNonNull(name, "Macro name cannot be null");
        Objects.requireNonNull(body, "Macro body cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Macro name cannot be blank");
        }
        if (arity < 0 || arity > 9) {
            throw new IllegalArgumentException("Macro arity must be 0..9: " + arity);
        }
    }
}
