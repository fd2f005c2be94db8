package com.williamcallahan.notewiki.service.tex;

import java.util.Objects;

/**
 * A known command or environment and the renderer that replaces it.
 *
 * @param name command or environment name, e.g. {@code textbf} or {@code theorem}; starred
 *             variants are separate entries named {@code section*}
 * @param kind command or environment
 * @param requiredArgs number of mandatory {@code {...}} groups (0 to 2)
 * @param optionalArgs number of leading optional {@code [...]} groups (0 or 1)
 * @param trailingOptional whether a {@code [...]} group may follow the mandatory groups
 * @param recursiveBody whether an environment body is dispatched before rendering; false for raw
 *                      bodies such as diagram source
 * @param renderer produces the replacement text
 */
public record DispatchEntry(
    String name,
    DispatchKind kind,
    int requiredArgs,
    int optionalArgs,
    boolean trailingOptional,
    boolean recursiveBody,
    Renderer renderer
) {

    /**
     * Produces the replacement for one invocation.
     */
    @FunctionalInterface
    public interface Renderer {
        /**
         * @param invocation parsed arguments and body
         * @param dispatcher the dispatcher running this entry, for rendering nested markup
         * @return replacement text emitted in place of the invocation
         */
        String render(Invocation invocation, CommandDispatcher dispatcher);
    }

    public DispatchEntry {
        Objects.requireNonNull(name, "Entry name cannot be null");
        Objects.requireNonNull(kind, "Entry kind cannot be null");
        Objects.requireNonNull(renderer, "Entry renderer cannot be null");
        if (requiredArgs < 0 || requiredArgs > 2) {
            throw new IllegalArgumentException("Required argument count must be 0..2: " + requiredArgs);
        }
        if (optionalArgs < 0 || optionalArgs > 1) {
            throw new IllegalArgumentException("Optional argument count must be 0..1: " + optionalArgs);
        }
    }

    /**
     * A command with {@code requiredArgs} brace groups and an optional leading bracket group.
     */
    public static DispatchEntry command(String name, int requiredArgs, int optionalArgs, Renderer renderer) {
        return new DispatchEntry(name, DispatchKind.COMMAND, requiredArgs, optionalArgs, false, false, renderer);
    }

    /**
     * A command that also accepts a bracket group after its brace groups.
     */
    public static DispatchEntry commandWithTrailingOption(String name, int requiredArgs, Renderer renderer) {
        return new DispatchEntry(name, DispatchKind.COMMAND, requiredArgs, 1, true, false, renderer);
    }

    /**
     * An environment whose body is dispatched before rendering.
     */
    public static DispatchEntry environment(String name, Renderer renderer) {
        return new DispatchEntry(name, DispatchKind.ENVIRONMENT, 0, 1, false, true, renderer);
    }

    /**
     * An environment taking {@code requiredArgs} brace groups after {@code \begin{name}}.
     */
    public static DispatchEntry environment(String name, int requiredArgs, Renderer renderer) {
        return new DispatchEntry(name, DispatchKind.ENVIRONMENT, requiredArgs, 1, false, true, renderer);
    }

    /**
     * An environment whose body is handed over untouched.
     */
    public static DispatchEntry rawEnvironment(String name, Renderer renderer) {
        return new DispatchEntry(name, DispatchKind.ENVIRONMENT, 0, 1, false, false, renderer);
    }
}
