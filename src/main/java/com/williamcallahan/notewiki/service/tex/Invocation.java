package com.williamcallahan.notewiki.service.tex;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One parsed use of a command or environment, handed to its renderer.
 *
 * @param name entry name as written, including a trailing star
 * @param kind command or environment
 * @param optionalArgument the leading {@code [...]} group, when present
 * @param requiredArguments the {@code {...}} groups, in order
 * @param trailingArgument a {@code [...]} group written after the required groups, when present
 * @param body environment body (already dispatched for recursive entries); empty for commands
 * @param position offset of the marker in the text being dispatched
 */
public record Invocation(
    String name,
    DispatchKind kind,
    Optional<String> optionalArgument,
    List<String> requiredArguments,
    Optional<String> trailingArgument,
    String body,
    int position
) {

    public Invocation {
        Objects.requireNonNull(name, "Invocation name cannot be null");
        Objects.requireNonNull(kind, "Invocation kind cannot be null");
        optionalArgument = optionalArgument == null ? Optional.empty() : optionalArgument;
        requiredArguments = requiredArguments == null ? List.of() : List.copyOf(requiredArguments);
        trailingArgument = trailingArgument == null ? Optional.empty() : trailingArgument;
        body = body == null ? "" : body;
    }

    /**
     * Returns the required argument at {@code index}.
     */
    public String argument(int index) {
        return requiredArguments.get(index);
    }
}
