package com.phillippitts.mathwords.service.registry;

import java.util.Objects;

/**
 * Registry entry for one control sequence.
 *
 * @param name command name without the leading backslash
 * @param role semantic tag the parser dispatches on
 * @param arity number of mandatory arguments (0 to 2)
 * @param shape how each mandatory argument is delimited
 * @param optionalArgument whether a bracketed optional argument may precede the mandatory ones
 * @param glyph display glyph for symbols, or null
 * @param spoken default English reading for symbols and functions, or null
 * @param payload role-specific vocabulary constant, or null
 */
public record CommandDescriptor(
        String name,
        CommandRole role,
        int arity,
        ArgumentShape shape,
        boolean optionalArgument,
        String glyph,
        String spoken,
        Enum<?> payload
) {

    /** Argument delimiting convention. */
    public enum ArgumentShape {
        /** Command takes no mandatory argument. */
        NONE,
        /** A brace group, or failing that the single next token (LaTeX convention). */
        GROUP_OR_TOKEN,
        /** A brace group is mandatory. */
        GROUP
    }

    public CommandDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(shape, "shape");
        if (arity < 0 || arity > 2) {
            throw new IllegalArgumentException("arity must be 0..2 for \\" + name + ": " + arity);
        }
        if ((arity == 0) != (shape == ArgumentShape.NONE)) {
            throw new IllegalArgumentException("argument shape does not match arity for \\" + name);
        }
    }

    static CommandDescriptor nullary(String name, CommandRole role, Enum<?> payload) {
        return new CommandDescriptor(name, role, 0, ArgumentShape.NONE, false, null, null, payload);
    }

    static CommandDescriptor unary(String name, CommandRole role, ArgumentShape shape, Enum<?> payload) {
        return new CommandDescriptor(name, role, 1, shape, false, null, null, payload);
    }

    static CommandDescriptor symbol(String name, String glyph, String spoken) {
        return new CommandDescriptor(name, CommandRole.SYMBOL, 0, ArgumentShape.NONE, false, glyph, spoken, null);
    }

    static CommandDescriptor function(String name, String spoken) {
        return new CommandDescriptor(name, CommandRole.FUNCTION, 0, ArgumentShape.NONE, false, null, spoken, null);
    }

    /**
     * Returns the payload cast to the vocabulary type expected for this role.
     *
     * @param type expected enum type
     * @return payload
     * @throws IllegalStateException if the payload is absent or of another type
     */
    public <E extends Enum<E>> E payload(Class<E> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("\\" + name + " (" + role + ") has no " + type.getSimpleName() + " payload");
        }
        return type.cast(payload);
    }
}
