package org.conflux.runtime.api;

import java.util.Objects;

/**
 * A categorized, human-readable failure.
 *
 * @param kind    The failure category.
 * @param message Description suitable for a chain's error message.
 */
public record ConversionError(ConversionErrorKind kind, String message) {

    public ConversionError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static ConversionError of(ConversionErrorKind kind, String format, Object... args) {
        return new ConversionError(kind, String.format(format, args));
    }
}
