package com.libragraph.sift.formats.api;

import java.util.Objects;

/**
 * Outcome of {@link FormatParser#parse}: either the parsed state or the reason the
 * bytes are not this format. A mismatch is ordinary control flow, not an error.
 */
public sealed interface ParseResult<S> {

    record Ok<S>(S state) implements ParseResult<S> {
        public Ok {
            Objects.requireNonNull(state, "state cannot be null");
        }
    }

    record Mismatch<S>(String reason) implements ParseResult<S> {}

    static <S> ParseResult<S> ok(S state) {
        return new Ok<>(state);
    }

    static <S> ParseResult<S> mismatch(String reason) {
        return new Mismatch<>(reason);
    }

    static <S> ParseResult<S> mismatch(String format, Object... args) {
        return new Mismatch<>(String.format(format, args));
    }

    default boolean isOk() {
        return this instanceof Ok;
    }
}
