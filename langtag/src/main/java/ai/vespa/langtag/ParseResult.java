// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of parsing a string as a language tag: Either a tag, or the error which prevented
 * one from being created. There are no partial results.
 *
 * <p>This class is <b>immutable</b>.
 */
public final class ParseResult {

    private final String input;
    private final LanguageTag tag;
    private final ParseError error;

    private ParseResult(String input, LanguageTag tag, ParseError error) {
        this.input = input;
        this.tag = tag;
        this.error = error;
    }

    static ParseResult success(String input, LanguageTag tag) {
        return new ParseResult(input, Objects.requireNonNull(tag), null);
    }

    static ParseResult failure(String input, ParseError error) {
        return new ParseResult(input, null, Objects.requireNonNull(error));
    }

    /** Returns whether the input was a well-formed tag */
    public boolean isSuccess() { return error == null; }

    /** Returns the string which was parsed */
    public String input() { return input; }

    /**
     * Returns the parsed tag.
     *
     * @throws LanguageTagParseException if this is a failure
     */
    public LanguageTag tag() {
        if (error != null) throw new LanguageTagParseException(input, error);
        return tag;
    }

    /** Returns the parsed tag, or empty if this is a failure */
    public Optional<LanguageTag> asOptional() { return Optional.ofNullable(tag); }

    /** Returns the error of this, or empty if this is a success */
    public Optional<ParseError> error() { return Optional.ofNullable(error); }

    @Override
    public String toString() {
        return isSuccess() ? "parsed '" + tag + "'" : "failed parsing '" + input + "': " + error.description();
    }

}
