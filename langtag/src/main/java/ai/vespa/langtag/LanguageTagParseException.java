// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

/**
 * Thrown by the throwing parse methods when a string is not a well-formed language tag.
 */
public class LanguageTagParseException extends IllegalArgumentException {

    private final String input;
    private final ParseError error;

    public LanguageTagParseException(String input, ParseError error) {
        super("Could not parse '" + input + "' as a language tag: " + error.description());
        this.input = input;
        this.error = error;
    }

    /** Returns the string which failed to parse */
    public String input() { return input; }

    public ParseError error() { return error; }

}
