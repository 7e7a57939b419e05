// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

/**
 * The reasons a string is not a well-formed language tag.
 */
public enum ParseError {

    /** If an extension subtag is present, it must not be empty. */
    EMPTY_EXTENSION("If an extension subtag is present, it must not be empty"),

    /** If the x subtag is present, it must not be empty. */
    EMPTY_PRIVATE_USE("If the 'x' subtag is present, it must not be empty"),

    /** The tag contains a char which is not A-Z, a-z, 0-9 or dash. */
    FORBIDDEN_CHAR("The language tag contains a char which is not allowed"),

    /** A subtag does not match any of the subtag types allowed at its position. */
    INVALID_SUBTAG("A subtag fails to parse, it does not match any other subtags"),

    /** The primary language subtag is invalid. */
    INVALID_LANGUAGE("The given language subtag is invalid"),

    SUBTAG_TOO_LONG("A subtag may be eight characters in length at maximum"),

    EMPTY_SUBTAG("A subtag should not be empty"),

    /** At most three extended language subtags are allowed, and zero or one is preferred. */
    TOO_MANY_EXTLANGS("At maximum three extlangs are allowed");

    private final String description;

    ParseError(String description) {
        this.description = description;
    }

    public String description() { return description; }

    @Override
    public String toString() { return description; }

}
