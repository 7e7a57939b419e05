// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

/**
 * The reasons a well-formed language tag is not valid.
 * Membership in the IANA subtag registry is not checked.
 */
public enum ValidationError {

    DUPLICATE_VARIANT("The same variant subtag is only allowed once in a tag"),

    DUPLICATE_EXTENSION("The same extension subtag is only allowed once in a tag"),

    /** RFC 5646 errata 5457 */
    MULTIPLE_EXTENDED_LANGUAGE_SUBTAGS("Only one extended language subtag is allowed");

    private final String description;

    ValidationError(String description) {
        this.description = description;
    }

    public String description() { return description; }

    @Override
    public String toString() { return description; }

}
