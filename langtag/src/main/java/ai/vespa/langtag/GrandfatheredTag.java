// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import java.util.Objects;
import java.util.Optional;

/**
 * A whole tag registered before RFC 4646, which does not follow the subtag grammar,
 * together with the tag which replaces it, if any.
 */
public final class GrandfatheredTag {

    private final String tag;
    private final String preferredValue;

    GrandfatheredTag(String tag, String preferredValue) {
        this.tag = Objects.requireNonNull(tag);
        this.preferredValue = preferredValue;
    }

    /** Returns the tag as spelled in the registry */
    public String tag() { return tag; }

    /** Returns the tag to use instead of this, or empty if there is none */
    public Optional<String> preferredValue() { return Optional.ofNullable(preferredValue); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if ( ! (o instanceof GrandfatheredTag)) return false;
        GrandfatheredTag other = (GrandfatheredTag) o;
        return tag.equals(other.tag) && Objects.equals(preferredValue, other.preferredValue);
    }

    @Override
    public int hashCode() { return Objects.hash(tag, preferredValue); }

    @Override
    public String toString() {
        return preferredValue == null ? tag : tag + " -> " + preferredValue;
    }

}
