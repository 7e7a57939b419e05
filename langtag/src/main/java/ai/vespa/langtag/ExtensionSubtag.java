// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import java.util.Objects;

/**
 * An extension subtag together with the singleton which introduces it,
 * e.g. <code>u</code> and <code>co</code> in <code>de-u-co-phonebk</code>.
 */
public final class ExtensionSubtag {

    private final char singleton;
    private final String value;

    public ExtensionSubtag(char singleton, String value) {
        this.singleton = singleton;
        this.value = Objects.requireNonNull(value);
    }

    public char singleton() { return singleton; }

    public String value() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if ( ! (o instanceof ExtensionSubtag)) return false;
        ExtensionSubtag other = (ExtensionSubtag) o;
        return singleton == other.singleton && value.equals(other.value);
    }

    @Override
    public int hashCode() { return Objects.hash(singleton, value); }

    @Override
    public String toString() { return singleton + "-" + value; }

}
