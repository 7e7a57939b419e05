// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import java.util.List;
import java.util.Optional;

/**
 * Basic filtering of language tags by a language range, as in RFC 4647 section 3.3.1.
 * Both tags are normalized, so comparing their serializations exactly is case-insensitive matching.
 */
final class RangeMatcher {

    private RangeMatcher() { }

    static boolean matches(LanguageTag range, LanguageTag tag) {
        if ( ! range.isLanguageRange())
            throw new IllegalStateException("'" + range + "' is not a language range: It has extension or private use subtags");

        return range.fullLanguage().equals(tag.fullLanguage())
               && matches(range.script(), tag.script())
               && matches(range.region(), tag.region())
               && matches(range.variantSubtags(), tag.variantSubtags());
    }

    /** An absent range component matches anything */
    private static boolean matches(Optional<String> range, Optional<String> tag) {
        if (range.isEmpty()) return true;
        return range.equals(tag);
    }

    /** Compares variants pairwise, ignoring those beyond the length of the shorter list */
    private static boolean matches(List<String> range, List<String> tag) {
        int common = Math.min(range.size(), tag.size());
        for (int i = 0; i < common; i++) {
            if ( ! range.get(i).equals(tag.get(i))) return false;
        }
        return true;
    }

}
