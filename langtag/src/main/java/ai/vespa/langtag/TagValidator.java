// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import java.util.List;
import java.util.Optional;

/**
 * Checks the parts of RFC 5646 validity which do not depend on the IANA subtag registry.
 */
final class TagValidator {

    private TagValidator() { }

    static Optional<ValidationError> validate(LanguageTag tag) {
        if (hasDuplicateVariant(tag.variantSubtags())) return Optional.of(ValidationError.DUPLICATE_VARIANT);
        if (hasDuplicateSingleton(tag)) return Optional.of(ValidationError.DUPLICATE_EXTENSION);
        if (tag.extendedLanguage().map(extlang -> extlang.indexOf('-') >= 0).orElse(false))
            return Optional.of(ValidationError.MULTIPLE_EXTENDED_LANGUAGE_SUBTAGS);
        return Optional.empty();
    }

    private static boolean hasDuplicateVariant(List<String> variants) {
        for (int i = 0; i < variants.size(); i++) {
            for (int j = i + 1; j < variants.size(); j++) {
                if (variants.get(i).equals(variants.get(j))) return true;
            }
        }
        return false;
    }

    private static boolean hasDuplicateSingleton(LanguageTag tag) {
        Optional<String> extension = tag.extension();
        if (extension.isEmpty()) return false;

        boolean[] seen = new boolean[36]; // a-z, then 0-9
        String subtags = extension.get();
        int start = 0;
        while (start < subtags.length()) {
            int end = subtags.indexOf('-', start);
            if (end < 0) end = subtags.length();
            if (end - start == 1) {
                int slot = slot(subtags.charAt(start));
                if (seen[slot]) return true;
                seen[slot] = true;
            }
            start = end + 1;
        }
        return false;
    }

    private static int slot(char singleton) {
        char c = SubtagChars.toLower(singleton);
        return SubtagChars.isDigit(c) ? 26 + (c - '0') : c - 'a';
    }

}
