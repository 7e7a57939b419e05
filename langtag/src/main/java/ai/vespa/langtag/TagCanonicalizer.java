// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import java.util.Optional;

/**
 * Rewrites a tag to its canonical form, as far as this can be done without the IANA subtag registry.
 * The component offsets of the result are computed as it is built.
 */
final class TagCanonicalizer {

    private TagCanonicalizer() { }

    static LanguageTag canonicalize(LanguageTag tag) {
        String language = tag.primaryLanguage();

        Optional<GrandfatheredTag> grandfathered = SubtagTables.grandfathered(language);
        if (grandfathered.isPresent() && grandfathered.get().preferredValue().isPresent())
            return LanguageTag.ofSingleComponent(grandfathered.get().preferredValue().get());

        if (language.startsWith("x-")) return tag; // private use only

        language = tag.extendedLanguage().orElse(language);
        language = SubtagTables.deprecatedLanguage(language).orElse(language);

        StringBuilder b = new StringBuilder(tag.value().length());
        b.append(language);
        int languageEnd = b.length();

        tag.script().ifPresent(script -> b.append('-').append(script));
        int scriptEnd = b.length();

        tag.region().ifPresent(region -> b.append('-').append(SubtagTables.deprecatedRegion(region).orElse(region)));
        int regionEnd = b.length();

        for (String variant : tag.variantSubtags())
            b.append('-').append(variant.equals("heploc") ? "alalc97" : variant);
        int variantEnd = b.length();

        tag.extension().ifPresent(extension -> b.append('-').append(extension));
        int extensionEnd = b.length();

        tag.privateUse().ifPresent(privateUse -> b.append('-').append(privateUse));

        return new LanguageTag(b.toString(), languageEnd, languageEnd, scriptEnd, regionEnd, variantEnd, extensionEnd);
    }

}
