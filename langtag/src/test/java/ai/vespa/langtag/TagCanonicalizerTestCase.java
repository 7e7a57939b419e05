// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

public class TagCanonicalizerTestCase {

    @Test
    void requireThatGrandfatheredTagsAreReplaced() {
        LanguageTag klingon = LanguageTag.parse("i-klingon");
        assertNotEquals(LanguageTag.parse("tlh"), klingon);
        assertEquals(LanguageTag.parse("tlh"), klingon.canonicalize());
        assertEquals("jbo", canonical("art-lojban"));
        assertEquals("nan", canonical("zh-min-nan"));
        assertEquals("en-GB-oxendict", canonical("en-GB-oed"));
    }

    @Test
    void requireThatGrandfatheredTagsWithoutReplacementAreKept() {
        assertEquals("i-default", canonical("i-default"));
        assertEquals("zh-min", canonical("zh-min"));
    }

    @Test
    void requireThatExtendedLanguageIsPromoted() {
        LanguageTag tag = LanguageTag.parse("zh-yue-HK").canonicalize();
        assertEquals("yue-HK", tag.value());
        assertEquals("yue", tag.primaryLanguage());
        assertEquals(Optional.empty(), tag.extendedLanguage());
        assertEquals(Optional.of("HK"), tag.region());
        assertEquals(LanguageTag.parse("yue-HK"), tag);
    }

    @Test
    void requireThatAllExtendedLanguagesReplaceThePrimaryLanguage() {
        LanguageTag tag = LanguageTag.parse("zh-cmn-yue-Hant").canonicalize();
        assertEquals("cmn-yue-Hant", tag.value());
        assertEquals("cmn-yue", tag.primaryLanguage());
        assertEquals("cmn-yue", tag.fullLanguage());
        assertEquals(Optional.empty(), tag.extendedLanguage());
        assertEquals(Optional.of("Hant"), tag.script());
        assertEquals(Optional.empty(), tag.region());
    }

    @Test
    void requireThatDeprecatedLanguagesAreReplaced() {
        assertEquals("he-IL", canonical("iw-IL"));
        assertEquals("id", canonical("in"));
        assertEquals("ro-MD", canonical("mo-MD"));
        assertEquals("aas", canonical("zh-aam"));
    }

    @Test
    void requireThatDeprecatedRegionsAreReplaced() {
        assertEquals("de-DE", canonical("de-DD"));
        assertEquals("my-Mymr-MM", canonical("my-Mymr-BU"));
        assertEquals(Optional.of("CD"), LanguageTag.parse("fr-ZR-x-foo").canonicalize().region());
    }

    @Test
    void requireThatHeplocIsRenamed() {
        LanguageTag tag = LanguageTag.parse("ja-Latn-hepburn-heploc").canonicalize();
        assertEquals("ja-Latn-hepburn-alalc97", tag.value());
        assertEquals(List.of("hepburn", "alalc97"), tag.variantSubtags());
    }

    @Test
    void requireThatExtensionsAndPrivateUseAreKept() {
        LanguageTag tag = LanguageTag.parse("iw-DD-1901-a-bbb-x-ccc").canonicalize();
        assertEquals("he-DE-1901-a-bbb-x-ccc", tag.value());
        assertEquals(Optional.of("a-bbb"), tag.extension());
        assertEquals(Optional.of("x-ccc"), tag.privateUse());
        assertEquals(List.of("1901"), tag.variantSubtags());
        assertEquals(LanguageTag.parse("he-DE-1901-a-bbb-x-ccc"), tag);
    }

    @Test
    void requireThatPrivateUseOnlyTagsAreUnchanged() {
        assertEquals("x-foo-bar", canonical("x-foo-bar"));
    }

    @Test
    void requireThatCanonicalTagsAreUnchanged() {
        for (String tag : List.of("en", "sr-Latn-RS", "de-CH-1901", "en-US-u-islamcal", "es-419"))
            assertEquals(LanguageTag.parse(tag), LanguageTag.parse(tag).canonicalize(), tag);
    }

    private static String canonical(String tag) {
        return LanguageTag.parse(tag).canonicalize().value();
    }

}
