// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TagValidatorTestCase {

    @Test
    void requireThatWellFormedTagsAreValid() {
        for (String tag : new String[] { "de", "zh-yue-HK", "sr-Latn-RS", "sl-rozaj-biske", "en-US-u-islamcal",
                                         "en-a-bbb-b-ccc", "x-foo", "i-klingon", "de-CH-x-phonebk-phonebk" }) {
            assertEquals(Optional.empty(), LanguageTag.parse(tag).validate(), tag);
            assertTrue(LanguageTag.parse(tag).isValid(), tag);
        }
    }

    @Test
    void requireThatDuplicateVariantsAreInvalid() {
        assertEquals(Optional.of(ValidationError.DUPLICATE_VARIANT), LanguageTag.parse("de-1901-1901").validate());
        assertEquals(Optional.of(ValidationError.DUPLICATE_VARIANT), LanguageTag.parse("sl-rozaj-biske-ROZAJ").validate());
        assertFalse(LanguageTag.parse("de-1901-1901").isValid());
    }

    @Test
    void requireThatDuplicateSingletonsAreInvalid() {
        assertEquals(Optional.of(ValidationError.DUPLICATE_EXTENSION), LanguageTag.parse("ar-a-aaa-b-bbb-a-ccc").validate());
        assertEquals(Optional.of(ValidationError.DUPLICATE_EXTENSION), LanguageTag.parse("en-1-foo-1-bar").validate());
        assertEquals(Optional.of(ValidationError.DUPLICATE_EXTENSION), LanguageTag.parse("en-A-foo-a-bar").validate());
    }

    @Test
    void requireThatSingletonsInPrivateUseAreNotExtensions() {
        assertEquals(Optional.empty(), LanguageTag.parse("en-a-foo-x-a-bar").validate());
    }

    @Test
    void requireThatMultipleExtendedLanguagesAreInvalid() {
        assertEquals(Optional.of(ValidationError.MULTIPLE_EXTENDED_LANGUAGE_SUBTAGS),
                     LanguageTag.parse("zh-abc-def").validate());
        assertEquals(Optional.empty(), LanguageTag.parse("zh-abc").validate());
    }

    @Test
    void requireThatErrorsDescribeThemselves() {
        assertEquals("The same variant subtag is only allowed once in a tag", ValidationError.DUPLICATE_VARIANT.description());
        assertEquals(ValidationError.DUPLICATE_EXTENSION.description(), ValidationError.DUPLICATE_EXTENSION.toString());
    }

}
