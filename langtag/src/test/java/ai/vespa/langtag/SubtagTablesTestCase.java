// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SubtagTablesTestCase {

    @Test
    void requireThatGrandfatheredTagsAreFoundIgnoringCase() {
        assertEquals(26, SubtagTables.grandfathered().size());
        GrandfatheredTag klingon = SubtagTables.grandfathered("I-Klingon").get();
        assertEquals("i-klingon", klingon.tag());
        assertEquals(Optional.of("tlh"), klingon.preferredValue());
        assertEquals("i-klingon -> tlh", klingon.toString());
        assertEquals(Optional.empty(), SubtagTables.grandfathered("i-default").get().preferredValue());
        assertEquals(Optional.empty(), SubtagTables.grandfathered("i-klingon-x"));
        assertEquals(Optional.empty(), SubtagTables.grandfathered("en"));
    }

    @Test
    void requireThatGrandfatheredTagsAreValues() {
        GrandfatheredTag klingon = new GrandfatheredTag("i-klingon", "tlh");
        assertEquals(klingon, SubtagTables.grandfathered("i-klingon").get());
        assertEquals(klingon.hashCode(), SubtagTables.grandfathered("I-KLINGON").get().hashCode());
        assertNotEquals(klingon, new GrandfatheredTag("i-klingon", null));
        assertNotEquals(klingon, new GrandfatheredTag("i-lux", "tlh"));
        assertEquals(new GrandfatheredTag("i-default", null), SubtagTables.grandfathered("i-default").get());
        assertEquals(26, new HashSet<>(SubtagTables.grandfathered()).size());
    }

    @Test
    void requireThatEveryGrandfatheredTagParsesAsItself() {
        for (GrandfatheredTag tag : SubtagTables.grandfathered()) {
            assertEquals(tag.tag(), LanguageTag.parse(tag.tag()).value());
            tag.preferredValue().ifPresent(preferred -> assertTrue(LanguageTag.tryParse(preferred).isSuccess(), preferred));
        }
    }

    @Test
    void requireThatDeprecatedCodesAreFoundIgnoringCase() {
        assertEquals(Optional.of("he"), SubtagTables.deprecatedLanguage("iw"));
        assertEquals(Optional.of("he"), SubtagTables.deprecatedLanguage("IW"));
        assertEquals(Optional.of("yug"), SubtagTables.deprecatedLanguage("yuu"));
        assertEquals(Optional.empty(), SubtagTables.deprecatedLanguage("en"));
        assertEquals(Optional.of("MM"), SubtagTables.deprecatedRegion("bu"));
        assertEquals(Optional.of("CD"), SubtagTables.deprecatedRegion("ZR"));
        assertEquals(Optional.empty(), SubtagTables.deprecatedRegion("419"));
    }

}
