// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SubtagIteratorTestCase {

    @Test
    void requireThatSubtagsAreReturnedWithTheirEnd() {
        assertEquals(List.of("en@2", "Latn@7", "GB@10"), split("en-Latn-GB"));
        assertEquals(List.of("de@2"), split("de"));
    }

    @Test
    void requireThatEmptySubtagsAreReturned() {
        assertEquals(List.of("@0"), split(""));
        assertEquals(List.of("@0", "en@3"), split("-en"));
        assertEquals(List.of("en@2", "@3"), split("en-"));
        assertEquals(List.of("en@2", "@3", "GB@6"), split("en--GB"));
    }

    private static List<String> split(String input) {
        List<String> subtags = new ArrayList<>();
        SubtagIterator iterator = new SubtagIterator(input);
        while (iterator.next())
            subtags.add(iterator.subtag() + "@" + iterator.end());
        return subtags;
    }

}
