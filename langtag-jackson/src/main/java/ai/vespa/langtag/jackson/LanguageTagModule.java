// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag.jackson;

import ai.vespa.langtag.LanguageTag;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Registers JSON serialization of {@link LanguageTag} as strings.
 */
public class LanguageTagModule extends SimpleModule {

    public LanguageTagModule() {
        super("LanguageTagModule");
        addSerializer(LanguageTag.class, new LanguageTagSerializer());
        addDeserializer(LanguageTag.class, new LanguageTagDeserializer());
    }

}
