// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag.jackson;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Json mappers which read and write {@link ai.vespa.langtag.LanguageTag} values as strings.
 */
public class Jackson {

    private static final ObjectMapper mapperInstance = createMapper();

    private Jackson() { }

    /** Creates a mapper with {@link LanguageTagModule} registered, reporting the source of parse failures */
    public static ObjectMapper createMapper() {
        return new ObjectMapper(new JsonFactoryBuilder().configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
                                                        .build())
                .registerModule(new LanguageTagModule());
    }

    /** Returns a shared mapper with language tag support */
    public static ObjectMapper mapper() { return mapperInstance; }

}
