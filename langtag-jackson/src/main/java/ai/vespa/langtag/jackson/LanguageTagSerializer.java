// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag.jackson;

import ai.vespa.langtag.LanguageTag;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a language tag as a JSON string of its normalized serialization.
 */
public class LanguageTagSerializer extends StdSerializer<LanguageTag> {

    public LanguageTagSerializer() {
        super(LanguageTag.class);
    }

    @Override
    public void serialize(LanguageTag tag, JsonGenerator generator, SerializerProvider provider) throws IOException {
        generator.writeString(tag.value());
    }

}
