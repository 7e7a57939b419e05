// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag.jackson;

import ai.vespa.langtag.LanguageTag;
import ai.vespa.langtag.ParseResult;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;

/**
 * Reads a language tag from a JSON string. A string which is not a well-formed tag fails
 * as any other value of the wrong format, with the parse error as the message.
 */
public class LanguageTagDeserializer extends StdScalarDeserializer<LanguageTag> {

    public LanguageTagDeserializer() {
        super(LanguageTag.class);
    }

    @Override
    public LanguageTag deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if ( ! parser.hasToken(JsonToken.VALUE_STRING))
            return (LanguageTag) context.handleUnexpectedToken(LanguageTag.class, parser);

        String text = parser.getText();
        ParseResult result = LanguageTag.tryParse(text);
        if ( ! result.isSuccess())
            return (LanguageTag) context.handleWeirdStringValue(LanguageTag.class, text, result.error().get().description());
        return result.tag();
    }

}
