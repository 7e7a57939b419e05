// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import java.util.Objects;
import java.util.Optional;

import static ai.vespa.langtag.SubtagChars.isAlpha;
import static ai.vespa.langtag.SubtagChars.isAlphabetic;
import static ai.vespa.langtag.SubtagChars.isAlphanumeric;
import static ai.vespa.langtag.SubtagChars.isAlphanumericOrDash;
import static ai.vespa.langtag.SubtagChars.isDigit;
import static ai.vespa.langtag.SubtagChars.isNumeric;

/**
 * A parser of RFC 5646 language tags. This accepts exactly the tags which are "well-formed" as defined in
 * <a href="https://tools.ietf.org/html/rfc5646#section-2.2.9">RFC 5646 section 2.2.9</a>.
 * Use {@link LanguageTag#validate()} to additionally check that a tag is "valid".
 *
 * <p>The parser is a single pass over the subtags of the input. Each subtag is assigned to a component
 * according to the state reached by the preceding subtags, normalized, and appended to the serialization,
 * while the end offset of every component in that serialization is recorded.
 *
 * <p>This is stateless and thread safe.
 */
public final class LanguageTagParser {

    private static final int maxSubtagLength = 8;
    private static final int maxExtendedLanguages = 3;

    private enum State {
        START,
        AFTER_LANGUAGE,
        AFTER_EXTLANG,
        AFTER_SCRIPT,
        AFTER_REGION,
        IN_EXTENSION,
        IN_PRIVATE_USE
    }

    private LanguageTagParser() { }

    /**
     * Parses the given string as a language tag.
     *
     * @param input the string to parse
     * @return the tag, or the reason the input is not a well-formed tag
     * @throws NullPointerException if input is null
     */
    public static ParseResult parse(String input) {
        Objects.requireNonNull(input, "input cannot be null");

        Optional<GrandfatheredTag> grandfathered = SubtagTables.grandfathered(input);
        if (grandfathered.isPresent())
            return ParseResult.success(input, LanguageTag.ofSingleComponent(grandfathered.get().tag()));

        if (input.startsWith("x-") || input.startsWith("X-"))
            return parsePrivateUseOnly(input);

        return parseSubtags(input);
    }

    private static ParseResult parsePrivateUseOnly(String input) {
        if ( ! isAlphanumericOrDash(input)) return ParseResult.failure(input, ParseError.FORBIDDEN_CHAR);
        if (input.length() == 2) return ParseResult.failure(input, ParseError.EMPTY_PRIVATE_USE);
        if (input.contains("--") || input.endsWith("-")) return ParseResult.failure(input, ParseError.EMPTY_SUBTAG);
        return ParseResult.success(input, LanguageTag.ofSingleComponent(SubtagChars.toLowerCase(input)));
    }

    private static ParseResult parseSubtags(String input) {
        StringBuilder serialization = new StringBuilder(input.length());
        State state = State.START;
        boolean expected = false; // whether a singleton still awaits its first subtag
        int languageEnd = 0;
        int extlangEnd = 0;
        int scriptEnd = 0;
        int regionEnd = 0;
        int variantEnd = 0;
        int extensionEnd = 0;
        int extlangCount = 0;

        SubtagIterator subtags = new SubtagIterator(input);
        while (subtags.next()) {
            String subtag = subtags.subtag();
            int end = subtags.end();
            if (subtag.isEmpty()) return ParseResult.failure(input, ParseError.EMPTY_SUBTAG);
            if (subtag.length() > maxSubtagLength) return ParseResult.failure(input, ParseError.SUBTAG_TOO_LONG);

            if (state == State.START) {
                if (subtag.length() < 2 || ! isAlphabetic(subtag))
                    return ParseResult.failure(input, ParseError.INVALID_LANGUAGE);
                SubtagChars.appendLower(subtag, serialization);
                languageEnd = end;
                // extended languages only follow short primary languages
                state = subtag.length() < 4 ? State.AFTER_LANGUAGE : State.AFTER_EXTLANG;
            }
            else if (state == State.IN_PRIVATE_USE) {
                if ( ! isAlphanumeric(subtag)) return ParseResult.failure(input, ParseError.INVALID_SUBTAG);
                appendDashedLower(subtag, serialization);
                expected = false;
            }
            else if (subtag.equals("x") || subtag.equals("X")) {
                if (state == State.IN_EXTENSION && expected) return ParseResult.failure(input, ParseError.EMPTY_EXTENSION);
                serialization.append("-x");
                state = State.IN_PRIVATE_USE;
                expected = true;
            }
            else if (subtag.length() == 1 && isAlphanumeric(subtag)) {
                if (state == State.IN_EXTENSION && expected) return ParseResult.failure(input, ParseError.EMPTY_EXTENSION);
                serialization.append('-').append(SubtagChars.toLower(subtag.charAt(0)));
                state = State.IN_EXTENSION;
                expected = true;
            }
            else if (state == State.IN_EXTENSION) {
                if ( ! isAlphanumeric(subtag)) return ParseResult.failure(input, ParseError.INVALID_SUBTAG);
                appendDashedLower(subtag, serialization);
                extensionEnd = end;
                expected = false;
            }
            else if (state == State.AFTER_LANGUAGE && isExtendedLanguage(subtag)) {
                if (++extlangCount > maxExtendedLanguages)
                    return ParseResult.failure(input, ParseError.TOO_MANY_EXTLANGS);
                appendDashedLower(subtag, serialization);
                extlangEnd = end;
            }
            else if ((state == State.AFTER_LANGUAGE || state == State.AFTER_EXTLANG) && isScript(subtag)) {
                serialization.append('-');
                SubtagChars.appendTitle(subtag, serialization);
                scriptEnd = end;
                state = State.AFTER_SCRIPT;
            }
            else if ((state == State.AFTER_LANGUAGE || state == State.AFTER_EXTLANG || state == State.AFTER_SCRIPT)
                     && isRegion(subtag)) {
                serialization.append('-');
                SubtagChars.appendUpper(subtag, serialization);
                regionEnd = end;
                state = State.AFTER_REGION;
            }
            else if (isVariant(subtag)) { // all remaining states precede extensions
                appendDashedLower(subtag, serialization);
                variantEnd = end;
                state = State.AFTER_REGION;
            }
            else {
                return ParseResult.failure(input, ParseError.INVALID_SUBTAG);
            }
        }

        if (state == State.IN_EXTENSION && expected) return ParseResult.failure(input, ParseError.EMPTY_EXTENSION);
        if (state == State.IN_PRIVATE_USE && expected) return ParseResult.failure(input, ParseError.EMPTY_PRIVATE_USE);

        // absent components end where the previous one ends
        extlangEnd = Math.max(extlangEnd, languageEnd);
        scriptEnd = Math.max(scriptEnd, extlangEnd);
        regionEnd = Math.max(regionEnd, scriptEnd);
        variantEnd = Math.max(variantEnd, regionEnd);
        extensionEnd = Math.max(extensionEnd, variantEnd);

        return ParseResult.success(input, new LanguageTag(serialization.toString(),
                                                          languageEnd, extlangEnd, scriptEnd,
                                                          regionEnd, variantEnd, extensionEnd));
    }

    private static void appendDashedLower(String subtag, StringBuilder serialization) {
        serialization.append('-');
        SubtagChars.appendLower(subtag, serialization);
    }

    static boolean isExtendedLanguage(String subtag) {
        return subtag.length() == 3 && isAlphabetic(subtag);
    }

    static boolean isScript(String subtag) {
        return subtag.length() == 4 && isAlphabetic(subtag);
    }

    static boolean isRegion(String subtag) {
        return (subtag.length() == 2 && isAlphabetic(subtag)) || (subtag.length() == 3 && isNumeric(subtag));
    }

    static boolean isVariant(String subtag) {
        if ( ! isAlphanumeric(subtag)) return false;
        return (subtag.length() >= 5 && isAlpha(subtag.charAt(0))) || (subtag.length() >= 4 && isDigit(subtag.charAt(0)));
    }

}
