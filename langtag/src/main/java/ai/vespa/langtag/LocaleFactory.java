// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import java.util.IllformedLocaleException;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Conversions between language tags and {@link Locale}.
 *
 * @author Simon Thoresen
 */
public final class LocaleFactory {

    private static final Logger log = Logger.getLogger(LocaleFactory.class.getName());

    private static final Locale UNKNOWN = Locale.ROOT;

    private LocaleFactory() {
        // hide
    }

    /**
     * Parses a language tag into a Locale.
     *
     * @param tag the language tag to parse
     * @return the corresponding Locale, or the root locale if the tag is empty or not well-formed
     * @throws NullPointerException if tag is null
     */
    public static Locale fromLanguageTag(String tag) {
        tag = tag.trim();
        if (tag.isEmpty()) {
            return UNKNOWN;
        }
        ParseResult result = LanguageTagParser.parse(tag);
        if ( ! result.isSuccess()) {
            log.log(Level.FINE, () -> "Using the root locale for " + result);
            return UNKNOWN;
        }
        return toLocale(result.tag());
    }

    /**
     * Returns the locale corresponding to the given tag. The first extended language, if any, is used as the
     * language of the locale, as {@link Locale#forLanguageTag} does. Tags which cannot be represented
     * component by component, such as grandfathered tags, are converted by {@link Locale#forLanguageTag}.
     */
    public static Locale toLocale(LanguageTag tag) {
        if (tag.primaryLanguage().indexOf('-') >= 0 || ! tag.isValid()) // grandfathered, private use only, or invalid
            return forLanguageTag(tag);

        try {
            Locale.Builder builder = new Locale.Builder();
            builder.setLanguage(tag.extendedLanguageSubtags().isEmpty() ? tag.primaryLanguage()
                                                                         : tag.extendedLanguageSubtags().get(0));
            tag.script().ifPresent(builder::setScript);
            tag.region().ifPresent(builder::setRegion);
            tag.variant().ifPresent(builder::setVariant);
            char singleton = 0;
            StringBuilder values = new StringBuilder();
            for (ExtensionSubtag subtag : tag.extensionSubtags()) {
                if (subtag.singleton() != singleton && values.length() > 0) {
                    builder.setExtension(singleton, values.toString());
                    values.setLength(0);
                }
                singleton = subtag.singleton();
                if (values.length() > 0) values.append('-');
                values.append(subtag.value());
            }
            if (values.length() > 0)
                builder.setExtension(singleton, values.toString());
            tag.privateUse().ifPresent(privateUse -> builder.setExtension(Locale.PRIVATE_USE_EXTENSION,
                                                                          privateUse.substring(2)));
            return builder.build();
        }
        catch (IllformedLocaleException e) {
            log.log(Level.FINE, e, () -> "Locale rejected a component of '" + tag + "'");
            return forLanguageTag(tag);
        }
    }

    /** Returns the tag of the given locale. The root locale has the tag <code>und</code>. */
    public static LanguageTag fromLocale(Locale locale) {
        return LanguageTagParser.parse(locale.toLanguageTag()).tag();
    }

    private static Locale forLanguageTag(LanguageTag tag) {
        log.log(Level.FINE, () -> "Converting '" + tag + "' to a locale as a whole");
        return Locale.forLanguageTag(tag.value());
    }

}
