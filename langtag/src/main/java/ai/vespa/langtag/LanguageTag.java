// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A language tag as described in <a href="https://tools.ietf.org/html/rfc5646">RFC 5646</a>, such as
 * <code>en</code>, <code>fr-BE</code>, <code>zh-Hant-TW</code> or <code>de-CH-1901-x-phonebk</code>.
 *
 * <p>A tag is its normalized serialization, where the language, extended language, variant, extension and
 * private use subtags are lowercase, the script is titlecase and the region is uppercase, together with the
 * offsets at which each component ends in that serialization. The components are views of the serialization,
 * and two tags are equal if and only if their serializations are.
 *
 * <p>Tags are created by parsing, see {@link #parse} and {@link #tryParse}.
 *
 * <p>This class is <b>immutable</b>.
 */
public final class LanguageTag {

    private static final Splitter subtagSplitter = Splitter.on('-').omitEmptyStrings();

    private final String serialization;
    private final int languageEnd;
    private final int extlangEnd;
    private final int scriptEnd;
    private final int regionEnd;
    private final int variantEnd;
    private final int extensionEnd;

    LanguageTag(String serialization,
                int languageEnd, int extlangEnd, int scriptEnd, int regionEnd, int variantEnd, int extensionEnd) {
        if ( ! (0 < languageEnd && languageEnd <= extlangEnd && extlangEnd <= scriptEnd && scriptEnd <= regionEnd &&
                regionEnd <= variantEnd && variantEnd <= extensionEnd && extensionEnd <= serialization.length()))
            throw new IllegalStateException("Component offsets of '" + serialization + "' are out of order");
        this.serialization = serialization;
        this.languageEnd = languageEnd;
        this.extlangEnd = extlangEnd;
        this.scriptEnd = scriptEnd;
        this.regionEnd = regionEnd;
        this.variantEnd = variantEnd;
        this.extensionEnd = extensionEnd;
    }

    /** Returns a tag consisting of a single component spanning the whole serialization */
    static LanguageTag ofSingleComponent(String serialization) {
        int end = serialization.length();
        return new LanguageTag(serialization, end, end, end, end, end, end);
    }

    /**
     * Parses a language tag.
     *
     * @param input the string to parse
     * @return the tag, or the reason it could not be parsed
     */
    public static ParseResult tryParse(String input) {
        return LanguageTagParser.parse(input);
    }

    /**
     * Parses a language tag.
     *
     * @param input the string to parse
     * @return the parsed tag
     * @throws LanguageTagParseException if the input is not a well-formed language tag
     */
    public static LanguageTag parse(String input) {
        return LanguageTagParser.parse(input).tag();
    }

    /** Returns the tag corresponding to the given locale. */
    public static LanguageTag from(Locale locale) {
        return LocaleFactory.fromLocale(locale);
    }

    /** Returns the normalized serialization of this tag */
    public String value() { return serialization; }

    /** Returns the primary language subtag. For grandfathered tags this is the entire tag. */
    public String primaryLanguage() {
        return serialization.substring(0, languageEnd);
    }

    /** Returns the extended language subtags, dash separated, if any. Valid tags have at most one. */
    public Optional<String> extendedLanguage() {
        return component(languageEnd, extlangEnd);
    }

    public List<String> extendedLanguageSubtags() {
        return subtags(extendedLanguage());
    }

    /** Returns the primary language followed by its extended language subtags */
    public String fullLanguage() {
        return serialization.substring(0, extlangEnd);
    }

    public Optional<String> script() {
        return component(extlangEnd, scriptEnd);
    }

    public Optional<String> region() {
        return component(scriptEnd, regionEnd);
    }

    /** Returns the variant subtags, dash separated, if any */
    public Optional<String> variant() {
        return component(regionEnd, variantEnd);
    }

    public List<String> variantSubtags() {
        return subtags(variant());
    }

    /** Returns the extensions, including their singletons, dash separated, if any */
    public Optional<String> extension() {
        return component(variantEnd, extensionEnd);
    }

    /** Returns each extension subtag together with the singleton which introduces it, in tag order */
    public List<ExtensionSubtag> extensionSubtags() {
        ImmutableList.Builder<ExtensionSubtag> builder = ImmutableList.builder();
        char singleton = 0;
        for (String subtag : subtags(extension())) {
            if (subtag.length() == 1)
                singleton = subtag.charAt(0);
            else
                builder.add(new ExtensionSubtag(singleton, subtag));
        }
        return builder.build();
    }

    /** Returns the private use part of this, starting with the "x" singleton, if any */
    public Optional<String> privateUse() {
        if (serialization.startsWith("x-")) return Optional.of(serialization);
        if (extensionEnd == serialization.length()) return Optional.empty();
        return Optional.of(serialization.substring(extensionEnd + 1));
    }

    /** Returns the private use subtags, not including the "x" singleton */
    public List<String> privateUseSubtags() {
        return privateUse().map(privateUse -> subtags(Optional.of(privateUse.substring(2))))
                           .orElse(List.of());
    }

    /** Returns whether this can be used as a language range, which is the case when it has no extension or private use */
    public boolean isLanguageRange() {
        return extension().isEmpty() && privateUse().isEmpty();
    }

    /**
     * Checks whether this tag is "valid" as defined in
     * <a href="https://tools.ietf.org/html/rfc5646#section-2.2.9">RFC 5646 section 2.2.9</a>,
     * except that the subtags are not checked against the IANA subtag registry.
     *
     * @return the first problem found, or empty if this is valid
     */
    public Optional<ValidationError> validate() {
        return TagValidator.validate(this);
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    /**
     * Returns the canonical version of this tag:
     * <ul>
     *     <li>Grandfathered tags are replaced by their preferred value, if any.</li>
     *     <li>The extended language replaces the primary language.</li>
     *     <li>Deprecated languages and regions are replaced by their modern equivalents.</li>
     *     <li>The <code>heploc</code> variant is replaced by <code>alalc97</code>.</li>
     * </ul>
     * This is a subset of the canonicalization described in RFC 5646 section 4.5, so the returned tag
     * may not be fully canonical. It is not validated.
     */
    public LanguageTag canonicalize() {
        return TagCanonicalizer.canonicalize(this);
    }

    /**
     * Returns whether the given tag matches this as a language range. Components absent in this range
     * match anything, so <code>en</code> matches <code>en-GB</code> but <code>en-GB</code> does not match <code>en</code>.
     *
     * @throws IllegalStateException if this is not a language range
     * @see #isLanguageRange()
     */
    public boolean matches(LanguageTag tag) {
        return RangeMatcher.matches(this, tag);
    }

    /** Returns a locale corresponding to this, as far as one can be represented */
    public Locale toLocale() {
        return LocaleFactory.toLocale(this);
    }

    private Optional<String> component(int previousEnd, int end) {
        if (previousEnd == end) return Optional.empty();
        return Optional.of(serialization.substring(previousEnd + 1, end));
    }

    private static List<String> subtags(Optional<String> component) {
        return component.map(subtagSplitter::splitToList).orElse(List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if ( ! (o instanceof LanguageTag)) return false;
        return serialization.equals(((LanguageTag) o).serialization);
    }

    @Override
    public int hashCode() { return serialization.hashCode(); }

    @Override
    public String toString() { return serialization; }

}
