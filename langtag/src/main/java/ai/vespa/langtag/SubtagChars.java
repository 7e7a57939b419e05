// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

/**
 * Character class predicates over 7 bit ascii, as used by the subtag grammar.
 * Non-ascii letters and digits never match.
 */
final class SubtagChars {

    private SubtagChars() { }

    static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAlphanumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    static boolean isAlphabetic(String s) {
        for (int i = 0; i < s.length(); i++) {
            if ( ! isAlpha(s.charAt(i))) return false;
        }
        return true;
    }

    static boolean isNumeric(String s) {
        for (int i = 0; i < s.length(); i++) {
            if ( ! isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    static boolean isAlphanumeric(String s) {
        for (int i = 0; i < s.length(); i++) {
            if ( ! isAlphanumeric(s.charAt(i))) return false;
        }
        return true;
    }

    static boolean isAlphanumericOrDash(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ( ! isAlphanumeric(c) && c != '-') return false;
        }
        return true;
    }

    static char toLower(char c) {
        return (c >= 'A' && c <= 'Z') ? (char)(c + ('a' - 'A')) : c;
    }

    static char toUpper(char c) {
        return (c >= 'a' && c <= 'z') ? (char)(c - ('a' - 'A')) : c;
    }

    /** Appends the subtag lowercased. */
    static void appendLower(String s, StringBuilder out) {
        for (int i = 0; i < s.length(); i++)
            out.append(toLower(s.charAt(i)));
    }

    /** Appends the subtag uppercased. */
    static void appendUpper(String s, StringBuilder out) {
        for (int i = 0; i < s.length(); i++)
            out.append(toUpper(s.charAt(i)));
    }

    /** Appends the subtag with the first character uppercased and the rest lowercased. Requires a non-empty subtag. */
    static void appendTitle(String s, StringBuilder out) {
        out.append(toUpper(s.charAt(0)));
        for (int i = 1; i < s.length(); i++)
            out.append(toLower(s.charAt(i)));
    }

    static String toLowerCase(String s) {
        StringBuilder b = new StringBuilder(s.length());
        appendLower(s, b);
        return b.toString();
    }

    static String toUpperCase(String s) {
        StringBuilder b = new StringBuilder(s.length());
        appendUpper(s, b);
        return b.toString();
    }

}
