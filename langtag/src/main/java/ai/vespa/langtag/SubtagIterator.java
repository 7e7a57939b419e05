// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.langtag;

/**
 * Splits a tag on dashes. After each successful {@link #next()}, {@link #subtag()} is the current subtag
 * and {@link #end()} its exclusive end offset, which is also its end offset in the normalized output
 * since normalization never changes subtag lengths.
 * Empty subtags are returned as such, the caller decides whether they are an error.
 */
final class SubtagIterator {

    private final String input;

    /** Start of the next subtag, or past the input when exhausted */
    private int position = 0;

    private String subtag = null;
    private int end = 0;

    SubtagIterator(String input) {
        this.input = input;
    }

    /** Advances to the next subtag and returns true, or returns false if there are no more subtags. */
    boolean next() {
        if (position > input.length()) return false;
        int dash = input.indexOf('-', position);
        end = dash < 0 ? input.length() : dash;
        subtag = input.substring(position, end);
        position = end + 1;
        return true;
    }

    String subtag() { return subtag; }

    int end() { return end; }

}
