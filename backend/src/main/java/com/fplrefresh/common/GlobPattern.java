package com.fplrefresh.common;

import java.util.regex.Pattern;

/**
 * Compiles cache-key globs ({@code *} any run, {@code ?} one char) to anchored regexes.
 */
public final class GlobPattern {

    private GlobPattern() {
    }

    public static Pattern compile(String glob) {
        if (glob == null || glob.isEmpty()) {
            throw new IllegalArgumentException("glob must not be empty");
        }
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.append('$').toString());
    }

    public static boolean isPattern(String keyOrGlob) {
        return keyOrGlob.indexOf('*') >= 0 || keyOrGlob.indexOf('?') >= 0;
    }
}
