package com.platform.driftdetector.path;

import java.util.regex.Pattern;

/**
 * Glob over attribute paths and resource kinds.
 *
 * <p>{@code *} matches any run of characters, {@code [*]} matches any sequence index.
 * A pattern without wildcards is an exact match.
 */
public final class GlobPattern {
    
    public static final String ANY = "*";
    
    private final String pattern;
    private final Pattern regex;
    private final int literalPrefixLength;
    
    private GlobPattern(String pattern) {
        this.pattern = pattern;
        this.regex = pattern.contains("*") ? compile(pattern) : null;
        int star = pattern.indexOf('*');
        if (star < 0) {
            this.literalPrefixLength = pattern.length();
        } else {
            this.literalPrefixLength = star > 0 && pattern.charAt(star - 1) == '[' ? star - 1 : star;
        }
    }
    
    public static GlobPattern of(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Pattern must not be empty");
        }
        return new GlobPattern(pattern);
    }
    
    public boolean matches(String value) {
        if (regex == null) {
            return pattern.equals(value);
        }
        return regex.matcher(value).matches();
    }
    
    /**
     * Matches the value itself or any of its ancestor paths.
     */
    public boolean matchesSubtree(String path) {
        if (matches(path)) {
            return true;
        }
        for (String ancestor : AttributePath.ancestors(path)) {
            if (matches(ancestor)) {
                return true;
            }
        }
        return false;
    }
    
    public boolean isExact() {
        return regex == null;
    }
    
    public boolean isMatchAll() {
        return ANY.equals(pattern);
    }
    
    /**
     * Number of literal characters before the first wildcard; longer means more specific.
     */
    public int specificity() {
        return literalPrefixLength;
    }
    
    public String pattern() {
        return pattern;
    }
    
    private static Pattern compile(String glob) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            if (glob.startsWith("[*]", i)) {
                flush(sb, literal);
                sb.append("\\[\\d+\\]");
                i += 3;
            } else if (glob.charAt(i) == '*') {
                flush(sb, literal);
                sb.append(".*");
                i++;
            } else {
                literal.append(glob.charAt(i));
                i++;
            }
        }
        flush(sb, literal);
        return Pattern.compile(sb.toString());
    }
    
    private static void flush(StringBuilder sb, StringBuilder literal) {
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
    
    @Override
    public boolean equals(Object o) {
        return o instanceof GlobPattern other && pattern.equals(other.pattern);
    }
    
    @Override
    public int hashCode() {
        return pattern.hashCode();
    }
    
    @Override
    public String toString() {
        return pattern;
    }
}
