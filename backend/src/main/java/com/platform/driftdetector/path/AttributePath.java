package com.platform.driftdetector.path;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds and inspects flattened attribute paths.
 *
 * <p>Map keys are joined with {@code .}, sequence elements use {@code [n]}. Keys that would make
 * a path ambiguous (containing {@code .}, {@code [}, {@code ]} or {@code "}, or empty) are written
 * in bracket form: {@code metadata.labels["app.kubernetes.io/name"]}.
 */
public final class AttributePath {
    
    /**
     * Reserved path used when the two sides of a pair disagree on the resource kind.
     */
    public static final String KIND = "@kind";
    
    private AttributePath() {
    }
    
    public static String child(String parent, String key) {
        String segment = needsQuoting(key) ? "[\"" + key.replace("\"", "\\\"") + "\"]" : key;
        if (parent == null || parent.isEmpty()) {
            return segment;
        }
        return segment.startsWith("[") ? parent + segment : parent + "." + segment;
    }
    
    public static String index(String parent, int index) {
        return (parent == null ? "" : parent) + "[" + index + "]";
    }
    
    /**
     * True when {@code path} equals {@code prefix} or lies below it on a segment boundary.
     * {@code encryption} covers {@code encryption.algorithm} and {@code encryption[0]} but not
     * {@code encryptionx}.
     */
    public static boolean isWithin(String path, String prefix) {
        if (path.equals(prefix)) {
            return true;
        }
        if (!path.startsWith(prefix) || prefix.isEmpty()) {
            return false;
        }
        char next = path.charAt(prefix.length());
        return next == '.' || next == '[';
    }
    
    /**
     * Proper ancestors of a path, nearest first. {@code a.b[0].c} yields {@code a.b[0]}, {@code a.b}, {@code a}.
     */
    public static List<String> ancestors(String path) {
        List<Integer> cuts = new ArrayList<>();
        boolean quoted = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '"' && (i == 0 || path.charAt(i - 1) != '\\')) {
                quoted = !quoted;
            } else if (!quoted && (c == '.' || c == '[') && i > 0) {
                cuts.add(i);
            }
        }
        List<String> result = new ArrayList<>(cuts.size());
        for (int i = cuts.size() - 1; i >= 0; i--) {
            result.add(path.substring(0, cuts.get(i)));
        }
        return result;
    }
    
    private static boolean needsQuoting(String key) {
        if (key.isEmpty()) {
            return true;
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '.' || c == '[' || c == ']' || c == '"') {
                return true;
            }
        }
        return false;
    }
}
