package com.platform.driftdetector.diff;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One field-level difference of a matched pair. An absent side is {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffEntry(
    String path,
    Object declaredValue,
    Object observedValue,
    ChangeKind changeKind
) {
    
    public DiffEntry {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Diff entry path must not be empty");
        }
        boolean declaredPresent = declaredValue != null;
        boolean observedPresent = observedValue != null;
        boolean consistent = switch (changeKind) {
            case ADDED -> !declaredPresent && observedPresent;
            case REMOVED -> declaredPresent && !observedPresent;
            case MODIFIED -> declaredPresent && observedPresent;
        };
        if (!consistent) {
            throw new IllegalArgumentException(String.format(
                "%s entry at %s has declared=%s observed=%s", changeKind, path, declaredValue, observedValue));
        }
    }
    
    public static DiffEntry added(String path, Object observedValue) {
        return new DiffEntry(path, null, observedValue, ChangeKind.ADDED);
    }
    
    public static DiffEntry removed(String path, Object declaredValue) {
        return new DiffEntry(path, declaredValue, null, ChangeKind.REMOVED);
    }
    
    public static DiffEntry modified(String path, Object declaredValue, Object observedValue) {
        return new DiffEntry(path, declaredValue, observedValue, ChangeKind.MODIFIED);
    }
}
