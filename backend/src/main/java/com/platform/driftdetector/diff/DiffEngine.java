package com.platform.driftdetector.diff;

import com.platform.driftdetector.normalize.EquivalenceTable;
import com.platform.driftdetector.normalize.ValueCanonicalizer;
import com.platform.driftdetector.path.AttributePath;
import com.platform.driftdetector.resource.Origin;
import com.platform.driftdetector.resource.ResourceModel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Structural diff of two normalized models of the same resource.
 *
 * <p>Walks the union of both attribute path sets in lexicographic order: declared-only paths are
 * REMOVED, observed-only paths ADDED, paths present on both sides but not equivalent MODIFIED.
 * Sequences are compared in order unless the equivalence table marks the path as a set; numbers
 * must be equal unless the path is computed-numeric, in which case they may differ by the
 * tolerance.
 */
public class DiffEngine {
    
    private final EquivalenceTable equivalenceTable;
    private final BigDecimal defaultTolerance;
    
    public DiffEngine(EquivalenceTable equivalenceTable, BigDecimal defaultTolerance) {
        this.equivalenceTable = equivalenceTable;
        this.defaultTolerance = defaultTolerance != null ? defaultTolerance : BigDecimal.ZERO;
    }
    
    public List<DiffEntry> diff(ResourceModel declared, ResourceModel observed) {
        if (declared.origin() != Origin.DECLARED || observed.origin() != Origin.OBSERVED) {
            throw new IllegalArgumentException("diff expects a declared and an observed model");
        }
        if (!declared.address().equals(observed.address())) {
            throw new IllegalArgumentException(String.format(
                "Cannot diff different resources %s and %s", declared.address(), observed.address()));
        }
        
        List<DiffEntry> entries = new ArrayList<>();
        if (!declared.kind().equals(observed.kind())) {
            entries.add(DiffEntry.modified(AttributePath.KIND, declared.kind(), observed.kind()));
        }
        
        String kind = declared.kind();
        SortedMap<String, Object> left = declared.attributes();
        SortedMap<String, Object> right = observed.attributes();
        Iterator<Map.Entry<String, Object>> li = left.entrySet().iterator();
        Iterator<Map.Entry<String, Object>> ri = right.entrySet().iterator();
        Map.Entry<String, Object> l = next(li);
        Map.Entry<String, Object> r = next(ri);
        
        while (l != null || r != null) {
            int cmp = l == null ? 1 : r == null ? -1 : l.getKey().compareTo(r.getKey());
            if (cmp < 0) {
                entries.add(DiffEntry.removed(l.getKey(), l.getValue()));
                l = next(li);
            } else if (cmp > 0) {
                entries.add(DiffEntry.added(r.getKey(), r.getValue()));
                r = next(ri);
            } else {
                if (!equivalent(kind, l.getKey(), l.getValue(), r.getValue())) {
                    entries.add(DiffEntry.modified(l.getKey(), l.getValue(), r.getValue()));
                }
                l = next(li);
                r = next(ri);
            }
        }
        if (!declared.kind().equals(observed.kind())) {
            entries.sort(Comparator.comparing(DiffEntry::path));
        }
        return List.copyOf(entries);
    }
    
    boolean equivalent(String kind, String path, Object declaredValue, Object observedValue) {
        if (declaredValue instanceof List<?> a && observedValue instanceof List<?> b
                && equivalenceTable.isSet(kind, path)) {
            return sameMultiset(a, b);
        }
        if (declaredValue instanceof BigDecimal a && observedValue instanceof BigDecimal b) {
            Optional<BigDecimal> tolerance = equivalenceTable.toleranceAt(kind, path, defaultTolerance);
            if (tolerance.isPresent()) {
                return a.subtract(b).abs().compareTo(tolerance.get()) <= 0;
            }
        }
        return ValueCanonicalizer.sameValue(declaredValue, observedValue);
    }
    
    private static boolean sameMultiset(List<?> a, List<?> b) {
        if (a.size() != b.size()) {
            return false;
        }
        Map<String, Integer> counts = new HashMap<>();
        for (Object element : a) {
            counts.merge(ValueCanonicalizer.render(element), 1, Integer::sum);
        }
        for (Object element : b) {
            String key = ValueCanonicalizer.render(element);
            Integer remaining = counts.get(key);
            if (remaining == null) {
                return false;
            }
            if (remaining == 1) {
                counts.remove(key);
            } else {
                counts.put(key, remaining - 1);
            }
        }
        return counts.isEmpty();
    }
    
    private static <T> T next(Iterator<T> iterator) {
        return iterator.hasNext() ? iterator.next() : null;
    }
}
