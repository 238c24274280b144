package io.datashape.core.engine;

import java.util.Arrays;
import java.util.Set;

/**
 * Field filter for a dump: an allow-list, a deny-list, or neither. Names are field names, not
 * dump keys.
 */
public record DumpOptions(Set<String> include, Set<String> exclude) {

    private static final DumpOptions ALL = new DumpOptions(Set.of(), Set.of());

    public DumpOptions {
        include = include == null ? Set.of() : Set.copyOf(include);
        exclude = exclude == null ? Set.of() : Set.copyOf(exclude);
        if (!include.isEmpty() && !exclude.isEmpty()) {
            throw new IllegalArgumentException("include and exclude cannot be combined");
        }
    }

    public static DumpOptions all() {
        return ALL;
    }

    public static DumpOptions include(String... fields) {
        return new DumpOptions(Set.copyOf(Arrays.asList(fields)), Set.of());
    }

    public static DumpOptions exclude(String... fields) {
        return new DumpOptions(Set.of(), Set.copyOf(Arrays.asList(fields)));
    }

    boolean accepts(String field) {
        if (!include.isEmpty()) {
            return include.contains(field);
        }
        return !exclude.contains(field);
    }
}
