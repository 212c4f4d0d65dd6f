package com.nexflow.nexflow_compiler.model.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fields a node reads from and writes to the shared state, in declaration order.
 */
public record FieldContract(List<FieldSpec> reads, List<FieldSpec> writes) {

    public static final FieldContract EMPTY = new FieldContract(List.of(), List.of());

    public FieldContract {
        reads = reads != null ? List.copyOf(reads) : List.of();
        writes = writes != null ? List.copyOf(writes) : List.of();
    }

    public static FieldContract of(List<FieldSpec> reads, List<FieldSpec> writes) {
        return new FieldContract(reads, writes);
    }

    /** Appends the given specs; an identical spec already present on the same side is kept once. */
    public FieldContract plus(Collection<FieldSpec> extraReads, Collection<FieldSpec> extraWrites) {
        return new FieldContract(concat(reads, extraReads), concat(writes, extraWrites));
    }

    public FieldContract plus(FieldContract other) {
        return plus(other.reads(), other.writes());
    }

    public Set<String> readNames() {
        Set<String> names = new LinkedHashSet<>();
        reads.forEach(f -> names.add(f.name()));
        return names;
    }

    public Set<String> writeNames() {
        Set<String> names = new LinkedHashSet<>();
        writes.forEach(f -> names.add(f.name()));
        return names;
    }

    private static List<FieldSpec> concat(List<FieldSpec> base, Collection<FieldSpec> extra) {
        if (extra == null || extra.isEmpty()) return base;
        List<FieldSpec> merged = new ArrayList<>(base);
        for (FieldSpec spec : extra) {
            boolean sameTypedSpecPresent = merged.stream().anyMatch(s -> s.equals(spec));
            if (!sameTypedSpecPresent) {
                merged.add(spec);
            }
        }
        return merged;
    }
}
