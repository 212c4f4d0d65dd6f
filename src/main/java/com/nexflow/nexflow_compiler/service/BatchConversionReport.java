package com.nexflow.nexflow_compiler.service;

import java.util.List;

/** Per-file outcomes of a batch run, in input file order. */
public record BatchConversionReport(int total, int succeeded, int failed, List<Entry> entries) {

    public record Entry(String input, String output, boolean success, String stage, String message,
                        List<String> warnings) {}

    static BatchConversionReport of(List<Entry> entries) {
        int ok = (int) entries.stream().filter(Entry::success).count();
        return new BatchConversionReport(entries.size(), ok, entries.size() - ok, List.copyOf(entries));
    }
}
