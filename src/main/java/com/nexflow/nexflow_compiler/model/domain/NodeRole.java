package com.nexflow.nexflow_compiler.model.domain;

public enum NodeRole {
    NONE,
    ENTRY,   // marked input/start in the export
    FINISH   // marked output/end in the export
}
