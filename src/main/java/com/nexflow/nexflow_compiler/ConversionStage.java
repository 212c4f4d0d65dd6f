package com.nexflow.nexflow_compiler;

public enum ConversionStage {
    PARSE,       // reading and parsing the export
    MAPPING,     // node type → category
    SCHEMA,      // state schema synthesis
    ANALYSIS,    // entry/finish, edge classification, loops
    GENERATION,  // program text emission
    VALIDATION,  // structural check and repair of the emitted text
    OUTPUT       // writing the artifact
}
