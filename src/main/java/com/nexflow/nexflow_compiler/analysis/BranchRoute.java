package com.nexflow.nexflow_compiler.analysis;

/**
 * One outcome of a branch point.
 *
 * @param key        route key returned by the routing function, unique within its branch point
 * @param targetId   node the route leads to
 * @param pythonTest boolean expression over {@code state} that selects this route
 * @param edgeRef    edge the route was built from
 */
public record BranchRoute(String key, String targetId, String pythonTest, String edgeRef) {}
