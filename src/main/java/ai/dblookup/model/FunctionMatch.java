package ai.dblookup.model;

/**
 * Result of a by-name function lookup: the matched row and the known function
 * whose id led the scan to it.
 */
public record FunctionMatch(FunctionRecord function, FunctionRecord via) {
}
