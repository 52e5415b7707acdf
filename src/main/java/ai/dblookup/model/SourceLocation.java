package ai.dblookup.model;

/**
 * A caller reference decoded from the {@code file:line} fallback form.
 */
public record SourceLocation(String file, int line) {
}
