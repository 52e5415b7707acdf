package ai.dblookup.model;

import java.util.OptionalInt;

/**
 * Normalization applied at comparison sites. Stored field values stay raw;
 * only the compared copies go through here.
 */
public final class Names {

    private static final String NAMESPACE_SEPARATOR = "::";

    private Names() {
    }

    /**
     * Removes every literal double quote. Table fields may be quote-wrapped
     * and the same quote can appear embedded in encoded ids.
     */
    public static String unquote(String field) {
        if (field == null) {
            return "";
        }
        return field.replace("\"", "");
    }

    /** Unquoted and trimmed, the form ids are compared in. */
    public static String normalizeId(String field) {
        return unquote(field).strip();
    }

    /**
     * Text after the last {@code ::}, e.g. {@code ns::Foo::bar -> bar}.
     */
    public static String stripNamespace(String name) {
        if (name == null) {
            return "";
        }
        final int i = name.lastIndexOf(NAMESPACE_SEPARATOR);
        return i >= 0 ? name.substring(i + NAMESPACE_SEPARATOR.length()) : name;
    }

    public static OptionalInt parseLine(String field) {
        final String raw = normalizeId(field);
        if (raw.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }
}
