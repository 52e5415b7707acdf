package ai.dblookup.resolve;

import java.util.List;

import ai.dblookup.model.Names;

/**
 * The two passes of a name lookup. STRICT always runs first; FALLBACK runs at
 * most once, after a strict miss or when the caller asks for it directly.
 */
public enum MatchPhase {

    STRICT {
        @Override
        public boolean accepts(String storedName, String term) {
            return Names.unquote(storedName).equals(term);
        }
    },
    FALLBACK {
        @Override
        public boolean accepts(String storedName, String term) {
            final String name = Names.unquote(storedName);
            return name.equals(term) || name.contains(term);
        }
    };

    private static final List<MatchPhase> BOTH = List.of(STRICT, FALLBACK);
    private static final List<MatchPhase> FALLBACK_ONLY = List.of(FALLBACK);

    /**
     * @param storedName raw field text, possibly quoted
     * @param term       namespace-stripped search term
     */
    public abstract boolean accepts(String storedName, String term);

    public static List<MatchPhase> sequence(boolean lessStrict) {
        return lessStrict ? FALLBACK_ONLY : BOTH;
    }
}
