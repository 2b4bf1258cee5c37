package net.morkit.util.parser;

import java.io.Closeable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.morkit.api.parser.MatchingException;
import net.morkit.api.parser.TextLocation;

public interface TokenSource extends Closeable {

    /* The tokens a consumer is prepared to accept at some point. Names
     * without a pattern refer to declared tokens. */
    final class Selection {

        private final Set<String> names;
        private final Map<String, TokenPattern> patterns;

        public Selection(Set<String> names,
                         Map<String, TokenPattern> patterns) {
            this.names = Collections.unmodifiableSet(
                new LinkedHashSet<String>(names));
            this.patterns = Collections.unmodifiableMap(
                new LinkedHashMap<String, TokenPattern>(patterns));
        }

        public String toString() {
            return String.format("%s@%h%s", getClass().getSimpleName(), this,
                                 names);
        }

        public boolean equals(Object other) {
            return (other instanceof Selection &&
                    names.equals(((Selection) other).names));
        }

        public int hashCode() {
            return names.hashCode();
        }

        public Set<String> getNames() {
            return names;
        }

        public Map<String, TokenPattern> getPatterns() {
            return patterns;
        }

        public boolean contains(String tokenName) {
            return names.contains(tokenName);
        }

    }

    enum MatchStatus { OK, NO_MATCH, EOI }

    String getSourceName();

    void setSelection(Selection sel);

    TextLocation getCurrentLocation();

    Token getCurrentToken();

    MatchStatus peek(boolean required) throws MatchingException;

    Token next() throws MatchingException;

}
