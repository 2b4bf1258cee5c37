package net.morkit.util.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import net.morkit.api.parser.InvalidGrammarException;
import net.morkit.util.Formats;

/**
 * A context-free grammar expressed as data.
 * Productions whose only symbol is a Terminal define tokens; all other
 * productions may only reference tokens or other productions via
 * Nonterminal-s. Ignored tokens are skipped by the lexer in front of every
 * token; declared tokens have no pattern and are produced by a pre-pass over
 * the token stream instead.
 */
public class Grammar {

    public interface Symbol {

        /* Do not generate an own parsing tree node for this symbol. */
        int SYM_INLINE = 1;
        /* Discard any parsing tree nodes stemming from this symbol. */
        int SYM_DISCARD = 2;
        /* Optionally skip this symbol (regular expression x?).
         * If the symbol is not matched, no parse tree is generated for it. */
        int SYM_OPTIONAL = 4;
        /* Permit repetitions of this symbol (regular expression x+).
         * Combine with SYM_OPTIONAL to permit any amount of repetitions
         * (regular expression x*). */
        int SYM_REPEAT = 8;

        int getFlags();

    }

    public static abstract class AbstractSymbol implements Symbol {

        private final int flags;

        public AbstractSymbol(int flags) {
            this.flags = flags;
        }

        public String toString() {
            return formatWithFlags(toStringBase(), getFlags());
        }

        protected abstract String toStringBase();

        public int getFlags() {
            return flags;
        }

        public boolean isOptional() {
            return (flags & SYM_OPTIONAL) != 0;
        }

        public boolean isRepeated() {
            return (flags & SYM_REPEAT) != 0;
        }

    }

    public static class Nonterminal extends AbstractSymbol {

        private final String reference;

        public Nonterminal(String reference, int flags) {
            super(flags);
            if (reference == null)
                throw new NullPointerException(
                    "Nonterminal reference may not be null");
            this.reference = reference;
        }

        protected String toStringBase() {
            return getReference();
        }

        public boolean equals(Object other) {
            if (! (other instanceof Nonterminal)) return false;
            Nonterminal no = (Nonterminal) other;
            return (getFlags() == no.getFlags() &&
                    getReference().equals(no.getReference()));
        }

        public int hashCode() {
            return reference.hashCode() ^ getFlags();
        }

        public String getReference() {
            return reference;
        }

    }

    public static class Terminal extends AbstractSymbol {

        private final Pattern pattern;

        public Terminal(Pattern pattern, int flags) {
            super(flags);
            if (pattern == null)
                throw new NullPointerException(
                    "Terminal pattern may not be null");
            this.pattern = pattern;
        }

        protected String toStringBase() {
            return "/" + getPattern().pattern() + "/";
        }

        public Pattern getPattern() {
            return pattern;
        }

        /**
         * Ties between equally long matches are broken in favor of the
         * higher rank.
         */
        public int getMatchRank() {
            return 0;
        }

        /**
         * How this terminal is presented to users in error messages.
         */
        public String describe(String tokenName) {
            return tokenName;
        }

    }

    public static class FixedTerminal extends Terminal {

        private final String content;

        public FixedTerminal(String content, int flags) {
            super(Pattern.compile(Pattern.quote(content)), flags);
            this.content = content;
        }

        protected String toStringBase() {
            return Formats.formatString(getContent());
        }

        public String getContent() {
            return content;
        }

        public int getMatchRank() {
            return 100;
        }

        public String describe(String tokenName) {
            return Formats.formatString(getContent());
        }

    }

    public static class Production {

        public static final Pattern NAME_PATTERN = Pattern.compile(
            "[a-zA-Z$_][A-Za-z0-9$_-]*");

        private final String name;
        private final List<Symbol> symbols;

        public Production(String name, List<Symbol> symbols) {
            if (name == null)
                throw new NullPointerException(
                    "Production name may not be null");
            if (symbols == null)
                throw new NullPointerException(
                    "Production symbols may not be null");
            this.name = name;
            this.symbols = Collections.unmodifiableList(
                new ArrayList<Symbol>(symbols));
        }
        public Production(String name, Symbol... symbols) {
            this(name, Arrays.asList(symbols));
        }

        public String toString() {
            StringBuilder sb = new StringBuilder(getName()).append(" =");
            if (symbols.isEmpty()) sb.append(" %");
            for (Symbol s : symbols) sb.append(' ').append(s);
            return sb.toString();
        }

        public String getName() {
            return name;
        }

        public List<Symbol> getSymbols() {
            return symbols;
        }

        public boolean isTokenDefinition() {
            return (symbols.size() == 1 &&
                    symbols.get(0) instanceof Terminal);
        }

    }

    public static final String START_SYMBOL = "$start";

    private final Map<String, List<Production>> productions;
    private final Set<String> ignoredTokens;
    private final Set<String> declaredTokens;

    public Grammar() {
        productions = new LinkedHashMap<String, List<Production>>();
        ignoredTokens = new LinkedHashSet<String>();
        declaredTokens = new LinkedHashSet<String>();
    }
    public Grammar(Production... productions) {
        this();
        for (Production p : productions) addProduction(p);
    }

    public String toString() {
        return String.format("%s@%h[productions=%s,ignored=%s,declared=%s]",
            getClass().getName(), this, productions.keySet(),
            ignoredTokens, declaredTokens);
    }

    public Set<String> getProductionNames() {
        return Collections.unmodifiableSet(productions.keySet());
    }
    public List<Production> getProductions(String name) {
        List<Production> ret = productions.get(name);
        if (ret == null) return Collections.emptyList();
        return Collections.unmodifiableList(ret);
    }

    public Set<String> getIgnoredTokens() {
        return Collections.unmodifiableSet(ignoredTokens);
    }
    public Set<String> getDeclaredTokens() {
        return Collections.unmodifiableSet(declaredTokens);
    }

    public void addProduction(Production prod) {
        List<Production> group = productions.get(prod.getName());
        if (group == null) {
            group = new ArrayList<Production>();
            productions.put(prod.getName(), group);
        }
        group.add(prod);
    }

    /**
     * Mark the given token as insignificant; it is skipped wherever it
     * occurs between other tokens.
     */
    public void ignoreToken(String name) {
        ignoredTokens.add(name);
    }

    /**
     * Declare a token that has no pattern and is injected into the token
     * stream by other means.
     */
    public void declareToken(String name) {
        declaredTokens.add(name);
    }

    public boolean isToken(String name) {
        if (declaredTokens.contains(name)) return true;
        List<Production> group = productions.get(name);
        return (group != null && group.size() == 1 &&
                group.get(0).isTokenDefinition());
    }

    public Terminal getTokenTerminal(String name) {
        List<Production> group = productions.get(name);
        if (group == null || group.size() != 1 ||
                ! group.get(0).isTokenDefinition())
            return null;
        return (Terminal) group.get(0).getSymbols().get(0);
    }

    public void validate() throws InvalidGrammarException {
        if (! productions.containsKey(START_SYMBOL))
            throw new InvalidGrammarException("Missing start symbol");
        for (Map.Entry<String, List<Production>> ent :
             productions.entrySet()) {
            String name = ent.getKey();
            if (! Production.NAME_PATTERN.matcher(name).matches())
                throw new InvalidGrammarException("Invalid production " +
                    "name " + name);
            if (declaredTokens.contains(name))
                throw new InvalidGrammarException("Declared token " + name +
                    " may not have productions");
            for (Production p : ent.getValue()) {
                if (p.isTokenDefinition()) {
                    if (ent.getValue().size() != 1)
                        throw new InvalidGrammarException("Token " + name +
                            " must be defined by exactly one production");
                    continue;
                }
                for (Symbol s : p.getSymbols()) {
                    if (! (s instanceof Nonterminal))
                        throw new InvalidGrammarException("Production " +
                            p + " contains a raw terminal " + s);
                    String ref = ((Nonterminal) s).getReference();
                    if (! productions.containsKey(ref) &&
                            ! declaredTokens.contains(ref))
                        throw new InvalidGrammarException("Symbol " + s +
                            " in " + name +
                            " references a nonexistent production");
                }
            }
        }
        for (String name : ignoredTokens) {
            if (getTokenTerminal(name) == null)
                throw new InvalidGrammarException("Ignored symbol " + name +
                    " is not a token with a pattern");
        }
    }

    protected static String formatWithFlags(String base, int flags) {
        StringBuilder sb = new StringBuilder();
        if ((flags & Symbol.SYM_INLINE) != 0) sb.append('^');
        if ((flags & Symbol.SYM_DISCARD) != 0) sb.append('~');
        sb.append(base);
        switch (flags & (Symbol.SYM_OPTIONAL | Symbol.SYM_REPEAT)) {
            case Symbol.SYM_OPTIONAL: sb.append('?'); break;
            case Symbol.SYM_REPEAT: sb.append('+'); break;
            case Symbol.SYM_OPTIONAL | Symbol.SYM_REPEAT:
                sb.append('*');
                break;
        }
        return sb.toString();
    }

    /* Construction helpers for grammars defined in code. */

    protected static Production terminal(String name, String content) {
        return new Production(name, new FixedTerminal(content,
                                                      Symbol.SYM_INLINE));
    }
    protected static Production pattern(String name, String regex) {
        return new Production(name, new Terminal(Pattern.compile(regex),
                                                 Symbol.SYM_INLINE));
    }
    protected static Nonterminal nt(String reference, int flags) {
        return new Nonterminal(reference, flags);
    }
    protected static Nonterminal nt(String reference) {
        return nt(reference, 0);
    }
    protected static Production prod(String name, Symbol... symbols) {
        return new Production(name, symbols);
    }

}
