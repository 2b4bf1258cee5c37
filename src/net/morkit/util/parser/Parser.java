package net.morkit.util.parser;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import net.morkit.api.parser.InvalidGrammarException;
import net.morkit.api.parser.MatchingException;
import net.morkit.api.parser.ParseTree;
import net.morkit.api.parser.ParsingException;
import net.morkit.api.parser.TextLocation;
import net.morkit.util.Formats;
import net.morkit.util.parser.TokenSource.Selection;

/**
 * A deterministic parser with one token of lookahead.
 * Grammars are compiled once into a CompiledGrammar, which is immutable and
 * may be shared; each input is then parsed by a fresh Parser instance
 * reading from its own TokenSource. At every point where the parser has to
 * decide (which alternative of a production to take, whether to enter an
 * optional or repeated symbol), the token source is restricted to the
 * tokens that may legally occur there.
 */
public class Parser implements Closeable {

    public static class CompiledGrammar {

        private final Grammar source;
        private final Map<String, Rule> rules;
        private final Map<String, TokenPattern> patterns;
        private final List<TokenPattern> ignored;

        protected CompiledGrammar(Grammar source, Map<String, Rule> rules,
                                  Map<String, TokenPattern> patterns,
                                  List<TokenPattern> ignored) {
            this.source = source;
            this.rules = rules;
            this.patterns = patterns;
            this.ignored = ignored;
        }

        public String toString() {
            return String.format("%s@%h[source=%s]", getClass().getName(),
                                 this, source);
        }

        public Grammar getSource() {
            return source;
        }

        protected Rule getRule(String name) {
            return rules.get(name);
        }

        protected Rule getStartRule() {
            return rules.get(Grammar.START_SYMBOL);
        }

        public Lexer createLexer(String sourceName, Reader input,
                                 TextLocation origin) {
            return new Lexer(sourceName, input, ignored, origin);
        }
        public Lexer createLexer(String sourceName, Reader input) {
            return createLexer(sourceName, input, null);
        }

        public Parser createParser(TokenSource tokens) {
            return new Parser(this, tokens);
        }

        public Selection select(Collection<String> names) {
            Map<String, TokenPattern> sel =
                new LinkedHashMap<String, TokenPattern>();
            for (String n : names) {
                TokenPattern p = patterns.get(n);
                if (p != null) sel.put(n, p);
            }
            return new Selection(new LinkedHashSet<String>(names), sel);
        }

        /**
         * How the given token is named in error messages.
         */
        public String describe(String tokenName) {
            TokenPattern p = patterns.get(tokenName);
            if (p == null) return tokenName;
            return p.describe();
        }

    }

    protected static class Step {

        private final Grammar.Nonterminal symbol;
        private final boolean token;
        private Set<String> first;
        private boolean nullable;
        private Selection lookahead;
        private Selection tokenSelection;

        public Step(Grammar.Nonterminal symbol, boolean token) {
            this.symbol = symbol;
            this.token = token;
        }

        public String toString() {
            return symbol.toString();
        }

        public String getReference() {
            return symbol.getReference();
        }

        public boolean isToken() {
            return token;
        }

        public boolean isOptional() {
            return symbol.isOptional();
        }

        public boolean isRepeated() {
            return symbol.isRepeated();
        }

        public boolean isInline() {
            return (symbol.getFlags() & Grammar.Symbol.SYM_INLINE) != 0;
        }

        public boolean isDiscarded() {
            return (symbol.getFlags() & Grammar.Symbol.SYM_DISCARD) != 0;
        }

        /* Whether this step may match no input at all. */
        public boolean isSkippable() {
            return isOptional() || nullable;
        }

    }

    protected static class Alternative {

        private final Grammar.Production production;
        private final List<Step> steps;
        private final Set<String> first;
        private boolean nullable;

        public Alternative(Grammar.Production production, List<Step> steps) {
            this.production = production;
            this.steps = steps;
            this.first = new LinkedHashSet<String>();
        }

        public String toString() {
            return production.toString();
        }

    }

    protected static class Rule {

        private final String name;
        private final List<Alternative> alternatives;
        private final Set<String> first;
        private final Map<String, Alternative> dispatch;
        private boolean nullable;
        private Alternative fallback;
        private Selection selection;

        public Rule(String name) {
            this.name = name;
            this.alternatives = new ArrayList<Alternative>();
            this.first = new LinkedHashSet<String>();
            this.dispatch = new LinkedHashMap<String, Alternative>();
        }

        public String toString() {
            return String.format("%s@%h[name=%s]",
                getClass().getSimpleName(), this, name);
        }

    }

    protected static class ParseTreeImpl implements ParseTree {

        private final String name;
        private final String content;
        private final List<ParseTree> children;
        private final List<ParseTree> childrenView;
        private TextLocation start;
        private TextLocation end;

        public ParseTreeImpl(Token token) {
            this.name = token.getName();
            this.content = token.getContent();
            this.children = Collections.emptyList();
            this.childrenView = children;
            this.start = token.getStart();
            this.end = token.getEnd();
        }
        public ParseTreeImpl(String name) {
            this.name = name;
            this.content = null;
            this.children = new ArrayList<ParseTree>();
            this.childrenView = Collections.unmodifiableList(children);
        }

        public String toString() {
            return String.format("%s@%h[name=%s,start=%s,children=%s]",
                getClass().getName(), this, name, start, children.size());
        }

        public String getName() {
            return name;
        }

        public String getContent() {
            return content;
        }

        public TextLocation getStart() {
            return start;
        }

        public TextLocation getEnd() {
            return end;
        }

        public List<ParseTree> getChildren() {
            return childrenView;
        }

        public int childCount() {
            return children.size();
        }

        public ParseTree childAt(int index) {
            return children.get(index);
        }

        protected void addChild(ParseTree child) {
            children.add(child);
        }

        protected void extend(TextLocation s, TextLocation e) {
            if (s == null) return;
            if (start == null) start = s;
            end = e;
        }

    }

    private static final Logger LOGGER = Logger.getLogger("Parser");

    private static final String END_OF_INPUT = "end of input";

    private final CompiledGrammar grammar;
    private final TokenSource source;
    private final List<Set<String>> expectations;
    private ParseTree result;

    public Parser(CompiledGrammar grammar, TokenSource source) {
        if (grammar == null)
            throw new NullPointerException(
                "Parser grammar may not be null");
        if (source == null)
            throw new NullPointerException(
                "Parser token source may not be null");
        this.grammar = grammar;
        this.source = source;
        this.expectations = new ArrayList<Set<String>>();
    }

    public CompiledGrammar getGrammar() {
        return grammar;
    }

    public TokenSource getTokenSource() {
        return source;
    }

    /**
     * Parse the whole input.
     * The tree is built completely or not at all; subsequent calls return
     * the same tree.
     */
    public ParseTree parse() throws MatchingException, ParsingException {
        if (result != null) return result;
        ParseTreeImpl root = new ParseTreeImpl(Grammar.START_SYMBOL);
        parseRule(grammar.getStartRule(), root);
        Set<String> names = new LinkedHashSet<String>();
        for (Set<String> exp : expectations) names.addAll(exp);
        source.setSelection(grammar.select(names));
        if (source.peek(false) != TokenSource.MatchStatus.EOI) {
            expectations.add(Collections.singleton(END_OF_INPUT));
            throw unexpected();
        }
        result = root;
        return result;
    }

    protected void parseRule(Rule rule, ParseTreeImpl target)
            throws MatchingException, ParsingException {
        Alternative alt = chooseAlternative(rule);
        for (Step st : alt.steps) {
            if (st.isOptional() && ! lookingAt(st)) continue;
            parseStep(st, target);
            if (! st.isRepeated()) continue;
            while (lookingAt(st)) parseStep(st, target);
        }
    }

    protected Alternative chooseAlternative(Rule rule)
            throws MatchingException, ParsingException {
        if (rule.alternatives.size() == 1) return rule.alternatives.get(0);
        source.setSelection(rule.selection);
        if (source.peek(false) == TokenSource.MatchStatus.OK) {
            Alternative ret = rule.dispatch.get(
                source.getCurrentToken().getName());
            if (ret != null) return ret;
        }
        expectations.add(rule.first);
        if (rule.fallback != null) return rule.fallback;
        throw unexpected();
    }

    protected boolean lookingAt(Step st) throws MatchingException {
        source.setSelection(st.lookahead);
        if (source.peek(false) == TokenSource.MatchStatus.OK &&
                st.first.contains(source.getCurrentToken().getName()))
            return true;
        expectations.add(st.first);
        return false;
    }

    protected void parseStep(Step st, ParseTreeImpl parent)
            throws MatchingException, ParsingException {
        if (st.isToken()) {
            source.setSelection(st.tokenSelection);
            if (source.peek(false) != TokenSource.MatchStatus.OK ||
                    ! source.getCurrentToken().getName().equals(
                        st.getReference())) {
                expectations.add(st.first);
                throw unexpected();
            }
            Token tok = source.next();
            expectations.clear();
            parent.extend(tok.getStart(), tok.getEnd());
            if (! st.isDiscarded()) parent.addChild(new ParseTreeImpl(tok));
            return;
        }
        Rule sub = grammar.getRule(st.getReference());
        if (st.isInline() && ! st.isDiscarded()) {
            parseRule(sub, parent);
            return;
        }
        ParseTreeImpl node = new ParseTreeImpl(st.getReference());
        parseRule(sub, node);
        parent.extend(node.getStart(), node.getEnd());
        if (! st.isDiscarded()) parent.addChild(node);
    }

    protected ParsingException unexpected() {
        Set<String> accum = new LinkedHashSet<String>();
        for (Set<String> exp : expectations) {
            for (String name : exp) {
                if (name.equals(END_OF_INPUT)) {
                    accum.add(name);
                } else {
                    accum.add(grammar.describe(name));
                }
            }
        }
        List<String> expected = new ArrayList<String>(accum);
        String tail = ", expected " + Formats.formatAlternatives(expected);
        try {
            if (source.peek(true) == TokenSource.MatchStatus.EOI)
                return new ParsingException(source.getSourceName(),
                    source.getCurrentLocation(),
                    "Unexpected end of input" + tail, expected);
        } catch (MatchingException exc) {
            ParsingException ret = new ParsingException(
                source.getSourceName(), exc.getLocation(),
                exc.getDetail() + tail, expected);
            ret.initCause(exc);
            return ret;
        }
        Token tok = source.getCurrentToken();
        String found = (tok.getContent().isEmpty()) ?
            "token " + tok.getName() :
            "token " + Formats.formatString(tok.getContent()) + " (" +
                tok.getName() + ")";
        return new ParsingException(source.getSourceName(), tok.getStart(),
            "Unexpected " + found + tail, expected);
    }

    public void close() throws IOException {
        source.close();
    }

    /**
     * Validate the given grammar and prepare it for parsing.
     */
    public static CompiledGrammar compile(Grammar g)
            throws InvalidGrammarException {
        g.validate();
        Map<String, TokenPattern> patterns =
            new LinkedHashMap<String, TokenPattern>();
        Map<String, Rule> rules = new LinkedHashMap<String, Rule>();
        for (String name : g.getProductionNames()) {
            Grammar.Terminal term = g.getTokenTerminal(name);
            if (term != null) {
                patterns.put(name, new TokenPattern(name, term));
                continue;
            }
            Rule r = new Rule(name);
            for (Grammar.Production p : g.getProductions(name)) {
                List<Step> steps = new ArrayList<Step>();
                for (Grammar.Symbol s : p.getSymbols()) {
                    Grammar.Nonterminal ref = (Grammar.Nonterminal) s;
                    steps.add(new Step(ref, g.isToken(ref.getReference())));
                }
                r.alternatives.add(new Alternative(p, steps));
            }
            rules.put(name, r);
        }
        List<TokenPattern> ignored = new ArrayList<TokenPattern>();
        for (String name : g.getIgnoredTokens())
            ignored.add(patterns.get(name));
        CompiledGrammar ret = new CompiledGrammar(g, rules, patterns,
                                                  ignored);
        computeFirstSets(rules);
        checkLeftRecursion(rules);
        for (Rule r : rules.values()) prepareRule(ret, r);
        LOGGER.config("Compiled grammar with " + rules.size() +
                      " productions and " + patterns.size() + " tokens");
        return ret;
    }

    private static void computeFirstSets(Map<String, Rule> rules) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Rule r : rules.values()) {
                for (Alternative alt : r.alternatives) {
                    boolean nullable = true;
                    for (Step st : alt.steps) {
                        Set<String> sf;
                        if (st.isToken()) {
                            sf = Collections.singleton(st.getReference());
                        } else {
                            Rule sub = rules.get(st.getReference());
                            sf = sub.first;
                            if (st.nullable != sub.nullable) {
                                st.nullable = sub.nullable;
                                changed = true;
                            }
                        }
                        if (alt.first.addAll(sf)) changed = true;
                        if (! st.isSkippable()) {
                            nullable = false;
                            break;
                        }
                    }
                    if (nullable && ! alt.nullable) {
                        alt.nullable = true;
                        changed = true;
                    }
                    if (r.first.addAll(alt.first)) changed = true;
                    if (alt.nullable && ! r.nullable) {
                        r.nullable = true;
                        changed = true;
                    }
                }
            }
        }
        for (Rule r : rules.values()) {
            for (Alternative alt : r.alternatives) {
                for (Step st : alt.steps) {
                    st.first = (st.isToken()) ?
                        Collections.singleton(st.getReference()) :
                        rules.get(st.getReference()).first;
                }
            }
        }
    }

    private static void checkLeftRecursion(Map<String, Rule> rules)
            throws InvalidGrammarException {
        Set<String> done = new HashSet<String>();
        for (String name : rules.keySet()) {
            visitLeftmost(rules, name, new LinkedHashSet<String>(), done);
        }
    }

    private static void visitLeftmost(Map<String, Rule> rules, String name,
                                      Set<String> path, Set<String> done)
            throws InvalidGrammarException {
        if (done.contains(name)) return;
        if (! path.add(name))
            throw new InvalidGrammarException("Left recursion involving " +
                "productions " + path);
        for (Alternative alt : rules.get(name).alternatives) {
            for (Step st : alt.steps) {
                if (! st.isToken())
                    visitLeftmost(rules, st.getReference(), path, done);
                if (! st.isSkippable()) break;
            }
        }
        path.remove(name);
        done.add(name);
    }

    private static void prepareRule(CompiledGrammar cg, Rule r)
            throws InvalidGrammarException {
        for (Alternative alt : r.alternatives) {
            if (alt.nullable) {
                if (r.fallback != null)
                    throw new InvalidGrammarException("Production " +
                        r.name + " has more than one empty alternative");
                r.fallback = alt;
            }
            for (String tok : alt.first) {
                Alternative prev = r.dispatch.put(tok, alt);
                if (prev != null)
                    throw new InvalidGrammarException("Ambiguous " +
                        "alternatives for " + r.name + " on token " + tok +
                        ": " + prev + " and " + alt);
            }
            List<Step> steps = alt.steps;
            for (int i = 0; i < steps.size(); i++) {
                Step st = steps.get(i);
                st.tokenSelection = cg.select(st.first);
                if (! st.isOptional() && ! st.isRepeated()) continue;
                Set<String> rest = new LinkedHashSet<String>();
                for (int j = i + 1; j < steps.size(); j++) {
                    rest.addAll(steps.get(j).first);
                    if (! steps.get(j).isSkippable()) break;
                }
                for (String tok : st.first) {
                    if (rest.contains(tok))
                        throw new InvalidGrammarException("Ambiguous " +
                            "repetition of " + st + " in " + alt +
                            " on token " + tok);
                }
                Set<String> look = new LinkedHashSet<String>(st.first);
                look.addAll(rest);
                st.lookahead = cg.select(look);
            }
        }
        r.selection = cg.select(r.first);
    }

}
