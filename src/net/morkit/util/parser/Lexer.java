package net.morkit.util.parser;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import net.morkit.api.parser.MatchingException;
import net.morkit.api.parser.TextLocation;
import net.morkit.util.Formats;
import net.morkit.util.Locations;

/**
 * A contextual tokenizer.
 * Only the patterns of the current selection are tried; among those the
 * longest match wins, and equally long matches are decided by match rank.
 * Ignored patterns are skipped in front of every token regardless of the
 * selection.
 */
public class Lexer implements TokenSource {

    private static final int BUFFER_SIZE = 8192;

    private final String sourceName;
    private final Reader input;
    private final StringBuilder inputBuffer;
    private final Locations.LocationTracker inputPosition;
    private final List<TokenPattern> ignored;
    private final Map<String, Matcher> matchers;
    private Selection selection;
    private boolean atEOI;
    private MatchStatus matchStatus;
    private Token currentToken;

    public Lexer(String sourceName, Reader input,
                 List<TokenPattern> ignored, TextLocation origin) {
        if (input == null)
            throw new NullPointerException("Lexer input may not be null");
        this.sourceName = sourceName;
        this.input = input;
        this.inputBuffer = new StringBuilder();
        this.inputPosition = (origin == null) ?
            new Locations.LocationTracker() :
            new Locations.LocationTracker(origin);
        this.ignored = new ArrayList<TokenPattern>(ignored);
        this.matchers = new HashMap<String, Matcher>();
        this.selection = null;
        this.atEOI = false;
        this.matchStatus = null;
        this.currentToken = null;
    }
    public Lexer(String sourceName, Reader input,
                 List<TokenPattern> ignored) {
        this(sourceName, input, ignored, null);
    }

    public String getSourceName() {
        return sourceName;
    }

    public TextLocation getCurrentLocation() {
        return inputPosition.freeze();
    }

    protected Selection getSelection() {
        return selection;
    }
    public void setSelection(Selection s) {
        if (s == null ? selection == null : s.equals(selection)) return;
        selection = s;
        matchStatus = null;
        currentToken = null;
    }

    public Token getCurrentToken() {
        return currentToken;
    }

    protected Matcher getMatcher(TokenPattern pat) {
        Matcher m = matchers.get(pat.getName());
        if (m == null) {
            m = pat.matcher(inputBuffer);
            matchers.put(pat.getName(), m);
        } else {
            m.reset(inputBuffer);
        }
        return m;
    }

    protected int pullInput() throws MatchingException {
        char[] data = new char[BUFFER_SIZE];
        int ret;
        try {
            ret = input.read(data);
        } catch (IOException exc) {
            throw new MatchingException(sourceName, getCurrentLocation(),
                "Could not read input: " + exc.getMessage(), exc);
        }
        if (ret < 0) {
            atEOI = true;
            return ret;
        }
        inputBuffer.append(data, 0, ret);
        return ret;
    }

    protected void consume(int length) {
        inputPosition.advance(inputBuffer, 0, length);
        inputBuffer.delete(0, length);
    }

    protected void skipIgnored() throws MatchingException {
        outer: for (;;) {
            int best = 0;
            for (TokenPattern pat : ignored) {
                Matcher m = getMatcher(pat);
                boolean matched = m.lookingAt();
                if (m.hitEnd() && ! atEOI) {
                    pullInput();
                    continue outer;
                }
                if (matched && m.end() > best) best = m.end();
            }
            if (best == 0) return;
            consume(best);
        }
    }

    /* Returns EOI if more input is needed to decide. */
    protected MatchStatus doMatchBuffer() throws MatchingException {
        if (selection == null) return MatchStatus.NO_MATCH;
        TokenPattern best = null;
        int bestSize = Integer.MIN_VALUE;
        int bestRank = Integer.MIN_VALUE;
        for (TokenPattern pat : selection.getPatterns().values()) {
            Matcher m = getMatcher(pat);
            boolean matched = m.lookingAt();
            if (m.hitEnd() && ! atEOI) return MatchStatus.EOI;
            if (! matched || m.end() == 0) continue;
            int thisSize = m.end();
            int thisRank = pat.getMatchRank();
            if (thisSize < bestSize ||
                    (thisSize == bestSize && thisRank < bestRank)) {
                continue;
            } else if (thisSize == bestSize && thisRank == bestRank) {
                throw new MatchingException(sourceName, getCurrentLocation(),
                    "Ambiguous classifications for prospective token " +
                    Formats.formatString(m.group()) + ": " +
                    best.getName() + " and " + pat.getName());
            }
            best = pat;
            bestSize = thisSize;
            bestRank = thisRank;
        }
        if (best == null) return MatchStatus.NO_MATCH;
        TextLocation start = getCurrentLocation();
        String content = inputBuffer.substring(0, bestSize);
        currentToken = new Token(best.getName(), start,
                                 Locations.after(start, content), content);
        return MatchStatus.OK;
    }
    protected MatchStatus doMatch() throws MatchingException {
        for (;;) {
            skipIgnored();
            switch (doMatchBuffer()) {
                case OK:
                    return MatchStatus.OK;
                case NO_MATCH:
                    if (inputBuffer.length() != 0)
                        return MatchStatus.NO_MATCH;
                    if (atEOI) return MatchStatus.EOI;
                    pullInput();
                    break;
                case EOI:
                    pullInput();
                    break;
            }
        }
    }

    protected MatchingException unexpectedInput() {
        String message = (inputBuffer.length() == 0) ?
            "Unexpected end of input" :
            "Unexpected character " + Formats.formatCharacter(
                Character.codePointAt(inputBuffer, 0));
        return new MatchingException(sourceName, getCurrentLocation(),
                                     message);
    }

    public MatchStatus peek(boolean required) throws MatchingException {
        if (matchStatus == null) {
            matchStatus = doMatch();
            if (matchStatus != MatchStatus.OK) currentToken = null;
        }
        if (required && matchStatus == MatchStatus.NO_MATCH)
            throw unexpectedInput();
        return matchStatus;
    }

    public Token next() throws MatchingException {
        MatchStatus st = peek(true);
        if (st == MatchStatus.EOI)
            throw new MatchingException(sourceName, getCurrentLocation(),
                                        "No more input to advance past");
        Token tok = currentToken;
        consume(tok.getContent().length());
        matchStatus = null;
        currentToken = null;
        return tok;
    }

    public void close() throws IOException {
        input.close();
        inputBuffer.setLength(0);
        matchers.clear();
        selection = null;
        atEOI = true;
        matchStatus = null;
        currentToken = null;
    }

}
