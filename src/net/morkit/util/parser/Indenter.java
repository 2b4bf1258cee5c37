package net.morkit.util.parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import net.morkit.api.parser.MatchingException;
import net.morkit.api.parser.TextLocation;

/**
 * A TokenSource filter that turns changes of indentation into tokens.
 * Whenever a newline token (whose content includes the leading whitespace
 * of the following line) is consumed, the width of that whitespace is
 * compared against a stack of open indentation levels: a deeper line opens
 * a level and produces an indent token, a shallower one closes one level per
 * dedent token. At the end of input, all open levels are closed.
 */
public class Indenter implements TokenSource {

    public static final int TAB_WIDTH = 4;

    private final TokenSource source;
    private final String newlineToken;
    private final String indentToken;
    private final String dedentToken;
    private final List<Integer> levels;
    private final LinkedList<Token> pending;

    public Indenter(TokenSource source, String newlineToken,
                    String indentToken, String dedentToken) {
        if (source == null)
            throw new NullPointerException(
                "Indenter source may not be null");
        this.source = source;
        this.newlineToken = newlineToken;
        this.indentToken = indentToken;
        this.dedentToken = dedentToken;
        this.levels = new ArrayList<Integer>();
        this.pending = new LinkedList<Token>();
        levels.add(0);
    }

    public String getSourceName() {
        return source.getSourceName();
    }

    public int getDepth() {
        return levels.size() - 1;
    }

    public void setSelection(Selection sel) {
        source.setSelection(sel);
    }

    public TextLocation getCurrentLocation() {
        if (! pending.isEmpty()) return pending.getFirst().getStart();
        return source.getCurrentLocation();
    }

    public Token getCurrentToken() {
        if (! pending.isEmpty()) return pending.getFirst();
        return source.getCurrentToken();
    }

    public MatchStatus peek(boolean required) throws MatchingException {
        if (! pending.isEmpty()) return MatchStatus.OK;
        MatchStatus ret = source.peek(required);
        if (ret == MatchStatus.EOI && levels.size() > 1) {
            TextLocation pos = source.getCurrentLocation();
            while (levels.size() > 1) {
                levels.remove(levels.size() - 1);
                pending.add(Token.synthetic(dedentToken, pos));
            }
            return MatchStatus.OK;
        }
        return ret;
    }

    public Token next() throws MatchingException {
        if (! pending.isEmpty()) return pending.removeFirst();
        Token ret = source.next();
        if (ret.getName().equals(newlineToken)) processNewline(ret);
        return ret;
    }

    protected void processNewline(Token tok) throws MatchingException {
        int width = measure(tok.getContent());
        int top = levels.get(levels.size() - 1);
        TextLocation pos = tok.getEnd();
        if (width > top) {
            levels.add(width);
            pending.add(Token.synthetic(indentToken, pos));
            return;
        }
        while (width < levels.get(levels.size() - 1)) {
            levels.remove(levels.size() - 1);
            pending.add(Token.synthetic(dedentToken, pos));
        }
        if (width != levels.get(levels.size() - 1))
            throw new MatchingException(getSourceName(), pos,
                "Unindent to width " + width + " does not match any " +
                "outer indentation level");
    }

    /**
     * Measure the indentation following the last line break in text.
     * Spaces count as one column and tabs as TAB_WIDTH columns.
     */
    public static int measure(String text) {
        int start = Math.max(text.lastIndexOf('\n'),
                             text.lastIndexOf('\r')) + 1;
        int ret = 0;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ' ') {
                ret++;
            } else if (ch == '\t') {
                ret += TAB_WIDTH;
            }
        }
        return ret;
    }

    public void close() throws IOException {
        pending.clear();
        source.close();
    }

}
