package net.morkit.util.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import net.morkit.api.parser.MatchingException;
import org.junit.jupiter.api.Test;

class LexerTest {

    private static final TokenPattern WORD = new TokenPattern("Word",
        new Grammar.Terminal(Pattern.compile("[a-z]+"), 0));
    private static final TokenPattern KEYWORD = new TokenPattern("If",
        new Grammar.FixedTerminal("if", 0));
    private static final TokenPattern NEWLINE = new TokenPattern("Newline",
        new Grammar.Terminal(Pattern.compile("\r\n?|\n"), 0));
    private static final TokenPattern SPACE = new TokenPattern("Space",
        new Grammar.Terminal(Pattern.compile("[ \t]+"), 0));

    private static TokenSource.Selection select(TokenPattern... pats) {
        Map<String, TokenPattern> map =
            new LinkedHashMap<String, TokenPattern>();
        for (TokenPattern p : pats) map.put(p.getName(), p);
        return new TokenSource.Selection(map.keySet(), map);
    }

    private static Lexer lexer(String text) {
        return new Lexer("test", new StringReader(text),
                         Collections.singletonList(SPACE));
    }

    @Test
    void tracksLinesAndColumnsAcrossLineBreaks() throws MatchingException {
        Lexer lx = lexer("ab  cd\r\nef");
        lx.setSelection(select(WORD, NEWLINE));
        List<Token> tokens = new ArrayList<Token>();
        while (lx.peek(true) == TokenSource.MatchStatus.OK)
            tokens.add(lx.next());

        assertThat(tokens).extracting(Token::getContent)
            .containsExactly("ab", "cd", "\r\n", "ef");
        assertThat(tokens.get(1).getStart().getColumn()).isEqualTo(5);
        assertThat(tokens.get(1).getEnd().getColumn()).isEqualTo(7);
        assertThat(tokens.get(3).getStart().getLine()).isEqualTo(2);
        assertThat(tokens.get(3).getStart().getColumn()).isEqualTo(1);
        assertThat(tokens.get(3).getStart().getCharacterIndex())
            .isEqualTo(8);
        assertThat(lx.peek(true)).isEqualTo(TokenSource.MatchStatus.EOI);
    }

    @Test
    void fixedTerminalsWinTiesAgainstPatterns() throws MatchingException {
        Lexer lx = lexer("if iffy");
        lx.setSelection(select(WORD, KEYWORD));

        assertThat(lx.next().getName()).isEqualTo("If");
        assertThat(lx.next().getName()).isEqualTo("Word");
    }

    @Test
    void onlySelectedTokensAreMatched() throws MatchingException {
        Lexer lx = lexer("if");
        lx.setSelection(select(NEWLINE));

        assertThat(lx.peek(false)).isEqualTo(
            TokenSource.MatchStatus.NO_MATCH);
        lx.setSelection(select(WORD));
        assertThat(lx.next().getName()).isEqualTo("Word");
    }

    @Test
    void equallyRankedTiesAreAnError() {
        TokenPattern other = new TokenPattern("Other",
            new Grammar.Terminal(Pattern.compile("[a-z]+"), 0));
        Lexer lx = lexer("abc");
        lx.setSelection(select(WORD, other));

        assertThatThrownBy(() -> lx.peek(false))
            .isInstanceOf(MatchingException.class)
            .hasMessageContaining("Ambiguous classifications");
    }

    @Test
    void unrecognizedInputReportsPosition() throws MatchingException {
        Lexer lx = lexer("ab\n  ?");
        lx.setSelection(select(WORD, NEWLINE));
        lx.next();
        lx.next();

        assertThatThrownBy(() -> lx.peek(true))
            .isInstanceOf(MatchingException.class)
            .hasMessage("test:2:3: Unexpected character '?'");
    }

}
