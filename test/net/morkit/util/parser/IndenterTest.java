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

class IndenterTest {

    private static Indenter indenter(String text) {
        TokenPattern word = new TokenPattern("Word",
            new Grammar.Terminal(Pattern.compile("[a-z]+"), 0));
        TokenPattern newlines = new TokenPattern("Newlines",
            new Grammar.Terminal(
                Pattern.compile("(?:(?:\r\n?|\n)[ \t]*)+"), 0));
        TokenPattern space = new TokenPattern("Space",
            new Grammar.Terminal(Pattern.compile("[ \t]+"), 0));
        Lexer lx = new Lexer("test", new StringReader(text),
                             Collections.singletonList(space));
        Map<String, TokenPattern> sel =
            new LinkedHashMap<String, TokenPattern>();
        sel.put("Word", word);
        sel.put("Newlines", newlines);
        Indenter ret = new Indenter(lx, "Newlines", "Indent", "Dedent");
        ret.setSelection(new TokenSource.Selection(sel.keySet(), sel));
        return ret;
    }

    private static List<String> names(Indenter source)
            throws MatchingException {
        List<String> ret = new ArrayList<String>();
        while (source.peek(true) == TokenSource.MatchStatus.OK)
            ret.add(source.next().getName());
        return ret;
    }

    @Test
    void emitsIndentAndDedentTokens() throws MatchingException {
        assertThat(names(indenter("a\n    b\n        c\nd\n")))
            .containsExactly("Word", "Newlines", "Indent", "Word",
                             "Newlines", "Indent", "Word", "Newlines",
                             "Dedent", "Dedent", "Word", "Newlines");
    }

    @Test
    void tabsCountAsFourColumns() {
        assertThat(Indenter.measure("\n\t  ")).isEqualTo(6);
        assertThat(Indenter.measure("x\n\n  ")).isEqualTo(2);
    }

    @Test
    void closesOpenLevelsAtEndOfInput() throws MatchingException {
        Indenter source = indenter("a\n\tb");

        assertThat(names(source)).containsExactly("Word", "Newlines",
            "Indent", "Word", "Dedent");
        assertThat(source.getDepth()).isZero();
    }

    @Test
    void rejectsUnindentToUnknownLevel() throws MatchingException {
        Indenter source = indenter("a\n    b\n  c\n");
        source.next();
        source.next();
        source.next();
        source.next();

        assertThatThrownBy(source::next)
            .isInstanceOf(MatchingException.class)
            .hasMessageContaining("Unindent to width 2");
    }

}
