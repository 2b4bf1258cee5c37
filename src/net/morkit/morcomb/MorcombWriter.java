package net.morkit.morcomb;

import java.io.IOException;
import java.util.List;

/**
 * Renders Annotation-s back into sentence-annotation text.
 * Cells left empty by padding are dropped; the candidate lists of the
 * %mor: row are put on separate, tab-indented lines.
 */
public class MorcombWriter {

    private final Appendable output;

    public MorcombWriter(Appendable output) {
        if (output == null)
            throw new NullPointerException("Output may not be null");
        this.output = output;
    }

    public Appendable getOutput() {
        return output;
    }

    protected void emit(CharSequence text) {
        try {
            output.append(text);
        } catch (IOException exc) {
            throw new RuntimeException(exc);
        }
    }

    public void writeAmble(String amble) {
        emit("@");
        emit(amble);
        emit("\n");
    }

    protected void writeRow(String header, List<?> cells, String sep) {
        StringBuilder sb = new StringBuilder(header).append('\t');
        boolean first = true;
        for (Object c : cells) {
            if (c == null || c.toString().isEmpty()) continue;
            if (! first) sb.append(sep);
            sb.append(c);
            first = false;
        }
        emit(sb.append('\n'));
    }

    public void writeSentence(Sentence s) {
        Sentence.Columns cols = s.columns();
        emit("*CHI:\t");
        emit(s.getUtterance());
        emit("\n");
        writeRow("%mor:", cols.getMor(), "\n\t");
        writeRow("%comb:", cols.getComb(), " ");
        writeRow("%penn:", cols.getPenn(), " ");
        writeRow("%ort:", cols.getOrt(), " ");
        emit("@G:\t");
        emit(s.getId());
        emit("\n");
    }

    public void writeAnnotation(Annotation a) {
        for (String p : a.getPreambles()) writeAmble(p);
        for (Sentence s : a.getSentences()) writeSentence(s);
        for (String p : a.getPostambles()) writeAmble(p);
    }

    public static String serialize(Annotation a) {
        StringBuilder sb = new StringBuilder();
        new MorcombWriter(sb).writeAnnotation(a);
        return sb.toString();
    }

}
