package net.morkit.mordict;

import java.io.IOException;
import java.util.List;

/**
 * Renders dictionary nodes back into dictionary text.
 * The writer remembers the last character it emitted; a separating blank
 * is only written where the output does not already stand at the
 * beginning of a line, and every entry is terminated by exactly one line
 * break.
 */
public class MorDictWriter {

    private static final String DISABLED_PREFIX = "% " +
        LexEntry.DISABLED_MARKER + " ";

    private final Appendable output;
    private final boolean includeComments;
    private int lastChar;

    public MorDictWriter(Appendable output, boolean includeComments) {
        if (output == null)
            throw new NullPointerException("Output may not be null");
        this.output = output;
        this.includeComments = includeComments;
        this.lastChar = -1;
    }

    public Appendable getOutput() {
        return output;
    }

    public boolean isIncludingComments() {
        return includeComments;
    }

    /**
     * Whether the output is empty or ends with a line break.
     */
    public boolean atLineStart() {
        return (lastChar == -1 || lastChar == '\n' || lastChar == '\r');
    }

    protected void emit(CharSequence text) {
        if (text.length() == 0) return;
        try {
            output.append(text);
        } catch (IOException exc) {
            throw new RuntimeException(exc);
        }
        lastChar = text.charAt(text.length() - 1);
    }

    protected void endLine() {
        if (! atLineStart()) emit("\n");
    }

    public void writeComment(Comment c) {
        if (c.isEmpty()) {
            emit("%\n");
        } else {
            emit(NodeKind.COMMENT.getBegin());
            emit(c.getValue());
            emit(NodeKind.COMMENT.getEnd());
        }
    }

    public void writeComments(List<Comment> comments) {
        if (! includeComments || comments.isEmpty()) return;
        if (! atLineStart()) emit(" ");
        for (Comment c : comments) writeComment(c);
    }

    /**
     * Write a delimited value followed by its comments.
     * Empty values of omittable kinds are left out, but not their
     * comments.
     */
    public void writeValue(MorDictValue value) {
        if (value instanceof Comment) {
            writeComment((Comment) value);
            return;
        }
        NodeKind kind = value.getKind();
        if (! kind.isOmittable() || ! value.isEmpty()) {
            emit(kind.getBegin());
            emit(value.getValue());
            emit(kind.getEnd());
        }
        writeComments(value.getComments());
    }

    public void writeAttrVal(CatAttrVal av) {
        emit(NodeKind.CAT_ATTR_VAL.getBegin());
        emit(av.getKey());
        StringBuilder sb = new StringBuilder();
        for (String v : av.getValues()) {
            if (v.isEmpty()) continue;
            sb.append(' ').append(v);
        }
        emit(sb);
        emit(NodeKind.CAT_ATTR_VAL.getEnd());
        writeComments(av.getComments());
    }

    public void writeCat(Cat cat) {
        emit(NodeKind.CAT.getBegin());
        for (CatAttrVal av : cat.getAttrVals()) writeAttrVal(av);
        emit(NodeKind.CAT.getEnd());
        writeComments(cat.getComments());
    }

    protected void writeFields(LexEntry entry) {
        writeValue(entry.getPhon());
        emit("\t");
        writeCat(entry.getCat());
        writeOptional(entry.getSem());
        writeOptional(entry.getGloss());
    }

    private void writeOptional(MorDictValue value) {
        if (! value.isEmpty() && ! atLineStart()) emit(" ");
        writeValue(value);
    }

    /**
     * Write an entry as a complete line (or lines, if comments intervene).
     * A disabled entry is flattened into a single DISABLED comment line;
     * its own comments follow it either way.
     */
    public void writeEntry(LexEntry entry) {
        if (entry.isEnabled()) {
            writeFields(entry);
        } else {
            endLine();
            emit(DISABLED_PREFIX);
            emit(flatten(entry));
            emit("\n");
        }
        writeComments(entry.getComments());
        endLine();
    }

    /**
     * The single-line text a disabled entry is folded into.
     */
    public String flatten(LexEntry entry) {
        StringBuilder sb = new StringBuilder();
        new MorDictWriter(sb, includeComments).writeFields(entry);
        String flat = sb.toString().replace("\r\n", " ")
            .replace('\r', ' ').replace('\n', ' ');
        int end = flat.length();
        while (end > 0 && Character.isWhitespace(flat.charAt(end - 1)))
            end--;
        return flat.substring(0, end);
    }

    public void writePreamble(Preamble p) {
        endLine();
        writeValue(p);
        endLine();
    }

    public void writeDictionary(Dictionary dict) {
        if (includeComments) {
            for (Comment c : dict.getComments()) {
                endLine();
                writeComment(c);
            }
        }
        for (Preamble p : dict.getPreambles()) writePreamble(p);
        for (LexEntry e : dict.getEntries()) writeEntry(e);
    }

    public static String serialize(Dictionary dict,
                                   boolean includeComments) {
        StringBuilder sb = new StringBuilder();
        new MorDictWriter(sb, includeComments).writeDictionary(dict);
        return sb.toString();
    }

    public static String serialize(LexEntry entry,
                                   boolean includeComments) {
        StringBuilder sb = new StringBuilder();
        new MorDictWriter(sb, includeComments).writeEntry(entry);
        return sb.toString();
    }

}
