package net.morkit.morcomb;

import java.util.ArrayList;
import java.util.List;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * A structured JSON encoding of Annotation-s.
 * The output is indented with one value per line, except that a word's
 * candidate list is kept on a single line when it has only one element;
 * an ambiguous list is spread over several lines. Decoding accepts either
 * form.
 */
public final class AnnotationJson {

    public static final String KEY_PREAMBLES = "preambles";
    public static final String KEY_CONTENTS = "contents";
    public static final String KEY_POSTAMBLES = "postambles";
    public static final String KEY_ID = "ID";
    public static final String KEY_CHI = "CHI";
    public static final String KEY_WORDS = "Words";
    public static final String KEY_SYNCAT = "SynCat";
    public static final String KEY_ORTHOGRAPHY = "Orthography";
    public static final String KEY_PHON = "Phon";
    public static final String KEY_MORS = "Mors";

    private static final String INDENT = "  ";

    /* Prevent construction */
    private AnnotationJson() {}

    private static void indent(StringBuilder sb, int level) {
        for (int i = 0; i < level; i++) sb.append(INDENT);
    }

    private static void key(StringBuilder sb, int level, String name) {
        indent(sb, level);
        sb.append(JSONObject.quote(name)).append(": ");
    }

    private static void stringArray(StringBuilder sb, int level,
                                    List<String> values, boolean inline) {
        if (values.isEmpty()) {
            sb.append("[]");
            return;
        }
        if (inline) {
            sb.append('[');
            for (int i = 0; i < values.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(JSONObject.quote(values.get(i)));
            }
            sb.append(']');
            return;
        }
        sb.append("[\n");
        for (int i = 0; i < values.size(); i++) {
            indent(sb, level + 1);
            sb.append(JSONObject.quote(values.get(i)));
            if (i != values.size() - 1) sb.append(',');
            sb.append('\n');
        }
        indent(sb, level);
        sb.append(']');
    }

    /**
     * Append the encoding of a candidate list (or null for a padded cell).
     */
    public static void appendCandidates(StringBuilder sb, int level,
                                        AnalysisCandidates cands) {
        if (cands == null) {
            sb.append("null");
            return;
        }
        stringArray(sb, level, cands.getAlternatives(),
                    ! cands.isAmbiguous());
    }

    private static void appendWord(StringBuilder sb, int level, Word w) {
        indent(sb, level);
        sb.append("{\n");
        key(sb, level + 1, KEY_SYNCAT);
        sb.append(JSONObject.quote(w.getPenn())).append(",\n");
        key(sb, level + 1, KEY_ORTHOGRAPHY);
        sb.append(JSONObject.quote(w.getOrt())).append(",\n");
        key(sb, level + 1, KEY_PHON);
        sb.append(JSONObject.quote(w.getComb())).append(",\n");
        key(sb, level + 1, KEY_MORS);
        appendCandidates(sb, level + 1, w.getCandidates());
        sb.append('\n');
        indent(sb, level);
        sb.append('}');
    }

    private static void appendSentence(StringBuilder sb, int level,
                                       Sentence s) {
        indent(sb, level);
        sb.append("{\n");
        key(sb, level + 1, KEY_ID);
        sb.append(JSONObject.quote(s.getId())).append(",\n");
        key(sb, level + 1, KEY_CHI);
        sb.append(JSONObject.quote(s.getUtterance())).append(",\n");
        key(sb, level + 1, KEY_WORDS);
        List<Word> words = s.getWords();
        if (words.isEmpty()) {
            sb.append("[]");
        } else {
            sb.append("[\n");
            for (int i = 0; i < words.size(); i++) {
                appendWord(sb, level + 2, words.get(i));
                if (i != words.size() - 1) sb.append(',');
                sb.append('\n');
            }
            indent(sb, level + 1);
            sb.append(']');
        }
        sb.append('\n');
        indent(sb, level);
        sb.append('}');
    }

    public static String encode(Annotation a) {
        StringBuilder sb = new StringBuilder("{\n");
        key(sb, 1, KEY_PREAMBLES);
        stringArray(sb, 1, a.getPreambles(), false);
        sb.append(",\n");
        key(sb, 1, KEY_CONTENTS);
        List<Sentence> sents = a.getSentences();
        if (sents.isEmpty()) {
            sb.append("[]");
        } else {
            sb.append("[\n");
            for (int i = 0; i < sents.size(); i++) {
                appendSentence(sb, 2, sents.get(i));
                if (i != sents.size() - 1) sb.append(',');
                sb.append('\n');
            }
            indent(sb, 1);
            sb.append(']');
        }
        sb.append(",\n");
        key(sb, 1, KEY_POSTAMBLES);
        stringArray(sb, 1, a.getPostambles(), false);
        sb.append("\n}\n");
        return sb.toString();
    }

    /**
     * Extract exactly one JSON value from the given string.
     * Garbage after the value is rejected.
     */
    public static Object parseOneValue(String input) throws JSONException {
        JSONTokener tok = new JSONTokener(input);
        Object ret = tok.nextValue();
        if (tok.nextClean() != 0)
            throw tok.syntaxError("Unexpected garbage after JSON value");
        return ret;
    }

    private static List<String> strings(JSONArray arr) throws JSONException {
        List<String> ret = new ArrayList<String>(arr.length());
        for (int i = 0; i < arr.length(); i++) ret.add(arr.getString(i));
        return ret;
    }

    public static AnalysisCandidates decodeCandidates(Object value)
            throws JSONException {
        if (value == null || value == JSONObject.NULL) return null;
        if (! (value instanceof JSONArray))
            throw new JSONException("Candidate list must be an array, " +
                "got " + value);
        List<String> alts = strings((JSONArray) value);
        if (alts.isEmpty())
            throw new JSONException("Candidate list may not be empty");
        return new AnalysisCandidates(alts);
    }

    public static Word decodeWord(JSONObject obj) throws JSONException {
        return new Word(decodeCandidates(obj.opt(KEY_MORS)),
                        obj.getString(KEY_PHON), obj.getString(KEY_SYNCAT),
                        obj.getString(KEY_ORTHOGRAPHY));
    }

    public static Sentence decodeSentence(JSONObject obj)
            throws JSONException {
        JSONArray arr = obj.getJSONArray(KEY_WORDS);
        List<Word> words = new ArrayList<Word>(arr.length());
        for (int i = 0; i < arr.length(); i++)
            words.add(decodeWord(arr.getJSONObject(i)));
        return new Sentence(obj.getString(KEY_ID), obj.getString(KEY_CHI),
                            words);
    }

    public static Annotation decode(String text) throws JSONException {
        Object value = parseOneValue(text);
        if (! (value instanceof JSONObject))
            throw new JSONException("Annotation must be a JSON object");
        JSONObject obj = (JSONObject) value;
        Annotation ret = new Annotation();
        ret.getPreambles().addAll(strings(obj.getJSONArray(KEY_PREAMBLES)));
        JSONArray sents = obj.getJSONArray(KEY_CONTENTS);
        for (int i = 0; i < sents.length(); i++)
            ret.getSentences().add(decodeSentence(sents.getJSONObject(i)));
        ret.getPostambles().addAll(strings(
            obj.getJSONArray(KEY_POSTAMBLES)));
        return ret;
    }

}
