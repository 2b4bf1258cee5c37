package net.morkit.util;

import java.util.Collection;

public final class Formats {

    /* Prevent construction */
    private Formats() {}

    private static void appendEscaped(StringBuilder sb, int cp,
                                      char quote) {
        switch (cp) {
            case '\t': sb.append("\\t"); break;
            case '\n': sb.append("\\n"); break;
            case '\r': sb.append("\\r"); break;
            case '\f': sb.append("\\f"); break;
            case '\\': sb.append("\\\\"); break;
            default:
                if (cp == quote) {
                    sb.append('\\').append(quote);
                } else if (cp < 0x20 || cp == 0x7F) {
                    sb.append(String.format("\\u%04x", cp));
                } else {
                    sb.appendCodePoint(cp);
                }
                break;
        }
    }

    public static String formatString(CharSequence s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); ) {
            int cp = Character.codePointAt(s, i);
            appendEscaped(sb, cp, '"');
            i += Character.charCount(cp);
        }
        return sb.append('"').toString();
    }

    public static String formatCharacter(int cp) {
        StringBuilder sb = new StringBuilder("'");
        appendEscaped(sb, cp, '\'');
        return sb.append('\'').toString();
    }

    public static String formatAlternatives(Collection<String> items) {
        if (items.isEmpty()) return "nothing";
        if (items.size() == 1) return items.iterator().next();
        StringBuilder sb = new StringBuilder("any of ");
        boolean first = true;
        for (String item : items) {
            if (first) {
                first = false;
            } else {
                sb.append(", ");
            }
            sb.append(item);
        }
        return sb.toString();
    }

}
