package net.morkit.table;

import java.util.Random;
import net.morkit.api.parser.TextLocation;

/**
 * Identifies a table row by the dictionary and the source position its
 * entry came from.
 * Entries without a position receive random negative line and column
 * numbers, which can never clash with real ones (but may, improbably,
 * clash with each other).
 */
public class RowKey implements Comparable<RowKey> {

    public static final String[] COLUMN_NAMES = {
        "dict_name", "line", "column"
    };

    private static final Random PLACEHOLDER_RNG = new Random();

    private final String dictName;
    private final long line;
    private final long column;

    public RowKey(String dictName, long line, long column) {
        if (dictName == null)
            throw new NullPointerException(
                "Dictionary name may not be null");
        this.dictName = dictName;
        this.line = line;
        this.column = column;
    }

    public String toString() {
        return "(" + dictName + ", " + line + ", " + column + ")";
    }

    public boolean equals(Object other) {
        if (! (other instanceof RowKey)) return false;
        RowKey ko = (RowKey) other;
        return (dictName.equals(ko.getDictName()) &&
                line == ko.getLine() && column == ko.getColumn());
    }

    public int hashCode() {
        return dictName.hashCode() ^ (int) (line ^ line >>> 32) * 31 ^
            (int) (column ^ column >>> 32);
    }

    public int compareTo(RowKey other) {
        int ret = dictName.compareTo(other.getDictName());
        if (ret != 0) return ret;
        if (line != other.getLine())
            return (line < other.getLine()) ? -1 : 1;
        if (column != other.getColumn())
            return (column < other.getColumn()) ? -1 : 1;
        return 0;
    }

    public String getDictName() {
        return dictName;
    }

    public long getLine() {
        return line;
    }

    public long getColumn() {
        return column;
    }

    /**
     * Whether this key stems from an actual source position.
     */
    public boolean isPlaceholder() {
        return line < 0 || column < 0;
    }

    public static RowKey forPosition(String dictName, TextLocation pos) {
        if (pos == null)
            return new RowKey(dictName, placeholder(), placeholder());
        return new RowKey(dictName, pos.getLine(), pos.getColumn());
    }

    /**
     * A random number less than zero.
     */
    public static long placeholder() {
        long v;
        synchronized (PLACEHOLDER_RNG) {
            v = PLACEHOLDER_RNG.nextLong();
        }
        return (v < 0) ? v : -v - 1;
    }

}
