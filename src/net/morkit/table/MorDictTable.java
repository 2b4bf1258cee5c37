package net.morkit.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A dictionary flattened into rows, one per entry.
 * The rows are kept in insertion order.
 */
public class MorDictTable implements Iterable<TableRow> {

    public static final String COL_PHON = "Phon";
    public static final String COL_CAT = "Category";
    public static final String COL_SEM = "Overall Semantics";
    public static final String COL_GLOSS = "Morphological Analysis";
    public static final String COL_ENABLED = "enabled";

    /** The columns that correspond to the parts of an entry's text. */
    public static final List<String> OVERT_COLUMNS =
        Collections.unmodifiableList(Arrays.asList(COL_PHON, COL_CAT,
                                                   COL_SEM, COL_GLOSS));

    /** All columns of a freshly made table. */
    public static final List<String> COLUMNS =
        Collections.unmodifiableList(Arrays.asList(COL_PHON, COL_CAT,
            COL_SEM, COL_GLOSS, COL_ENABLED));

    private final List<TableRow> rows;

    public MorDictTable() {
        rows = new ArrayList<TableRow>();
    }
    public MorDictTable(List<TableRow> rows) {
        this.rows = new ArrayList<TableRow>(rows);
    }

    public String toString() {
        return String.format("%s@%h[rows=%s]", getClass().getName(), this,
                             rows.size());
    }

    public Iterator<TableRow> iterator() {
        return Collections.unmodifiableList(rows).iterator();
    }

    public List<TableRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public int size() {
        return rows.size();
    }

    public TableRow get(int index) {
        return rows.get(index);
    }

    public void add(TableRow row) {
        rows.add(row);
    }

    /**
     * Return the first row with the given key, or null.
     */
    public TableRow find(RowKey key) {
        for (TableRow r : rows) {
            if (r.getKey().equals(key)) return r;
        }
        return null;
    }

    /**
     * The values of the given column, in row order (null where missing).
     */
    public List<Object> column(String name) {
        List<Object> ret = new ArrayList<Object>(rows.size());
        for (TableRow r : rows) ret.add(r.get(name));
        return ret;
    }

    /**
     * A deep copy of this table; the rows' cells may be changed without
     * affecting the original.
     */
    public MorDictTable copy() {
        MorDictTable ret = new MorDictTable();
        for (TableRow r : rows) ret.add(r.copy());
        return ret;
    }

}
