package net.morkit.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.morkit.mordict.Comment;

/**
 * A single row of a MorDictTable.
 * Cells are addressed by column name and are not typed; reading a cell as
 * a given type fails with a ProjectionException if it is missing or of
 * another type.
 * Besides its key, a row remembers the comments anchored to the entry as a
 * whole; like the key, they are not a cell.
 */
public class TableRow {

    private final RowKey key;
    private final Map<String, Object> cells;
    private final List<Comment> comments;

    public TableRow(RowKey key, Map<String, Object> cells,
                    List<Comment> comments) {
        if (key == null)
            throw new NullPointerException("Row key may not be null");
        this.key = key;
        this.cells = new LinkedHashMap<String, Object>(cells);
        this.comments = (comments == null) ?
            Collections.<Comment>emptyList() :
            Collections.unmodifiableList(new ArrayList<Comment>(comments));
    }
    public TableRow(RowKey key, Map<String, Object> cells) {
        this(key, cells, null);
    }
    public TableRow(RowKey key) {
        this(key, Collections.<String, Object>emptyMap());
    }

    public String toString() {
        return String.format("%s@%h[key=%s,cells=%s]",
            getClass().getName(), this, key, cells);
    }

    public RowKey getKey() {
        return key;
    }

    public List<Comment> getComments() {
        return comments;
    }

    public Map<String, Object> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    public boolean has(String column) {
        return cells.containsKey(column);
    }

    public Object get(String column) {
        return cells.get(column);
    }

    public void set(String column, Object value) {
        cells.put(column, value);
    }

    public void remove(String column) {
        cells.remove(column);
    }

    public <T> T get(String column, Class<T> type)
            throws ProjectionException {
        Object ret = cells.get(column);
        if (ret == null)
            throw new ProjectionException(key, "Missing value for " +
                "column " + column);
        if (! type.isInstance(ret))
            throw new ProjectionException(key, "Value of column " +
                column + " should be a " + type.getSimpleName() +
                ", got " + ret.getClass().getSimpleName());
        return type.cast(ret);
    }

    /**
     * A copy of this row with its own cell map.
     */
    public TableRow copy() {
        return new TableRow(key, cells, comments);
    }

}
