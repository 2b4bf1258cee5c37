package net.morkit.table;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.morkit.mordict.Cat;
import net.morkit.mordict.CatAttrVal;
import net.morkit.mordict.Comment;
import net.morkit.mordict.Dictionary;
import net.morkit.mordict.Gloss;
import net.morkit.mordict.LexEntry;
import net.morkit.mordict.Phon;
import net.morkit.mordict.Preamble;
import net.morkit.mordict.Sem;

/**
 * Conversions between Dictionary-s and MorDictTable-s, and operations on
 * the latter.
 */
public final class MorDictTables {

    private static final Logger LOGGER = Logger.getLogger("MorDictTables");

    /* Prevent construction */
    private MorDictTables() {}

    /**
     * Convert a single entry into a row.
     * The row is keyed by the entry's position, or by placeholders if it
     * has none.
     */
    public static TableRow toRow(String dictName, LexEntry entry) {
        Map<String, Object> cells = new LinkedHashMap<String, Object>();
        cells.put(MorDictTable.COL_PHON, entry.getPhon());
        cells.put(MorDictTable.COL_CAT, entry.getCat());
        cells.put(MorDictTable.COL_SEM, entry.getSem());
        cells.put(MorDictTable.COL_GLOSS, entry.getGloss());
        cells.put(MorDictTable.COL_ENABLED, entry.isEnabled());
        return new TableRow(RowKey.forPosition(dictName,
            entry.getPosition()), cells, entry.getComments());
    }

    /**
     * Convert the entries of the given dictionary into a table.
     * Comments and preambles of the dictionary itself are not part of the
     * table.
     */
    public static MorDictTable toTable(Dictionary dict) {
        MorDictTable ret = new MorDictTable();
        for (LexEntry e : dict.getEntries())
            ret.add(toRow(dict.getName(), e));
        return ret;
    }

    /**
     * Convert a row back into an entry.
     * The key of the row is not carried over; the resulting entry has no
     * position.
     */
    public static LexEntry fromRow(TableRow row) throws ProjectionException {
        return new LexEntry(row.get(MorDictTable.COL_PHON, Phon.class),
                            row.get(MorDictTable.COL_CAT, Cat.class),
                            row.get(MorDictTable.COL_SEM, Sem.class),
                            row.get(MorDictTable.COL_GLOSS, Gloss.class),
                            row.get(MorDictTable.COL_ENABLED, Boolean.class),
                            null, row.getComments());
    }

    public static List<LexEntry> fromTable(MorDictTable table)
            throws ProjectionException {
        List<LexEntry> ret = new ArrayList<LexEntry>(table.size());
        for (TableRow r : table) ret.add(fromRow(r));
        return ret;
    }

    /**
     * Replace all entries of dict with those projected from table.
     * If any row fails to convert, dict is left unchanged.
     */
    public static void update(Dictionary dict, MorDictTable table)
            throws ProjectionException {
        List<LexEntry> entries = fromTable(table);
        dict.setEntries(entries);
        LOGGER.fine("Updated dictionary " + dict.getName() + " with " +
                    entries.size() + " entries");
    }

    /**
     * Build a new Dictionary from its header parts and a table of entries.
     * Like fromTable(), this drops the row keys, so none of the entries
     * has a position.
     */
    public static Dictionary toDictionary(String name, List<Comment> comments,
                                          List<Preamble> preambles,
                                          MorDictTable table)
            throws ProjectionException {
        List<LexEntry> entries = fromTable(table);
        Dictionary ret = new Dictionary(name);
        if (comments != null) ret.getComments().addAll(comments);
        if (preambles != null) ret.getPreambles().addAll(preambles);
        ret.setEntries(entries);
        LOGGER.fine("Built dictionary " + ret.getName() + " from " +
                    entries.size() + " rows");
        return ret;
    }

    /**
     * Concatenate the rows of the given tables into a new one.
     */
    public static MorDictTable concat(List<MorDictTable> tables) {
        MorDictTable ret = new MorDictTable();
        for (MorDictTable t : tables) {
            for (TableRow r : t) ret.add(r);
        }
        return ret;
    }
    public static MorDictTable concat(MorDictTable... tables) {
        return concat(Arrays.asList(tables));
    }

    /**
     * Return the rows whose values in all the given columns, taken
     * together, also occur in some other row.
     * Every member of a duplicated group is kept, in table order.
     */
    public static MorDictTable selectDuplicates(MorDictTable table,
                                                List<String> columns) {
        Map<List<Object>, Integer> counts =
            new HashMap<List<Object>, Integer>();
        List<List<Object>> keys = new ArrayList<List<Object>>(table.size());
        for (TableRow r : table) {
            List<Object> k = new ArrayList<Object>(columns.size());
            for (String c : columns) k.add(r.get(c));
            keys.add(k);
            Integer prev = counts.get(k);
            counts.put(k, (prev == null) ? 1 : prev + 1);
        }
        MorDictTable ret = new MorDictTable();
        for (int i = 0; i < table.size(); i++) {
            if (counts.get(keys.get(i)) > 1) ret.add(table.get(i));
        }
        return ret;
    }
    public static MorDictTable selectDuplicates(MorDictTable table,
                                                String column) {
        return selectDuplicates(table, Arrays.asList(column));
    }

    /**
     * Return the rows having a category feature with the given key whose
     * value contains fragment.
     */
    public static MorDictTable filterByFeature(MorDictTable table,
                                               String key, String fragment)
            throws ProjectionException {
        MorDictTable ret = new MorDictTable();
        for (TableRow r : table) {
            Cat cat = r.get(MorDictTable.COL_CAT, Cat.class);
            Iterator<CatAttrVal> it = cat.get(key);
            while (it.hasNext()) {
                if (it.next().valueContains(fragment)) {
                    ret.add(r);
                    break;
                }
            }
        }
        return ret;
    }

    /**
     * Write the table as tab-separated values.
     * The header names the key columns and the overt columns; cells are
     * rendered in their dictionary notation without comments. Nothing is
     * quoted, so values must not contain tabs or line breaks.
     */
    public static void writeTsv(MorDictTable table, Appendable out)
            throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String k : RowKey.COLUMN_NAMES) sb.append(k).append('\t');
        appendJoined(sb, MorDictTable.OVERT_COLUMNS);
        out.append(sb.append('\n'));
        for (TableRow r : table) {
            sb.setLength(0);
            RowKey key = r.getKey();
            sb.append(key.getDictName()).append('\t')
              .append(key.getLine()).append('\t')
              .append(key.getColumn()).append('\t');
            List<String> cells = new ArrayList<String>();
            for (String c : MorDictTable.OVERT_COLUMNS) {
                Object v = r.get(c);
                cells.add((v == null) ? "" : v.toString());
            }
            appendJoined(sb, cells);
            out.append(sb.append('\n'));
        }
    }

    public static String toTsv(MorDictTable table) {
        StringBuilder sb = new StringBuilder();
        try {
            writeTsv(table, sb);
        } catch (IOException exc) {
            throw new RuntimeException(exc);
        }
        return sb.toString();
    }

    private static void appendJoined(StringBuilder sb, List<String> items) {
        for (int i = 0; i < items.size(); i++) {
            if (i != 0) sb.append('\t');
            sb.append(items.get(i));
        }
    }

}
