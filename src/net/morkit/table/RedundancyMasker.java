package net.morkit.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import net.morkit.mordict.Cat;
import net.morkit.mordict.Gloss;
import net.morkit.mordict.Phon;
import net.morkit.mordict.Sem;

/**
 * Disables entries that are made redundant by a better-scoring entry with
 * the same fingerprint.
 * Entries that share their surface form, the values of the group feature,
 * and their semantics form a group. Each member scores one point per
 * occurrence of the score feature plus one for a non-empty gloss; members
 * below the group's best score are disabled, but only if they stem from
 * beyond the threshold line. Nothing is removed.
 */
public class RedundancyMasker {

    protected static class Fingerprint {

        private final Phon phon;
        private final List<List<String>> groupValues;
        private final Sem sem;

        public Fingerprint(Phon phon, List<List<String>> groupValues,
                           Sem sem) {
            this.phon = phon;
            this.groupValues = groupValues;
            this.sem = sem;
        }

        public String toString() {
            return "(" + phon.getValue() + ", " + groupValues + ", " +
                sem.getValue() + ")";
        }

        public boolean equals(Object other) {
            if (! (other instanceof Fingerprint)) return false;
            Fingerprint fo = (Fingerprint) other;
            return (phon.equals(fo.phon) &&
                    groupValues.equals(fo.groupValues) &&
                    sem.equals(fo.sem));
        }

        public int hashCode() {
            return phon.hashCode() ^ groupValues.hashCode() * 31 ^
                sem.hashCode();
        }

    }

    private static final Logger LOGGER = Logger.getLogger("RedundancyMasker");

    private final MaskingSettings settings;

    public RedundancyMasker(MaskingSettings settings) {
        if (settings == null)
            throw new NullPointerException("Settings may not be null");
        this.settings = settings;
    }
    public RedundancyMasker() {
        this(MaskingSettings.fromConfiguration());
    }

    public MaskingSettings getSettings() {
        return settings;
    }

    protected Fingerprint fingerprint(TableRow row)
            throws ProjectionException {
        Cat cat = row.get(MorDictTable.COL_CAT, Cat.class);
        return new Fingerprint(row.get(MorDictTable.COL_PHON, Phon.class),
                               cat.valuesOf(settings.getGroupFeature()),
                               row.get(MorDictTable.COL_SEM, Sem.class));
    }

    public int score(TableRow row) throws ProjectionException {
        Cat cat = row.get(MorDictTable.COL_CAT, Cat.class);
        Gloss gloss = row.get(MorDictTable.COL_GLOSS, Gloss.class);
        return cat.count(settings.getScoreFeature()) +
            (gloss.isEmpty() ? 0 : 1);
    }

    /**
     * Return a copy of table with the redundant rows disabled.
     * Rows that are already disabled stay so; the input is not modified.
     */
    public MorDictTable maskRedundant(MorDictTable table)
            throws ProjectionException {
        MorDictTable ret = table.copy();
        Map<Fingerprint, List<TableRow>> groups =
            new LinkedHashMap<Fingerprint, List<TableRow>>();
        for (TableRow r : ret) {
            Fingerprint fp = fingerprint(r);
            List<TableRow> group = groups.get(fp);
            if (group == null) {
                group = new ArrayList<TableRow>();
                groups.put(fp, group);
            }
            group.add(r);
        }
        int masked = 0;
        for (List<TableRow> group : groups.values()) {
            int[] scores = new int[group.size()];
            int best = Integer.MIN_VALUE;
            for (int i = 0; i < scores.length; i++) {
                scores[i] = score(group.get(i));
                best = Math.max(best, scores[i]);
            }
            for (int i = 0; i < scores.length; i++) {
                TableRow r = group.get(i);
                if (r.getKey().getLine() <= settings.getThreshold() ||
                        scores[i] >= best)
                    continue;
                r.set(MorDictTable.COL_ENABLED, Boolean.FALSE);
                masked++;
            }
        }
        LOGGER.fine("Masked " + masked + " of " + ret.size() + " rows in " +
                    groups.size() + " groups");
        return ret;
    }

}
