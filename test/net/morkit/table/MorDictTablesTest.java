package net.morkit.table;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import net.morkit.mordict.Cat;
import net.morkit.mordict.CatAttrVal;
import net.morkit.mordict.Comment;
import net.morkit.mordict.Dictionary;
import net.morkit.mordict.LexEntry;
import net.morkit.mordict.MorDictParser;
import net.morkit.mordict.MorDictWriter;
import net.morkit.mordict.Phon;
import net.morkit.mordict.Sem;
import org.junit.jupiter.api.Test;

class MorDictTablesTest {

    private static final MorDictParser PARSER = new MorDictParser();

    private static final String TEXT = "@UTF8\n" +
        "cat\t{[scat n]} =animal=\n" +
        "% a pet\n" +
        "cat\t{[scat v]} \"to vomit\"\n" +
        "dog\t{[scat n][num sg]}\n" +
        "-s\t{[scat sfx][num pl]}\n";

    private static Dictionary parse() throws Exception {
        return PARSER.parse("d.cut", TEXT);
    }

    @Test
    void keysRowsBySourcePosition() throws Exception {
        MorDictTable table = MorDictTables.toTable(parse());

        assertThat(table.size()).isEqualTo(4);
        TableRow row = table.get(1);
        assertThat(row.getKey()).isEqualTo(new RowKey("d.cut", 4, 1));
        assertThat(row.get(MorDictTable.COL_PHON, Phon.class).getValue())
            .isEqualTo("cat");
        assertThat(row.get(MorDictTable.COL_ENABLED)).isEqualTo(true);
        assertThat(table.find(new RowKey("d.cut", 5, 1))).isSameAs(
            table.get(2));
        assertThat(table.column(MorDictTable.COL_SEM)).hasSize(4);
    }

    @Test
    void projectsBackWithoutLosingEntryData() throws Exception {
        Dictionary d = parse();
        MorDictTable table = MorDictTables.toTable(d);
        List<LexEntry> before = d.getEntries();

        List<LexEntry> after = MorDictTables.fromTable(table);

        assertThat(after).isEqualTo(before);
        assertThat(after.get(0).getPosition()).isNull();
        assertThat(after.get(0).getSem().getComments())
            .extracting(Comment::getValue).containsExactly("a pet");
    }

    @Test
    void rebuildsDictionaryWithoutRowKeys() throws Exception {
        Dictionary d = parse();
        MorDictTable table = MorDictTables.toTable(d);

        Dictionary rebuilt = MorDictTables.toDictionary("copy.cut",
            Arrays.asList(new Comment("rebuilt")), d.getPreambles(), table);

        assertThat(rebuilt.getName()).isEqualTo("copy.cut");
        assertThat(rebuilt.getEntries()).isEqualTo(d.getEntries());
        assertThat(rebuilt.getEntries()).extracting(LexEntry::getPosition)
            .containsOnlyNulls();
        assertThat(MorDictTables.toTable(rebuilt).get(0).getKey()
            .isPlaceholder()).isTrue();
        assertThat(MorDictWriter.serialize(rebuilt, true))
            .isEqualTo("% rebuilt\n" + MorDictWriter.serialize(d, true));
    }

    @Test
    void updateReplacesEntries() throws Exception {
        Dictionary d = parse();
        MorDictTable table = MorDictTables.toTable(d);
        table.get(3).set(MorDictTable.COL_ENABLED, Boolean.FALSE);

        MorDictTables.update(d, table);

        assertThat(MorDictWriter.serialize(d, true)).isEqualTo("@UTF8\n" +
            "cat\t{[scat n]} =animal= % a pet\n" +
            "cat\t{[scat v]} \"to vomit\"\n" +
            "dog\t{[scat n][num sg]}\n" +
            "% DISABLED: -s\t{[scat sfx][num pl]}\n");
    }

    @Test
    void updateLeavesDictionaryAloneOnFailure() throws Exception {
        Dictionary d = parse();
        MorDictTable table = MorDictTables.toTable(d);
        table.get(0).remove(MorDictTable.COL_CAT);

        assertThatThrownBy(() -> MorDictTables.update(d, table))
            .isInstanceOf(ProjectionException.class)
            .hasMessage("(d.cut, 2, 1): Missing value for column Category")
            .satisfies(exc -> assertThat(
                ((ProjectionException) exc).getRowKey())
                .isEqualTo(new RowKey("d.cut", 2, 1)));
        assertThat(d.getEntries()).hasSize(4);
    }

    @Test
    void rejectsIllTypedCells() throws Exception {
        MorDictTable table = MorDictTables.toTable(parse());
        table.get(0).set(MorDictTable.COL_SEM, "animal");

        assertThatThrownBy(() -> MorDictTables.fromTable(table))
            .isInstanceOf(ProjectionException.class)
            .hasMessageContaining("should be a Sem, got String");
    }

    @Test
    void synthesizedEntriesGetPlaceholderKeys() {
        LexEntry e = new LexEntry(new Phon("new"),
            new Cat(new CatAttrVal("scat", "adj")), new Sem("fresh"), null);

        TableRow a = MorDictTables.toRow("d.cut", e);
        TableRow b = MorDictTables.toRow("d.cut", e);

        assertThat(a.getKey().getLine()).isNegative();
        assertThat(a.getKey().getColumn()).isNegative();
        assertThat(a.getKey().isPlaceholder()).isTrue();
        assertThat(a.getKey()).isNotEqualTo(b.getKey());
    }

    @Test
    void selectsDuplicatedGroups() throws Exception {
        MorDictTable table = MorDictTables.toTable(parse());

        MorDictTable dups = MorDictTables.selectDuplicates(table,
            MorDictTable.COL_PHON);

        assertThat(dups.getRows()).containsExactly(table.get(0),
                                                   table.get(1));
        assertThat(MorDictTables.selectDuplicates(table, Arrays.asList(
            MorDictTable.COL_PHON, MorDictTable.COL_CAT)).size()).isZero();
    }

    @Test
    void filtersByFeatureValue() throws Exception {
        MorDictTable table = MorDictTables.toTable(parse());

        MorDictTable sfx = MorDictTables.filterByFeature(table, "scat",
                                                         "sfx");

        assertThat(sfx.getRows()).containsExactly(table.get(3));
        assertThat(MorDictTables.filterByFeature(table, "num", "s")
                   .size()).isEqualTo(1);
    }

    @Test
    void concatenatesTables() throws Exception {
        MorDictTable one = MorDictTables.toTable(parse());
        MorDictTable two = MorDictTables.toTable(
            PARSER.parse("e.cut", "cow\t{[scat n]}\n"));

        MorDictTable all = MorDictTables.concat(one, two);

        assertThat(all.size()).isEqualTo(5);
        assertThat(all.get(4).getKey().getDictName()).isEqualTo("e.cut");
    }

    @Test
    void writesTabSeparatedValues() throws Exception {
        MorDictTable table = MorDictTables.toTable(
            PARSER.parse("e.cut", "cow\t{[scat n][num sg]} =bovine=\n"));

        assertThat(MorDictTables.toTsv(table)).isEqualTo(
            "dict_name\tline\tcolumn\tPhon\tCategory\tOverall Semantics\t" +
            "Morphological Analysis\n" +
            "e.cut\t1\t1\tcow\t{[scat n][num sg]}\t=bovine=\t\n");
    }

}
