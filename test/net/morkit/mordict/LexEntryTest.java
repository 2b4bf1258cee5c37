package net.morkit.mordict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import net.morkit.util.Locations;
import org.junit.jupiter.api.Test;

class LexEntryTest {

    private static Cat cat() {
        return new Cat(new CatAttrVal("scat", "v"),
                       new CatAttrVal("comp", Arrays.asList("np", "pp")),
                       new CatAttrVal("comp", "vp"));
    }

    @Test
    void equalityIgnoresPositionCommentsAndState() {
        LexEntry a = new LexEntry(new Phon("run"), cat(), new Sem("move"),
                                  null);
        LexEntry b = new LexEntry(new Phon("run"), cat(), new Sem("move"),
            Gloss.EMPTY, false, new Locations.FixedLocation(4, 1, 30),
            Collections.singletonList(new Comment("note")));

        assertThat(b).isEqualTo(a);
        assertThat(b.hashCode()).isEqualTo(a.hashCode());
        assertThat(a).isNotEqualTo(new LexEntry(new Phon("ran"), cat(),
                                                new Sem("move"), null));
    }

    @Test
    void looksUpPairsByKey() {
        Cat c = cat();

        assertThat(c.count("comp")).isEqualTo(2);
        assertThat(c.count("tense")).isZero();
        assertThat(c.valuesOf("comp")).containsExactly(
            Arrays.asList("np", "pp"), Collections.singletonList("vp"));
        Iterator<CatAttrVal> it = c.get("scat");
        assertThat(it.next().getScalar()).isEqualTo("v");
        assertThat(it.hasNext()).isFalse();
    }

    @Test
    void distinguishesScalarsFromLists() {
        CatAttrVal list = new CatAttrVal("comp", Arrays.asList("np", "pp"));

        assertThat(list.isList()).isTrue();
        assertThat(list.valueContains("pp")).isTrue();
        assertThatThrownBy(list::getScalar)
            .isInstanceOf(IllegalStateException.class);
        assertThat(new CatAttrVal("tense",
            Collections.<String>emptyList()).getValues())
            .containsExactly("");
    }

    @Test
    void withCommentsKeepsValueAndState() {
        LexEntry e = new LexEntry(new Phon("run"), cat(), null, null);
        e.setEnabled(false);

        LexEntry copy = e.withComments(
            Collections.singletonList(new Comment("x")));

        assertThat(copy).isEqualTo(e);
        assertThat(copy.isEnabled()).isFalse();
        assertThat(copy.getComments()).extracting(Comment::getValue)
            .containsExactly("x");
        assertThat(e.getComments()).isEmpty();
    }

}
