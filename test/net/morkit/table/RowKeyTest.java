package net.morkit.table;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.morkit.util.Locations;
import org.junit.jupiter.api.Test;

class RowKeyTest {

    @Test
    void ordersByNameThenPosition() {
        List<RowKey> keys = new ArrayList<RowKey>(Arrays.asList(
            new RowKey("b.cut", 1, 1), new RowKey("a.cut", 7, 2),
            new RowKey("a.cut", 7, 1), new RowKey("a.cut", 3, 9)));

        Collections.sort(keys);

        assertThat(keys).containsExactly(new RowKey("a.cut", 3, 9),
            new RowKey("a.cut", 7, 1), new RowKey("a.cut", 7, 2),
            new RowKey("b.cut", 1, 1));
    }

    @Test
    void usesSourcePositionWhenAvailable() {
        RowKey k = RowKey.forPosition("a.cut",
                                      new Locations.FixedLocation(12, 3, 99));

        assertThat(k.toString()).isEqualTo("(a.cut, 12, 3)");
        assertThat(k.isPlaceholder()).isFalse();
    }

    @Test
    void placeholdersAreNegative() {
        for (int i = 0; i < 1000; i++)
            assertThat(RowKey.placeholder()).isNegative();
    }

}
