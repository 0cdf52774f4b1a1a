package com.termscan.common.automaton;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class OutputTableTest {

    @Test
    void test_offer() {
        final var table = new OutputTable();
        table.add();
        Assertions.assertEquals(OutputTable.NONE, table.index(0));
        Assertions.assertEquals(0, table.keyword(0).length);

        table.offer(0, 3, new int[] {3});
        table.offer(0, 5, new int[] {5});
        Assertions.assertEquals(3, table.index(0));
        Assertions.assertArrayEquals(new int[] {3}, table.keyword(0));

        table.offer(0, 2, new int[] {2});
        Assertions.assertEquals(2, table.index(0));
        Assertions.assertEquals(2, table.terminalIndex(0));
    }

    @Test
    void test_inherit_reset() {
        final var table = new OutputTable();
        table.add();
        table.add();
        table.offer(0, 1, new int[] {1});
        table.offer(1, 4, new int[] {4});

        table.inherit(1, 0);
        Assertions.assertEquals(1, table.index(1));
        Assertions.assertArrayEquals(new int[] {1}, table.keyword(1));
        Assertions.assertEquals(4, table.terminalIndex(1));

        table.inherit(0, 1);
        Assertions.assertEquals(1, table.index(0));

        table.reset();
        Assertions.assertEquals(4, table.index(1));
        Assertions.assertArrayEquals(new int[] {4}, table.keyword(1));
        Assertions.assertEquals(2, table.size());
    }
}
