package twothree;

import org.junit.jupiter.api.Test;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

class DuplicateKeyTest {

    @Test
    void equalKeysCoexist() {
        TwoThreeTree<Integer,String> t = new TwoThreeTree<>();
        t.insert(7, "a");
        t.insert(7, "b");
        t.validate();
        assertEquals(2, t.size());
        assertTrue(Set.of("a", "b").contains(t.get(7)));

        assertTrue(t.delete(7));
        t.validate();
        assertEquals(1, t.size());
        assertTrue(t.containsKey(7));

        assertTrue(t.delete(7));
        assertTrue(t.isEmpty());
        assertFalse(t.delete(7));
    }

    @Test
    void manyCopiesOfOneKey() {
        TwoThreeTree<Integer,Integer> t = new TwoThreeTree<>();
        for (int i = 0; i < 100; i++) {
            t.insert(5, i);
            t.insert(i * 10, i);
            t.validate();
        }
        // 5 is inserted 100 times, never collides with a multiple of 10
        assertEquals(200, t.size());
        for (int i = 0; i < 100; i++) {
            assertTrue(t.delete(5), "copy " + i);
            t.validate();
        }
        assertFalse(t.delete(5));
        assertEquals(100, t.size());
        for (int i = 0; i < 100; i++) assertEquals(i, t.get(i * 10));
    }

    @Test
    void collidingRandomKeysAreAllDeleted() {
        Random rnd = new Random(31);
        TwoThreeTree<Integer,Integer> t = new TwoThreeTree<>();
        Map<Integer,Integer> counts = new HashMap<>();
        for (int i = 0; i < 2000; i++) {
            int k = rnd.nextInt(50);
            counts.merge(k, 1, Integer::sum);
            t.insert(k, k);
        }
        t.validate();
        assertEquals(2000, t.size());

        for (Map.Entry<Integer,Integer> e : counts.entrySet()) {
            for (int i = 0; i < e.getValue(); i++) {
                assertTrue(t.delete(e.getKey()));
                t.validate();
            }
            assertFalse(t.containsKey(e.getKey()));
        }
        assertTrue(t.isEmpty());
    }

    @Test
    void interleavedDuplicateInsertsAndDeletesMatchCounts() {
        for (int seed = 0; seed < 200; seed++) {
            Random rnd = new Random(seed);
            TwoThreeTree<Integer,Integer> t = new TwoThreeTree<>();
            Map<Integer,Integer> counts = new HashMap<>();
            int expectedSize = 0;

            for (int op = 0; op < 1500; op++) {
                int k = rnd.nextInt(40);
                if (rnd.nextInt(3) != 0) {
                    t.insert(k, op);
                    counts.merge(k, 1, Integer::sum);
                    expectedSize++;
                } else {
                    boolean present = counts.getOrDefault(k, 0) > 0;
                    assertEquals(present, t.delete(k), "seed " + seed + " delete " + k);
                    if (present) {
                        counts.merge(k, -1, Integer::sum);
                        expectedSize--;
                    }
                }
                t.validate();
                assertEquals(expectedSize, t.size());
                assertEquals(counts.getOrDefault(k, 0) > 0, t.containsKey(k), "seed " + seed + " key " + k);
            }
        }
    }
}
