package bench;

import twothree.Element;
import twothree.TwoThreeTree;
import java.util.Random;

/**
 * Random insert storm followed by a random delete storm, validating the tree
 * after every single operation. The tree must end up empty.
 *
 * Usage: RandomInsertDelete [numElements] [repetitions] [keyRange] [seed]
 */
public class RandomInsertDelete {

    static boolean run(int numElements, int keyRange, Random rnd) {
        TwoThreeTree<Integer,Integer> tree = new TwoThreeTree<>();
        int[] elements = new int[numElements];

        // Insert. Keys may repeat, every copy is stored.
        for (int i = 0; i < numElements; i++) {
            int key = rnd.nextInt(keyRange);
            elements[i] = key;
            tree.insert(key, key);
            tree.validate();
            Element<Integer,Integer> found = tree.find(key);
            if (found == null || found.getKey() != key) {
                System.err.printf("❌ find(%d) after insert returned %s%n", key, found);
                return false;
            }
        }
        if (tree.size() != numElements) {
            System.err.printf("❌ size %d after %d inserts%n", tree.size(), numElements);
            return false;
        }
        System.out.printf("Inserted %d keys, height %d%n", tree.size(), tree.height());

        // Delete in random order, swap-removing from the candidate list.
        for (int i = numElements; i > 0; i--) {
            int n = rnd.nextInt(i);
            int key = elements[n];
            elements[n] = elements[i - 1];
            if (!tree.delete(key)) {
                System.err.printf("❌ delete(%d) did not find the key, %d keys left%n", key, i);
                return false;
            }
            tree.validate();
        }
        if (!tree.isEmpty()) {
            System.err.printf("❌ tree not empty after deleting every key:%n%s", tree.dump());
            return false;
        }
        return true;
    }

    public static void main(String[] args) {
        int numElements = (args.length >= 1) ? Integer.parseInt(args[0]) : 10_000;
        int repetitions = (args.length >= 2) ? Integer.parseInt(args[1]) : 1;
        int keyRange = (args.length >= 3) ? Integer.parseInt(args[2]) : 10_000_000;
        long seed = (args.length >= 4) ? Long.parseLong(args[3]) : System.nanoTime();

        System.out.println("========================================");
        System.out.println("2-3 Tree Random Insert/Delete");
        System.out.printf("%d keys in [0, %d), %d repetition(s), seed %d%n", numElements, keyRange, repetitions, seed);
        System.out.println("========================================\n");

        Random rnd = new Random(seed);
        long start = System.nanoTime();
        for (int r = 0; r < repetitions; r++) {
            if (!run(numElements, keyRange, rnd)) {
                System.err.printf("%n❌ FAILED in repetition %d (seed %d)%n", r + 1, seed);
                System.exit(1);
            }
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        System.out.printf("%n✅ %d repetition(s) passed in %d ms%n", repetitions, elapsedMs);
    }
}
