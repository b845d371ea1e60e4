package bench;

import twothree.TwoThreeTree;
import java.util.Random;
import java.util.TreeMap;

/**
 * Single-threaded throughput of TwoThreeTree against java.util.TreeMap.
 *
 * Usage: MicroBench [numElements] [rounds]
 */
public class MicroBench {

    interface KV {
        void insert(int k);
        boolean delete(int k);
        Integer get(int k);
    }

    static class TwoThreeKV implements KV {
        private final TwoThreeTree<Integer,Integer> map = new TwoThreeTree<>();
        public void insert(int k) { map.insert(k, k); }
        public boolean delete(int k) { return map.delete(k); }
        public Integer get(int k) { return map.get(k); }
    }

    static class TreeMapKV implements KV {
        private final TreeMap<Integer,Integer> map = new TreeMap<>();
        public void insert(int k) { map.put(k, k); }
        public boolean delete(int k) { return map.remove(k) != null; }
        public Integer get(int k) { return map.get(k); }
    }

    static class Result {
        long insertNanos;
        long getNanos;
        long deleteNanos;
    }

    static int[] shuffledKeys(int n, Random rnd) {
        int[] keys = new int[n];
        for (int i = 0; i < n; i++) keys[i] = i;
        for (int i = n - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int tmp = keys[i]; keys[i] = keys[j]; keys[j] = tmp;
        }
        return keys;
    }

    static Result runRound(KV ds, int[] insertOrder, int[] lookupOrder, int[] deleteOrder) {
        Result result = new Result();

        long t0 = System.nanoTime();
        for (int k : insertOrder) ds.insert(k);
        long t1 = System.nanoTime();
        for (int k : lookupOrder) {
            if (ds.get(k) == null) throw new IllegalStateException("missing key " + k);
        }
        long t2 = System.nanoTime();
        for (int k : deleteOrder) {
            if (!ds.delete(k)) throw new IllegalStateException("delete missed key " + k);
        }
        long t3 = System.nanoTime();

        result.insertNanos = t1 - t0;
        result.getNanos = t2 - t1;
        result.deleteNanos = t3 - t2;
        return result;
    }

    static double mops(int ops, long nanos) {
        return ops / (nanos / 1e9) / 1_000_000.0;
    }

    public static void main(String[] args) {
        int numElements = (args.length >= 1) ? Integer.parseInt(args[0]) : 200_000;
        int rounds = (args.length >= 2) ? Integer.parseInt(args[1]) : 5;

        Random rnd = new Random(42);
        int[] insertOrder = shuffledKeys(numElements, rnd);
        int[] lookupOrder = shuffledKeys(numElements, rnd);
        int[] deleteOrder = shuffledKeys(numElements, rnd);

        System.out.printf("Elements=%d, Rounds=%d (first round is warmup)%n", numElements, rounds);
        System.out.printf("%-12s %6s %12s %12s %12s%n", "Impl", "Round", "insert Mops", "get Mops", "delete Mops");

        for (int r = 0; r < rounds; r++) {
            Result a = runRound(new TwoThreeKV(), insertOrder, lookupOrder, deleteOrder);
            Result b = runRound(new TreeMapKV(), insertOrder, lookupOrder, deleteOrder);
            String round = (r == 0) ? "warm" : String.valueOf(r);
            System.out.printf("%-12s %6s %12.2f %12.2f %12.2f%n", "TwoThreeTree", round,
                    mops(numElements, a.insertNanos), mops(numElements, a.getNanos), mops(numElements, a.deleteNanos));
            System.out.printf("%-12s %6s %12.2f %12.2f %12.2f%n", "TreeMap", round,
                    mops(numElements, b.insertNanos), mops(numElements, b.getNanos), mops(numElements, b.deleteNanos));
        }
    }
}
