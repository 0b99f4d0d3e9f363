package bench;

import avl.AVLTree;
import avl.PathAVLTree;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded throughput comparison of both AVL variants against java.util.TreeMap
 * used as a counting multiset. Warmup first, then the measured runs in randomized order.
 *
 * Usage: TreeSetComparison [seconds] [preload] [keyRange]
 */
public class TreeSetComparison {

    interface MultisetInterface {
        void insert(int k);
        void erase(int k);
        boolean contains(int k);
        int size();
    }

    static class AVLWrapper implements MultisetInterface {
        private final AVLTree<Integer> tree = new AVLTree<>();
        public void insert(int k) { tree.insert(k); }
        public void erase(int k) { tree.erase(k); }
        public boolean contains(int k) { return tree.contains(k); }
        public int size() { return tree.size(); }
    }

    static class PathAVLWrapper implements MultisetInterface {
        private final PathAVLTree<Integer> tree = new PathAVLTree<>();
        public void insert(int k) { tree.insert(k); }
        public void erase(int k) { tree.erase(k); }
        public boolean contains(int k) { return tree.contains(k); }
        public int size() { return tree.size(); }
    }

    static class TreeMapWrapper implements MultisetInterface {
        private final TreeMap<Integer,Integer> counts = new TreeMap<>();
        private int size;
        public void insert(int k) { counts.merge(k, 1, Integer::sum); size++; }
        public void erase(int k) {
            Integer c = counts.get(k);
            if (c == null) return;
            if (c == 1) counts.remove(k); else counts.put(k, c - 1);
            size--;
        }
        public boolean contains(int k) { return counts.containsKey(k); }
        public int size() { return size; }
    }

    static final String[] IMPLS = {"avl", "path-avl", "treemap"};

    static MultisetInterface create(String impl) {
        switch (impl) {
            case "avl":      return new AVLWrapper();
            case "path-avl": return new PathAVLWrapper();
            case "treemap":  return new TreeMapWrapper();
            default: throw new IllegalArgumentException("unknown implementation: " + impl);
        }
    }

    static class TestConfig {
        int findPercent;
        String impl;

        TestConfig(int findPercent, String impl) {
            this.findPercent = findPercent;
            this.impl = impl;
        }
    }

    static long runTest(MultisetInterface ds, int seconds, int preload, int keyRange, int findPercent) {
        Random rnd = new Random(7);
        for (int i = 0; i < preload; i++) ds.insert(rnd.nextInt(keyRange));

        // the rest is split evenly between inserts and erases, so the size stays put
        final int insertPercent = findPercent + (100 - findPercent) / 2;
        final long endAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        long ops = 0;
        while (System.nanoTime() < endAt) {
            // check the clock every 1024 ops only
            for (int i = 0; i < 1024; i++) {
                int k = rnd.nextInt(keyRange);
                int r = rnd.nextInt(100);
                if (r < findPercent) ds.contains(k);
                else if (r < insertPercent) ds.insert(k);
                else ds.erase(k);
            }
            ops += 1024;
        }
        return ops;
    }

    public static void main(String[] args) {
        int seconds = (args.length >= 1) ? Integer.parseInt(args[0]) : 3;
        int preload = (args.length >= 2) ? Integer.parseInt(args[1]) : 100_000;
        int keyRange = (args.length >= 3) ? Integer.parseInt(args[2]) : 200_000;
        int warmupSeconds = 1;
        int[] findPercentages = {0, 50, 90};

        System.out.println("AVL tree vs java.util.TreeMap (counting multiset)");
        System.out.printf("Preload=%,d keys, key range=%,d, %d seconds per test%n%n", preload, keyRange, seconds);

        System.out.print("Warmup... ");
        for (String impl : IMPLS) runTest(create(impl), warmupSeconds, preload, keyRange, 50);
        System.out.println("done\n");

        List<TestConfig> allTests = new ArrayList<>();
        for (int findPercent : findPercentages) {
            for (String impl : IMPLS) allTests.add(new TestConfig(findPercent, impl));
        }
        Collections.shuffle(allTests, new Random(42));  // Fixed seed for reproducibility

        Map<String, Long> testResults = new HashMap<>();
        int testNum = 0;
        for (TestConfig config : allTests) {
            testNum++;
            System.out.printf("[%2d/%2d] %-8s %2d%% find... ", testNum, allTests.size(), config.impl, config.findPercent);
            System.out.flush();
            long ops = runTest(create(config.impl), seconds, preload, keyRange, config.findPercent);
            testResults.put(config.findPercent + "_" + config.impl, ops);
            System.out.printf("%,d ops%n", ops);
        }

        System.out.println();
        System.out.printf("%-8s %15s %15s %15s %10s%n", "find %", "avl", "path-avl", "treemap", "avl/tm");
        for (int findPercent : findPercentages) {
            long avl = testResults.get(findPercent + "_avl");
            long path = testResults.get(findPercent + "_path-avl");
            long tm = testResults.get(findPercent + "_treemap");
            System.out.printf("%-8d %,15.0f %,15.0f %,15.0f %9.2fx%n", findPercent,
                    avl / (double) seconds, path / (double) seconds, tm / (double) seconds, (double) avl / tm);
        }
        System.out.println("(ops per second)");
    }
}
