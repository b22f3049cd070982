package bench;

import recordindex.ListRecordSequence;
import recordindex.Record;
import recordindex.RecordIndex;
import recordindex.RecordQueries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Single-threaded benchmark of the CPF index.
 * Compares a tree built from shuffled keys with one built from sorted keys,
 * which degenerates into a list.
 */
public class IndexBenchmark {

    public static void main(String[] args) {
        int keys = (args.length >= 1) ? Integer.parseInt(args[0]) : 10_000;
        int lookups = (args.length >= 2) ? Integer.parseInt(args[1]) : 100_000;

        List<String> cpfs = new ArrayList<>(keys);
        for (int i = 0; i < keys; i++) cpfs.add(cpf(i));

        List<String> shuffled = new ArrayList<>(cpfs);
        Collections.shuffle(shuffled, new Random(42));

        System.out.println("========================================");
        System.out.println("CPF index benchmark");
        System.out.printf("Keys=%d, Lookups=%d%n", keys, lookups);
        System.out.println("========================================\n");

        run("shuffled", shuffled, lookups);
        run("sorted", cpfs, lookups);
    }

    static void run(String label, List<String> cpfs, int lookups) {
        ListRecordSequence edl = new ListRecordSequence();
        for (String c : cpfs) edl.append(new Record(c, "Name " + c, "2000-01-01"));

        long t0 = System.nanoTime();
        RecordIndex index = RecordQueries.buildIndex(edl);
        long buildNanos = System.nanoTime() - t0;

        Random rnd = new Random(7);
        long hits = 0;
        t0 = System.nanoTime();
        for (int i = 0; i < lookups; i++) {
            String cpf = cpfs.get(rnd.nextInt(cpfs.size()));
            if (RecordQueries.lookupByKey(index, edl, cpf).isFound()) hits++;
        }
        long lookupNanos = System.nanoTime() - t0;
        double mopsPerSec = lookups / (lookupNanos / 1e9) / 1_000_000.0;

        System.out.printf("[%s] size=%d, height=%d, build=%.1f ms, lookups=%.3f Mops/s, hits=%d%n",
                label, index.size(), index.height(), buildNanos / 1e6, mopsPerSec, hits);
    }

    static String cpf(int i) {
        return String.format("%011d", i);
    }
}
