package treelock.coordinator.metrics;

import org.junit.jupiter.api.Test;

import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class PercentilesTest {

    @Test
    void oneToHundredGivesExactRanks() {
        long[] durations = LongStream.rangeClosed(1, 100).toArray();

        LatencyStats stats = Percentiles.stats(durations);

        assertEquals(100, stats.count());
        assertEquals(50, stats.p50());
        assertEquals(95, stats.p95());
        assertEquals(99, stats.p99());
        assertEquals(100, stats.max());
    }

    @Test
    void unsortedInputIsSortedFirst() {
        long[] durations = LongStream.rangeClosed(1, 100).map(i -> 101 - i).toArray();

        assertEquals(50, Percentiles.stats(durations).p50());
        assertEquals(100, durations[0], "input must not be modified");
    }

    @Test
    void smallAndEmptySamples() {
        assertEquals(LatencyStats.EMPTY, Percentiles.stats(new long[0]));
        assertEquals(0, Percentiles.percentile(new long[0], 50));

        long[] single = {42};
        assertEquals(42, Percentiles.percentile(single, 50));
        assertEquals(42, Percentiles.percentile(single, 99));
        assertEquals(42, Percentiles.percentile(single, 0));

        long[] two = {10, 20};
        assertEquals(10, Percentiles.percentile(two, 50));
        assertEquals(20, Percentiles.percentile(two, 51));
    }
}
