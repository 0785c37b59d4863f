package de.bsommerfeld.onova.progress;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressMixerTest {

    private static final double EPSILON = 1e-9;

    @Test
    void split_shouldMapLocalFractionIntoReservedInterval() {
        List<Double> reported = new CopyOnWriteArrayList<>();
        var mixer = new ProgressMixer(reported::add);
        ProgressListener download = mixer.split(0.9);
        ProgressListener extract = mixer.split(0.1);

        download.report(0.5);
        assertEquals(0.45, last(reported), EPSILON);

        download.report(1.0);
        assertEquals(0.9, last(reported), EPSILON);

        extract.report(0.5);
        assertEquals(0.95, last(reported), EPSILON);

        extract.report(1.0);
        assertEquals(1.0, last(reported), EPSILON);
    }

    @Test
    void split_shouldClampOutOfRangeFractions() {
        List<Double> reported = new CopyOnWriteArrayList<>();
        var mixer = new ProgressMixer(reported::add);
        ProgressListener split = mixer.split(0.9);
        mixer.split(0.1);

        split.report(2.0);
        assertEquals(0.9, last(reported), EPSILON);

        split.report(-1.0);
        assertEquals(0.0, last(reported), EPSILON);

        split.report(Double.NaN);
        assertEquals(0.0, last(reported), EPSILON);
    }

    @Test
    void split_shouldRejectNonPositiveWidth() {
        var mixer = new ProgressMixer(ProgressListener.none());
        assertThrows(IllegalArgumentException.class, () -> mixer.split(0));
        assertThrows(IllegalArgumentException.class, () -> mixer.split(-0.1));
    }

    @Test
    void split_shouldRejectAllocationBeyondFullRange() {
        var mixer = new ProgressMixer(ProgressListener.none());
        mixer.split(0.9);
        assertThrows(IllegalArgumentException.class, () -> mixer.split(0.2));
    }

    @Test
    void report_shouldStayWithinBoundsUnderConcurrentReporting() throws InterruptedException {
        List<Double> reported = new CopyOnWriteArrayList<>();
        var mixer = new ProgressMixer(reported::add);
        List<ProgressListener> splits = List.of(mixer.split(0.9), mixer.split(0.1));

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            ProgressListener split = splits.get(t % 2);
            executor.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 500; i++) {
                    split.report(ThreadLocalRandom.current().nextDouble(-0.5, 1.5));
                }
                split.report(1.0);
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        for (double value : reported) {
            assertTrue(value >= 0.0 && value <= 1.0, "out of range: " + value);
        }
    }

    @Test
    void none_shouldIgnoreReports() {
        assertDoesNotThrow(() -> ProgressListener.none().report(0.5));
        assertNotNull(ProgressListener.orNone(null));
    }

    private static double last(List<Double> values) {
        return values.get(values.size() - 1);
    }
}
