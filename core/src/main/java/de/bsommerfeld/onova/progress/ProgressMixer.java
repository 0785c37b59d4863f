package de.bsommerfeld.onova.progress;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines several independently reported progress streams into one
 * downstream fraction.
 *
 * <p>
 * Each {@link #split(double)} reserves the next interval
 * {@code [start, start + width]} of the overall range. A split that reports a
 * local fraction {@code f} contributes {@code f * width}; the downstream
 * listener receives the sum of all contributions. When splits complete in
 * order this equals {@code start + f * width}.
 *
 * <h3>Concurrency</h3>
 * Splits may report from different threads. Contributions are updated and
 * summed under one monitor, and the downstream report happens inside it, so
 * every downstream value is a consistent snapshot within {@code [0, 1]}.
 * Local fractions outside {@code [0, 1]} are clamped to keep a split inside
 * its own interval.
 */
public final class ProgressMixer {

    private final ProgressListener target;
    private final List<Split> splits = new ArrayList<>();
    private double allocated;

    public ProgressMixer(ProgressListener target) {
        this.target = Preconditions.checkNotNull(target, "target");
    }

    /**
     * Reserves the next {@code width} of the overall range.
     *
     * @throws IllegalArgumentException if {@code width} is not positive or the
     *                                  total would exceed 1.0
     */
    public synchronized ProgressListener split(double width) {
        Preconditions.checkArgument(width > 0, "Split width must be positive: %s", width);
        Preconditions.checkArgument(allocated + width <= 1.0 + 1e-9,
                "Splits exceed the full range: %s + %s", allocated, width);

        Split split = new Split(allocated, width);
        allocated += width;
        splits.add(split);
        return split;
    }

    private synchronized void onReport(Split split, double fraction) {
        split.contribution = clamp(fraction) * split.width;

        double total = 0;
        for (Split s : splits) {
            total += s.contribution;
        }
        target.report(Math.min(1.0, total));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** One reserved interval. Mutated only under the mixer's monitor. */
    private final class Split implements ProgressListener {

        private final double start;
        private final double width;
        private double contribution;

        private Split(double start, double width) {
            this.start = start;
            this.width = width;
        }

        @Override
        public void report(double fraction) {
            onReport(this, fraction);
        }

        @Override
        public String toString() {
            return "Split[" + start + ", " + (start + width) + "]";
        }
    }
}
