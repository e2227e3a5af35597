package trial.core.filter;

import trial.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A selection of test case indices, held as the inclusive ranges it was written as. Membership is checked against the
 * ranges, so a selection as wide as {@code 0-2147483647} costs no more than a single index.
 */
public final class CaseSelection {
    private final List<Range> ranges;

    private CaseSelection(List<Range> ranges) {
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    /**
     * Returns a selection of the specified ranges, each of which must be non-empty and non-negative.
     */
    public static CaseSelection of(List<Range> ranges) {
        ObjectChecker.assertNonNull(ranges);
        return new CaseSelection(ranges);
    }

    /**
     * Returns a selection of exactly the specified indices.
     */
    public static CaseSelection ofIndices(int... indices) {
        List<Range> ranges = new ArrayList<>(indices.length);
        for (int index : indices) {
            ranges.add(Range.of(index, index));
        }
        return new CaseSelection(ranges);
    }

    /**
     * Returns true iff the specified index falls into one of the ranges.
     */
    public boolean contains(int index) {
        for (Range range : this.ranges) {
            if (range.contains(index)) {
                return true;
            }
        }
        return false;
    }

    public List<Range> getRanges() {
        return this.ranges;
    }

    @Override
    public boolean equals(Object other) {
        return (other instanceof CaseSelection) && this.ranges.equals(((CaseSelection) other).ranges);
    }

    @Override
    public int hashCode() {
        return this.ranges.hashCode();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.ranges + " }";
    }

    /**
     * An inclusive range of indices.
     */
    public static final class Range {
        public final int lower;
        public final int upper;

        private Range(int lower, int upper) {
            ObjectChecker.assertNonNegative(lower);
            if (lower > upper) {
                throw new IllegalArgumentException("lower bound " + lower + " exceeds upper bound " + upper);
            }
            this.lower = lower;
            this.upper = upper;
        }

        public static Range of(int lower, int upper) {
            return new Range(lower, upper);
        }

        public boolean contains(int index) {
            return (this.lower <= index) && (index <= this.upper);
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Range)) {
                return false;
            }
            Range otherRange = (Range) other;
            return (this.lower == otherRange.lower) && (this.upper == otherRange.upper);
        }

        @Override
        public int hashCode() {
            return 31 * this.lower + this.upper;
        }

        @Override
        public String toString() {
            return (this.lower == this.upper) ? String.valueOf(this.lower) : this.lower + "-" + this.upper;
        }
    }
}
