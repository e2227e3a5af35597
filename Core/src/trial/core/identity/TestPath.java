package trial.core.identity;

import trial.core.util.ObjectChecker;

import java.util.Locale;

/**
 * The identity of a single test case: the name of the group it was registered in and its position in that group.
 *
 * Two paths whose group names only differ in case have the same {@link #fileKey()}. They are distinct values but they
 * would write to the same output file, so a suite treats them as the same test.
 */
public final class TestPath implements Comparable<TestPath> {
    public final String groupName;
    public final int index;

    private TestPath(String groupName, int index) {
        ObjectChecker.assertNonNull(groupName);
        ObjectChecker.assertNonNegative(index);
        this.groupName = groupName;
        this.index = index;
    }

    public static TestPath of(String groupName, int index) {
        return new TestPath(groupName, index);
    }

    /**
     * Returns the short form of this path: the group name and the index zero-padded to three digits.
     *
     * @return the display string, like {@code math.001}.
     */
    public String display() {
        return format(this.groupName, this.index);
    }

    /**
     * Returns the case-insensitive key of this path, used to decide whether two tests collide.
     *
     * @return the display string with the group name lower-cased.
     */
    public String fileKey() {
        return format(this.groupName.toLowerCase(Locale.ROOT), this.index);
    }

    /**
     * Returns the name of the file this test's output is captured into.
     *
     * @return the file name.
     */
    public String outputFileName() {
        return fileKey() + ".output";
    }

    @Override
    public int compareTo(TestPath other) {
        int byName = this.groupName.compareTo(other.groupName);
        return (byName != 0) ? byName : Integer.compare(this.index, other.index);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TestPath)) {
            return false;
        }
        TestPath otherPath = (TestPath) other;
        return (this.index == otherPath.index) && this.groupName.equals(otherPath.groupName);
    }

    @Override
    public int hashCode() {
        return 31 * this.groupName.hashCode() + this.index;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + display() + " }";
    }

    private static String format(String name, int index) {
        return String.format("%s.%03d", name, index);
    }
}
