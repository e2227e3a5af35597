package trial.core.filter;

import trial.core.execution.Outcome;
import trial.core.execution.type.ExecutionTask;
import trial.core.identity.TestPath;
import trial.core.registry.SuiteEntry;
import trial.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Selects tests by group name and by index.
 *
 * A test matches if its group name contains a match for the name pattern and its index is one of the accepted cases.
 * Either criterion may be absent, in which case it accepts everything.
 */
public final class TestFilter {
    private final Pattern namePattern;
    private final CaseSelection cases;

    private TestFilter(Pattern namePattern, CaseSelection cases) {
        this.namePattern = namePattern;
        this.cases = cases;
    }

    /**
     * Returns a filter that matches every test.
     */
    public static TestFilter acceptAll() {
        return new TestFilter(null, null);
    }

    /**
     * Returns a filter with the specified criteria, each of which may be null.
     *
     * @param namePattern The pattern a group name must contain a match for, or null.
     * @param cases The accepted indices, or null.
     * @return the filter.
     */
    public static TestFilter matching(Pattern namePattern, CaseSelection cases) {
        return new TestFilter(namePattern, cases);
    }

    /**
     * Returns true iff the specified path is selected by this filter.
     */
    public boolean matches(TestPath path) {
        ObjectChecker.assertNonNull(path);
        boolean nameMatches = (this.namePattern == null) || this.namePattern.matcher(path.groupName).find();
        boolean caseMatches = (this.cases == null) || this.cases.contains(path.index);
        return nameMatches && caseMatches;
    }

    /**
     * Returns the matching entries, in their original order.
     *
     * @param entries The entries to filter.
     * @return the matching entries.
     */
    public <A> List<SuiteEntry<A>> drop(List<SuiteEntry<A>> entries) {
        ObjectChecker.assertNonNull(entries);
        List<SuiteEntry<A>> selected = new ArrayList<>();
        for (SuiteEntry<A> entry : entries) {
            if (matches(entry.path)) {
                selected.add(entry);
            }
        }
        return selected;
    }

    /**
     * Returns every entry, in its original order, with the tasks of the non-matching entries replaced by a task that
     * skips.
     *
     * @param entries The entries to filter.
     * @return the entries, of the same length and in the same order.
     */
    public <A> List<SuiteEntry<A>> substitute(List<SuiteEntry<A>> entries) {
        ObjectChecker.assertNonNull(entries);
        List<SuiteEntry<A>> substituted = new ArrayList<>(entries.size());
        for (SuiteEntry<A> entry : entries) {
            substituted.add(matches(entry.path) ? entry : entry.withTask(skipTask()));
        }
        return substituted;
    }

    /**
     * Returns a task that does not run anything and always yields {@link Outcome#skipped()}.
     */
    public static <A> ExecutionTask<A> skipTask() {
        return (argument) -> CompletableFuture.completedFuture(Outcome.skipped());
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.namePattern + ", cases: " + this.cases + " }";
    }
}
