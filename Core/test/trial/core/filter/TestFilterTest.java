package trial.core.filter;

import org.junit.Assert;
import org.junit.Test;
import trial.core.execution.ExecutionStatus;
import trial.core.execution.Outcome;
import trial.core.execution.type.ExecutionTask;
import trial.core.helper.AssertHelper;
import trial.core.identity.TestPath;
import trial.core.registry.SuiteEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

public class TestFilterTest {
    private static final ExecutionTask<Void> PASSING = (argument) -> CompletableFuture.completedFuture(Outcome.ok());

    @Test
    public void testAcceptAllMatchesEverything() {
        TestFilter filter = TestFilter.acceptAll();
        Assert.assertTrue(filter.matches(TestPath.of("anything", 0)));
        Assert.assertTrue(filter.matches(TestPath.of("else", 999)));
    }

    @Test
    public void testNamePatternIsSearchedNotAnchored() {
        TestFilter filter = TestFilter.matching(Pattern.compile("at"), null);
        Assert.assertTrue(filter.matches(TestPath.of("math", 3)));
        Assert.assertTrue(filter.matches(TestPath.of("formatting", 0)));
        Assert.assertFalse(filter.matches(TestPath.of("strings", 0)));
    }

    @Test
    public void testBothCriteriaMustMatch() {
        TestFilter filter = TestFilter.matching(Pattern.compile("^math$"), CaseSelection.ofIndices(1, 2));
        Assert.assertTrue(filter.matches(TestPath.of("math", 1)));
        Assert.assertFalse(filter.matches(TestPath.of("math", 0)));
        Assert.assertFalse(filter.matches(TestPath.of("strings", 1)));
    }

    @Test
    public void testCasesOnly() {
        TestFilter filter = TestFilter.matching(null, CaseSelection.ofIndices(0));
        Assert.assertTrue(filter.matches(TestPath.of("a", 0)));
        Assert.assertFalse(filter.matches(TestPath.of("a", 1)));
    }

    @Test
    public void testCaseRangesUpToTheLargestIndex() {
        TestFilter filter = TestFilter.matching(null, CaseSelection.of(Arrays.asList(CaseSelection.Range.of(3, Integer.MAX_VALUE))));
        Assert.assertTrue(filter.matches(TestPath.of("a", Integer.MAX_VALUE)));
        Assert.assertTrue(filter.matches(TestPath.of("a", 3)));
        Assert.assertFalse(filter.matches(TestPath.of("a", 2)));
    }

    @Test
    public void testDropKeepsMatchingEntriesInOrder() {
        List<SuiteEntry<Void>> entries = entries();
        List<SuiteEntry<Void>> kept = TestFilter.matching(Pattern.compile("^(alpha|gamma)$"), CaseSelection.ofIndices(1)).drop(entries);

        Assert.assertEquals(2, kept.size());
        Assert.assertSame(entries.get(1), kept.get(0));
        Assert.assertSame(entries.get(5), kept.get(1));
    }

    @Test
    public void testDropWithAcceptAllKeepsEverything() {
        List<SuiteEntry<Void>> entries = entries();
        Assert.assertEquals(entries, TestFilter.acceptAll().drop(entries));
    }

    @Test
    public void testSubstituteSkipsNonMatchingEntries() throws Exception {
        List<SuiteEntry<Void>> entries = entries();
        List<SuiteEntry<Void>> substituted = TestFilter.matching(Pattern.compile("beta"), null).substitute(entries);

        Assert.assertEquals(entries.size(), substituted.size());
        for (int i = 0; i < entries.size(); i++) {
            SuiteEntry<Void> entry = substituted.get(i);
            Assert.assertEquals(entries.get(i).path, entry.path);

            ExecutionStatus expected = entry.path.groupName.equals("beta") ? ExecutionStatus.OK : ExecutionStatus.SKIPPED;
            Assert.assertEquals(expected, AssertHelper.outcomeOf(entry.task, null).status);
        }
    }

    @Test
    public void testSkipTaskNeverRunsAnything() throws Exception {
        Outcome outcome = AssertHelper.outcomeOf(TestFilter.<Void>skipTask(), null);
        Assert.assertEquals(ExecutionStatus.SKIPPED, outcome.status);
        Assert.assertFalse(outcome.hasRun());
    }

    private static List<SuiteEntry<Void>> entries() {
        List<SuiteEntry<Void>> entries = new ArrayList<>();
        for (String name : Arrays.asList("alpha", "beta", "gamma")) {
            entries.add(SuiteEntry.of(TestPath.of(name, 0), PASSING));
            entries.add(SuiteEntry.of(TestPath.of(name, 1), PASSING));
        }
        return entries;
    }
}
