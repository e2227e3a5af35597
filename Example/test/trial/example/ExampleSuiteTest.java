package trial.example;

import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import trial.core.execution.CooperativeExecutionContext;
import trial.core.runner.TrialRunner;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

public class ExampleSuiteTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    public void testEverythingPasses() throws Exception {
        Calculator calculator = new Calculator();

        Assert.assertEquals(0, run(calculator, "-o", this.folder.getRoot().getPath()));

        String printed = printed();
        MatcherAssert.assertThat(printed, Matchers.containsString("Test Successful"));
        MatcherAssert.assertThat(printed, Matchers.endsWith(" 6 tests run.\n"));
        Assert.assertEquals(1_000 + 3, calculator.getOperations());
    }

    @Test
    public void testQuickModeSkipsLargeAdditions() throws Exception {
        Calculator calculator = new Calculator();

        Assert.assertEquals(0, run(calculator, "-q", "-o", this.folder.getRoot().getPath()));

        MatcherAssert.assertThat(printed(), Matchers.endsWith(" 5 tests run.\n"));
        Assert.assertEquals(3, calculator.getOperations());
    }

    @Test
    public void testSelectingStringsOnly() throws Exception {
        Assert.assertEquals(0, run(new Calculator(), "test", "str", "-o", this.folder.getRoot().getPath()));
        MatcherAssert.assertThat(printed(), Matchers.endsWith(" 2 tests run.\n"));
    }

    @Test
    public void testListing() throws Exception {
        Assert.assertEquals(0, run(new Calculator(), "list", "-o", this.folder.getRoot().getPath()));

        String printed = printed();
        MatcherAssert.assertThat(printed, Matchers.containsString("Addition on another thread"));
        MatcherAssert.assertThat(printed, Matchers.containsString("Large additions."));
        Assert.assertTrue(printed.indexOf("async") < printed.indexOf("math"));
    }

    private int run(Calculator calculator, String... args) {
        TrialRunner<Calculator> runner = TrialRunner.Builder.<Calculator>newBuilder("example")
                .addGroups(ExampleSuite.groups())
                .environment(Collections.emptyMap())
                .executionContext(CooperativeExecutionContext::create)
                .streams(new PrintStream(this.out, true, StandardCharsets.UTF_8), new PrintStream(this.err, true, StandardCharsets.UTF_8))
                .build();
        return runner.run(args, calculator);
    }

    private String printed() {
        return new String(this.out.toByteArray(), StandardCharsets.UTF_8);
    }
}
