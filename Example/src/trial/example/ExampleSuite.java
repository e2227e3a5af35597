package trial.example;

import org.hamcrest.Matchers;
import trial.core.check.Check;
import trial.core.execution.CooperativeExecutionContext;
import trial.core.identity.SpeedTier;
import trial.core.registry.TestCase;
import trial.core.registry.TestGroup;
import trial.core.runner.TrialRunner;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

/**
 * An example test binary. Every test receives the shared {@link Calculator}.
 *
 * Run it with no arguments to run everything, or for instance with {@code test strings} or {@code list}.
 */
public final class ExampleSuite {

    private ExampleSuite() {}

    public static List<TestGroup<Calculator>> groups() {
        TestGroup<Calculator> math = TestGroup.of("math",
                TestCase.of("Addition", SpeedTier.QUICK, (Calculator calculator) -> {
                    Check.equal("1 + 1", 2, calculator.add(1, 1));
                }),
                TestCase.of("Division", SpeedTier.QUICK, (Calculator calculator) -> {
                    System.out.println("dividing 7 by 2");
                    Check.equal("7 / 2", 3, calculator.divide(7, 2));
                }),
                TestCase.of("Large additions", SpeedTier.SLOW, (Calculator calculator) -> {
                    for (int i = 0; i < 1_000; i++) {
                        Check.equal("i + i", 2 * i, calculator.add(i, i));
                    }
                }));

        TestGroup<Calculator> strings = TestGroup.of("strings",
                TestCase.of("Concatenation", SpeedTier.QUICK, (Calculator calculator) -> {
                    Check.that("concatenation", "tri" + "al", Matchers.equalTo("trial"));
                }),
                TestCase.of("Formatting", SpeedTier.QUICK, (Calculator calculator) -> {
                    System.err.println("formatting " + calculator.getOperations());
                    Check.that("formatted count", String.valueOf(calculator.getOperations()), Matchers.not(Matchers.emptyString()));
                }));

        TestGroup<Calculator> async = TestGroup.of("async",
                TestCase.async("Addition on another thread", SpeedTier.QUICK, (Calculator calculator) -> calculator
                        .addLater(20, 22, ForkJoinPool.commonPool())
                        .thenAccept((sum) -> Check.equal("20 + 22", 42, sum))));

        return Arrays.asList(math, strings, async);
    }

    public static void main(String[] args) {
        TrialRunner<Calculator> runner = TrialRunner.Builder.<Calculator>newBuilder("example")
                .addGroups(groups())
                .executionContext(CooperativeExecutionContext::create)
                .build();
        System.exit(runner.run(args, new Calculator()));
    }
}
