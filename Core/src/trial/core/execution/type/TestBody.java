package trial.core.execution.type;

/**
 * The body of a synchronous test. It is done when it returns.
 */
@FunctionalInterface
public interface TestBody<A> {

    /**
     * Runs the test.
     *
     * @param argument The argument every test of the run receives.
     * @throws Exception If the test fails.
     */
    public void run(A argument) throws Exception;
}
