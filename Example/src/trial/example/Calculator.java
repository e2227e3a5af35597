package trial.example;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * The code the example suite tests. It keeps a running count of the operations it performed.
 */
public final class Calculator {
    private int operations = 0;

    public synchronized int add(int left, int right) {
        this.operations++;
        return Math.addExact(left, right);
    }

    public synchronized int divide(int dividend, int divisor) {
        if (divisor == 0) {
            throw new IllegalArgumentException("divisor must be non-zero.");
        }
        this.operations++;
        return dividend / divisor;
    }

    /**
     * Adds the two numbers on the specified executor.
     */
    public CompletionStage<Integer> addLater(int left, int right, Executor executor) {
        return CompletableFuture.supplyAsync(() -> add(left, right), executor);
    }

    public synchronized int getOperations() {
        return this.operations;
    }
}
