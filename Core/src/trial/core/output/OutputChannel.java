package trial.core.output;

import trial.core.exception.OutputCaptureException;
import trial.core.util.Logger;
import trial.core.util.ObjectChecker;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The process-wide output channel: {@link System#out} and {@link System#err}.
 *
 * At most one {@link Redirect} holds the channel at any time. The holder is tracked by a single permit rather than a
 * lock because a test that suspends may be completed, and its redirect closed, by a thread other than the one that
 * acquired it.
 */
public final class OutputChannel {
    private static final Logger LOGGER = Logger.forClass(OutputChannel.class);
    private static final OutputChannel SYSTEM = new OutputChannel();
    private final Semaphore permit = new Semaphore(1);

    private OutputChannel() {}

    /**
     * Returns the channel over the standard streams of this process.
     */
    public static OutputChannel system() {
        return SYSTEM;
    }

    /**
     * Waits until the channel is free and then redirects both stdout and stderr into the specified file, which is
     * created or truncated.
     *
     * @param file The file to redirect into.
     * @return the redirect, which must be closed to restore the channel.
     * @throws OutputCaptureException If the file cannot be opened. The channel is left untouched.
     */
    public Redirect acquire(File file) {
        ObjectChecker.assertNonNull(file);
        this.permit.acquireUninterruptibly();

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        PrintStream fileStream;
        try {
            originalOut.flush();
            originalErr.flush();
            fileStream = new PrintStream(new FileOutputStream(file, false), true, StandardCharsets.UTF_8);
        } catch (FileNotFoundException e) {
            this.permit.release();
            throw new OutputCaptureException("Unable to capture output into " + file.getPath(), e);
        }

        System.setOut(fileStream);
        System.setErr(fileStream);
        LOGGER.log("Redirected output into " + file.getPath());
        return new Redirect(originalOut, originalErr, fileStream);
    }

    /**
     * A held redirect of the channel. Closing it restores the streams that were in place when it was acquired and
     * frees the channel. Closing it more than once has no further effect.
     */
    public final class Redirect implements AutoCloseable {
        private final PrintStream originalOut;
        private final PrintStream originalErr;
        private final PrintStream fileStream;
        private final AtomicBoolean isClosed = new AtomicBoolean(false);

        private Redirect(PrintStream originalOut, PrintStream originalErr, PrintStream fileStream) {
            this.originalOut = originalOut;
            this.originalErr = originalErr;
            this.fileStream = fileStream;
        }

        /**
         * Returns the stdout stream in place before this redirect.
         */
        public PrintStream originalOut() {
            return this.originalOut;
        }

        /**
         * Writes the specified line into the redirect's file.
         */
        public void writeLine(String line) {
            this.fileStream.println(line);
        }

        @Override
        public void close() {
            if (this.isClosed.compareAndSet(false, true)) {
                try {
                    this.fileStream.flush();
                    System.setOut(this.originalOut);
                    System.setErr(this.originalErr);
                    this.fileStream.close();
                } finally {
                    OutputChannel.this.permit.release();
                }
                LOGGER.log("Restored output.");
            }
        }
    }
}
