package trial.core.output;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import trial.core.exception.OutputCaptureException;
import trial.core.execution.ExecutionStatus;
import trial.core.execution.FaultKind;
import trial.core.execution.Outcome;
import trial.core.execution.type.ExecutionTask;
import trial.core.helper.AssertHelper;
import trial.core.identity.TestPath;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class OutputCaptureTest {
    private static final TestPath PATH = TestPath.of("Capture", 2);
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();
    private PrintStream savedOut;
    private PrintStream savedErr;
    private ByteArrayOutputStream console;
    private PrintStream consoleStream;
    private RunDirectory runDirectory;

    @Before
    public void setup() throws Exception {
        this.savedOut = System.out;
        this.savedErr = System.err;
        this.console = new ByteArrayOutputStream();
        this.consoleStream = new PrintStream(this.console, true, StandardCharsets.UTF_8);
        System.setOut(this.consoleStream);
        System.setErr(this.consoleStream);

        this.runDirectory = RunDirectory.of(this.folder.getRoot(), "RUN");
        this.runDirectory.prepare("capture");
    }

    @After
    public void tearDown() {
        System.setOut(this.savedOut);
        System.setErr(this.savedErr);
    }

    @Test(timeout = 10_000)
    public void testOutputIsCapturedAndStreamsRestored() throws Exception {
        ExecutionTask<Void> task = (argument) -> {
            System.out.println("to stdout");
            System.err.println("to stderr");
            return CompletableFuture.completedFuture(Outcome.ok());
        };

        Outcome outcome = AssertHelper.outcomeOf(capture(false, true).wrap(PATH, task), null);

        Assert.assertEquals(ExecutionStatus.OK, outcome.status);
        Assert.assertSame(this.consoleStream, System.out);
        Assert.assertSame(this.consoleStream, System.err);
        Assert.assertEquals("to stdout\nto stderr\n", read(this.runDirectory.outputFile(PATH)));
        Assert.assertEquals("", console());
    }

    @Test(timeout = 10_000)
    public void testErrorIsAppendedAndEchoed() throws Exception {
        ExecutionTask<Void> task = (argument) -> {
            System.out.println("before failing");
            return CompletableFuture.completedFuture(Outcome.fault(FaultKind.EXCEPTION, "boom"));
        };

        AssertHelper.outcomeOf(capture(false, true).wrap(PATH, task), null);

        Assert.assertSame(this.consoleStream, System.out);
        Assert.assertEquals("before failing\n[exception] boom\n", read(this.runDirectory.outputFile(PATH)));
        Assert.assertEquals("[exception] boom\n", console());
    }

    @Test(timeout = 10_000)
    public void testErrorIsNotEchoedWhenDisabled() throws Exception {
        ExecutionTask<Void> task = (argument) -> CompletableFuture.completedFuture(Outcome.checkFailed("bad"));

        AssertHelper.outcomeOf(capture(false, false).wrap(PATH, task), null);

        Assert.assertEquals("bad\n", read(this.runDirectory.outputFile(PATH)));
        Assert.assertEquals("", console());
    }

    @Test(timeout = 10_000)
    public void testRedirectIsHeldWhileSuspended() throws Exception {
        CompletableFuture<Outcome> pending = new CompletableFuture<>();
        ExecutionTask<Void> task = (argument) -> pending;

        CompletableFuture<Outcome> outcome = capture(false, true).wrap(PATH, task).execute(null).toCompletableFuture();
        Assert.assertNotSame(this.consoleStream, System.out);
        System.out.println("while suspended");

        Thread completer = new Thread(() -> pending.complete(Outcome.ok()));
        completer.start();
        completer.join();

        Assert.assertEquals(ExecutionStatus.OK, outcome.get(10, TimeUnit.SECONDS).status);
        Assert.assertSame(this.consoleStream, System.out);
        Assert.assertEquals("while suspended\n", read(this.runDirectory.outputFile(PATH)));
    }

    @Test(timeout = 10_000)
    public void testSynchronousThrowRestoresStreams() {
        ExecutionTask<Void> task = (argument) -> {
            throw new IllegalStateException("escaped");
        };

        IllegalStateException e = AssertHelper.assertThrows(IllegalStateException.class, () -> capture(false, true).wrap(PATH, task).execute(null));

        Assert.assertEquals("escaped", e.getMessage());
        Assert.assertSame(this.consoleStream, System.out);
        Assert.assertSame(this.consoleStream, System.err);
    }

    @Test(timeout = 10_000)
    public void testUnopenableFileLeavesChannelUsable() throws Exception {
        RunDirectory missing = RunDirectory.of(new File(this.folder.getRoot(), "missing"), "RUN");
        ExecutionTask<Void> task = (argument) -> CompletableFuture.completedFuture(Outcome.ok());

        OutputCapture broken = OutputCapture.into(OutputChannel.system(), missing, false, true);
        AssertHelper.assertThrows(OutputCaptureException.class, () -> broken.wrap(PATH, task).execute(null));
        Assert.assertSame(this.consoleStream, System.out);

        Assert.assertEquals(ExecutionStatus.OK, AssertHelper.outcomeOf(capture(false, true).wrap(PATH, task), null).status);
    }

    @Test
    public void testVerboseCapturesNothing() {
        ExecutionTask<Void> task = (argument) -> CompletableFuture.completedFuture(Outcome.ok());
        Assert.assertSame(task, capture(true, true).wrap(PATH, task));
    }

    private OutputCapture capture(boolean verbose, boolean echoErrors) {
        return OutputCapture.into(OutputChannel.system(), this.runDirectory, verbose, echoErrors);
    }

    private String console() {
        return new String(this.console.toByteArray(), StandardCharsets.UTF_8);
    }

    private static String read(File file) throws Exception {
        return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    }
}
