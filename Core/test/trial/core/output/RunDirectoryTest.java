package trial.core.output;

import org.junit.Assert;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import trial.core.helper.AssertHelper;
import trial.core.identity.TestPath;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;

public class RunDirectoryTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testOutputFileLivesInTheRunDirectory() {
        RunDirectory runDirectory = RunDirectory.of(this.folder.getRoot(), "ABC");
        Assert.assertEquals(new File(new File(this.folder.getRoot(), "ABC"), "math.004.output"), runDirectory.outputFile(TestPath.of("Math", 4)));
    }

    @Test
    public void testRunIdsAreUniqueAndUppercase() {
        String first = RunDirectory.newRunId();
        Assert.assertNotEquals(first, RunDirectory.newRunId());
        Assert.assertEquals(first.toUpperCase(), first);
    }

    @Test
    public void testPrepareCreatesDirectoryAndLinks() throws Exception {
        assumePosix();
        RunDirectory runDirectory = RunDirectory.of(this.folder.getRoot(), "FIRST");
        runDirectory.prepare("calc");

        Assert.assertTrue(runDirectory.directory().isDirectory());
        assertLinksTo(link("calc"), runDirectory);
        assertLinksTo(link("latest"), runDirectory);
    }

    @Test
    public void testLaterRunsMoveTheLinks() throws Exception {
        assumePosix();
        RunDirectory.of(this.folder.getRoot(), "FIRST").prepare("calc");
        RunDirectory second = RunDirectory.of(this.folder.getRoot(), "SECOND");
        second.prepare("calc");

        assertLinksTo(link("calc"), second);
        assertLinksTo(link("latest"), second);
    }

    @Test
    public void testExistingDirectoryNamedLikeTheBinaryIsLeftAlone() throws Exception {
        assumePosix();
        File taken = this.folder.newFolder("calc");
        Files.write(new File(taken, "keep.txt").toPath(), "kept".getBytes(StandardCharsets.UTF_8));

        RunDirectory runDirectory = RunDirectory.of(this.folder.getRoot(), "RUN");
        runDirectory.prepare("calc");

        Assert.assertTrue(runDirectory.directory().isDirectory());
        Assert.assertFalse(Files.isSymbolicLink(link("calc")));
        Assert.assertTrue(new File(taken, "keep.txt").isFile());
        assertLinksTo(link("latest"), runDirectory);
    }

    @Test
    public void testRunPathThatIsAFileIsRejected() throws Exception {
        this.folder.newFile("TAKEN");
        RunDirectory runDirectory = RunDirectory.of(this.folder.getRoot(), "TAKEN");
        AssertHelper.assertThrows(IOException.class, () -> runDirectory.prepare("calc"));
    }

    private Path link(String name) {
        return this.folder.getRoot().toPath().resolve(name);
    }

    private static void assertLinksTo(Path link, RunDirectory runDirectory) throws IOException {
        Assert.assertTrue(Files.isSymbolicLink(link));
        Assert.assertEquals(runDirectory.directory().toPath().toAbsolutePath(), Files.readSymbolicLink(link));
    }

    private static void assumePosix() {
        Assume.assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    }
}
