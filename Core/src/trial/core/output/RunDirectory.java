package trial.core.output;

import trial.core.identity.TestPath;
import trial.core.util.Logger;
import trial.core.util.ObjectChecker;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * The directory a run writes its output files into: {@code <base>/<run id>/}.
 *
 * Preparing the directory also points two symlinks in the base directory at it, one named after the test binary and
 * one named {@code latest}, on file systems that support them. A link name already taken by anything other than a
 * symlink is left alone.
 */
public final class RunDirectory {
    private static final Logger LOGGER = Logger.forClass(RunDirectory.class);
    private final File baseDirectory;
    private final String runId;

    private RunDirectory(File baseDirectory, String runId) {
        ObjectChecker.assertNonNull(baseDirectory, runId);
        this.baseDirectory = baseDirectory;
        this.runId = runId;
    }

    public static RunDirectory of(File baseDirectory, String runId) {
        return new RunDirectory(baseDirectory, runId);
    }

    /**
     * Returns a new unique run identifier.
     */
    public static String newRunId() {
        return UUID.randomUUID().toString().toUpperCase(Locale.ROOT);
    }

    public String getRunId() {
        return this.runId;
    }

    /**
     * Returns the directory of this run.
     */
    public File directory() {
        return new File(this.baseDirectory, this.runId);
    }

    /**
     * Returns the file the output of the specified test is captured into.
     */
    public File outputFile(TestPath path) {
        ObjectChecker.assertNonNull(path);
        return new File(directory(), path.outputFileName());
    }

    /**
     * Creates the directory of this run if it does not exist yet, along with the convenience symlinks.
     *
     * @param binaryName The name of the test binary, used to name one of the symlinks.
     * @throws IOException If the directory cannot be created, or exists but is not a directory.
     */
    public void prepare(String binaryName) throws IOException {
        ObjectChecker.assertNonNull(binaryName);
        Path runPath = directory().toPath();

        if (Files.exists(runPath)) {
            if (!Files.isDirectory(runPath)) {
                throw new IOException("exists but is not a directory: \"" + runPath + "\"");
            }
            return;
        }

        Files.createDirectories(runPath);
        LOGGER.log("Created run directory " + runPath);

        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            replaceWithSymlink(this.baseDirectory.toPath().resolve(binaryName), runPath);
            replaceWithSymlink(this.baseDirectory.toPath().resolve("latest"), runPath);
        }
    }

    private static void replaceWithSymlink(Path link, Path target) throws IOException {
        if (Files.isSymbolicLink(link)) {
            Files.delete(link);
        } else if (Files.exists(link)) {
            LOGGER.log("Not linking " + link + " to the run: a file or directory of that name already exists.");
            return;
        }
        Files.createSymbolicLink(link, target.toAbsolutePath());
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + directory() + " }";
    }
}
