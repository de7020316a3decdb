package org.broadinstitute.replicon.testutils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.replicon.utils.LoggingUtils;
import org.testng.Assert;
import org.testng.Reporter;
import org.testng.annotations.BeforeSuite;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;


/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it sets up the logger, and resolves the location of directories that we rely on.
 */
public abstract class BaseTest {

    @BeforeSuite
    public void setTestVerbosity(){
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    public static final Logger logger = LogManager.getLogger("org.broadinstitute.replicon");

    /**
     * Returns the location of the resource directory for the command line program.
     */
    public String getToolTestDataDir(){
        return "src/test/resources/" +this.getClass().getPackage().getName().replace(".","/") +"/" + getTestedClassName() + "/";
    }

    /**
     * Returns the name of the class being tested.
     * The default implementation takes the simple name of the test class and removes the trailing "Test".
     * Override if needed.
     */
    public String getTestedClassName(){
        if (getClass().getSimpleName().contains("IntegrationTest"))
            return getClass().getSimpleName().replaceAll("IntegrationTest$", "");
        else if (getClass().getSimpleName().contains("UnitTest"))
            return getClass().getSimpleName().replaceAll("UnitTest$", "");
        else
            return getClass().getSimpleName().replaceAll("Test$", "");
    }

    /**
     * @param fileName the name of a file
     * @return a File resolved using getToolTestDataDir as the parent and fileName
     */
    public File getTestFile(String fileName) {
        return new File(getToolTestDataDir(), fileName);
    }

    /**
     * Creates a temp file that will be deleted on exit after tests are complete.
     * @param name Prefix of the file.
     * @param extension Extension to concat to the end of the file.
     * @return A file in the temporary directory starting with name, ending with extension, which will be deleted after the program exits.
     */
    public static File createTempFile(final String name, final String extension) {
        try {
            final File file = File.createTempFile(name, extension);
            file.deleteOnExit();
            return file;
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot create temp file " + name + extension, e);
        }
    }

    /**
     * Creates a temp file holding the given lines, one per line.
     */
    public static File createTempFileWithContents(final String name, final String extension, final String... lines) {
        final File file = createTempFile(name, extension);
        try {
            Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot write temp file " + file, e);
        }
        return file;
    }

    /**
     * Creates an empty temp directory which will be deleted on exit after tests are complete
     *
     * @param prefix prefix for the directory name
     * @return an empty directory starting with prefix which will be deleted after the program exits
     */
    public static File createTempDir(final String prefix){
        try {
            final File dir = Files.createTempDirectory(prefix).toFile();
            dir.deleteOnExit();
            return dir;
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot create temp directory " + prefix, e);
        }
    }

    /**
     * Return a File object representing a file with the given name and extension that is guaranteed not to exist.
     */
    public static File getSafeNonExistentFile(final String fileNameWithExtension) {
        final File tempDir = createTempDir("nonExistentFileHolder");
        return new File(tempDir, fileNameWithExtension);
    }

    /**
     * Reads all lines of a test output.
     */
    public static List<String> readLines(final Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    public static List<String> readLines(final File file) {
        return readLines(file.toPath());
    }

    /**
     * Log this message so that it shows up inline during output as well as in html reports
     */
    public static void log(final String message) {
        Reporter.log(message, true);
    }

    private static final double DEFAULT_FLOAT_TOLERANCE = 1e-3;

    public static void assertEqualsDoubleSmart(final double actual, final double expected) {
        assertEqualsDoubleSmart(actual, expected, DEFAULT_FLOAT_TOLERANCE);
    }

    public static void assertEqualsDoubleSmart(final double actual, final double expected, final double tolerance) {
        if (Double.isNaN(expected)) {
            Assert.assertTrue(Double.isNaN(actual), "expected is nan, actual is not");
        } else if (Double.isInfinite(expected)) {
            Assert.assertEquals(actual, expected, "expected is infinite, actual is not the same");
        } else {
            Assert.assertEquals(actual, expected, tolerance);
        }
    }

    public static <T> void assertEqualsSet(final Set<T> actual, final Set<T> expected, final String info) {
        Assert.assertEquals(actual.size(), expected.size(), info + ": sizes differ");
        Assert.assertTrue(actual.containsAll(expected), info + ": " + actual + " does not contain " + expected);
    }

    public static void assertContains(String actual, String expectedSubstring){
        Assert.assertTrue(actual.contains(expectedSubstring),  expectedSubstring +" was not found in " + actual + ".");
    }

    public static void assertContainsAll(final Collection<String> actual, final String... expected) {
        for (final String e : expected) {
            Assert.assertTrue(actual.contains(e), e + " was not found in " + actual + ".");
        }
    }
}
