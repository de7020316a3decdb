package org.broadinstitute.replicon.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

public final class IOUtils {

    private IOUtils() {}

    /**
     * Makes a reader for a file, unzipping if the file's name ends with '.gz'.
     */
    public static Reader makeReaderMaybeGzipped(final Path path) throws IOException {
        final InputStream in = new BufferedInputStream(Files.newInputStream(Utils.nonNull(path)));
        // toString because path.endsWith only checks whole path components, not substrings.
        return makeReaderMaybeGzipped(in, path.toString().endsWith(".gz"));
    }

    /**
     * Makes a UTF-8 reader for an inputStream wrapping it in an appropriate unzipper if necessary.
     * @param zipped is this stream zipped
     */
    public static Reader makeReaderMaybeGzipped(final InputStream in, final boolean zipped) throws IOException {
        if (zipped) {
            return new InputStreamReader(makeZippedInputStream(in), StandardCharsets.UTF_8);
        } else {
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        }
    }

    /**
     * Creates an input stream from a zipped stream.
     * @return a block gzipped input stream if the data is block gzipped, a plain gzip stream otherwise.
     */
    public static InputStream makeZippedInputStream(final InputStream in) throws IOException {
        Utils.nonNull(in);
        if (BlockCompressedInputStream.isValidFile(in)) {
            return new BlockCompressedInputStream(in);
        } else {
            return new GZIPInputStream(in);
        }
    }

    /**
     * @param path Path to test
     * @throws UserException.CouldNotReadInputFile if the file isn't readable and a regular file
     */
    public static void assertFileIsReadable(final Path path) {
        Utils.nonNull(path);
        if ( ! Files.exists(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It doesn't exist.");
        }
        if ( ! Files.isRegularFile(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It isn't a regular file");
        }
        if ( ! Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It is not readable, check the file permissions");
        }
    }

    /**
     * Creates an output directory and its parents if they don't exist yet.
     * @throws UserException.CouldNotCreateOutputFile if the directory could not be created.
     */
    public static void createDirectories(final Path directory) {
        Utils.nonNull(directory);
        try {
            Files.createDirectories(directory);
        } catch (final IOException ex) {
            throw new UserException.CouldNotCreateOutputFile(directory.toFile(), ex);
        }
    }

    /**
     * Opens a UTF-8 print writer on a file, replacing any existing content.
     */
    public static PrintWriter makePrintWriter(final Path path) throws IOException {
        return new PrintWriter(Files.newBufferedWriter(Utils.nonNull(path), StandardCharsets.UTF_8));
    }
}
