package org.broadinstitute.replicon.exceptions;

import java.io.File;
import java.nio.file.Path;
import java.util.Collection;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed tables.
 * {@link org.broadinstitute.replicon.Main} reports them without a stack trace unless asked to.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For errors opening or listing input tables and directories.
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(final Path file, final Exception e) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), getMessage(e)), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For errors writing comparison tables, placement lists and reports.
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.getAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(final File file, final Exception e) {
            super(String.format("Couldn't write file %s because exception %s", file.getAbsolutePath(), getMessage(e)), e);
        }
    }

    /**
     * Malformed table content: a missing header, repeated column names or a line with the wrong number of values.
     */
    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super(message);
        }
    }

    /**
     * A required column is absent from an input table header.
     */
    public static class MissingColumn extends BadInput {
        private static final long serialVersionUID = 0L;

        private final String column;

        public MissingColumn(final String source, final String column, final Collection<String> available) {
            super(String.format("Column '%s' not found in %s. Available: %s",
                    column, source == null ? "input" : source, available));
            this.column = column;
        }

        public String getColumn() {
            return column;
        }
    }
}
