package org.broadinstitute.replicon.utils.tsv;

import org.broadinstitute.replicon.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line string array wrapper.
 * <p>
 * Values are read by column name with {@link #get get} from within
 * {@link TableReader#createRecord(DataLine) TableReader.createRecord} and set in order of appearance
 * with {@link #append append} from within {@link TableWriter#composeLine TableWriter.composeLine}.
 * </p>
 * <p>
 * Requests for an unknown column are reported through the format error factory provided by the
 * enclosing reader, so that the error message can point at the offending file and line.
 * </p>
 */
public final class DataLine {

    /**
     * Holds the values for the data line in construction.
     */
    private final String[] values;

    /**
     * Next appending index used by {@link #append append} methods.
     */
    private int nextIndex = 0;

    private final TableColumnCollection columns;

    private final Function<String, RuntimeException> formatErrorFactory;

    /**
     * Creates a new data-line instance.
     * <p>
     * The value array passed is not copied and will be used directly to store the data-line values.
     * </p>
     *
     * @param values             the value array.
     * @param columns            the columns of the table that will enclose this data-line instance.
     * @param formatErrorFactory to be used when a requested column does not exist.
     * @throws IllegalArgumentException if any argument is {@code null} or the value count does not match the column count.
     */
    DataLine(final String[] values, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new empty data-line instance.
     *
     * @param columns            the columns of the table that will enclose this data-line instance.
     * @param formatErrorFactory to be used when a requested column does not exist.
     */
    public DataLine(final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    /**
     * Returns a reference to the data-line values after making sure that they are all defined.
     *
     * @return never {@code null} and with no {@code null} elements.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    /**
     * Returns the string value in a column by its name.
     *
     * @throws IllegalStateException if that column value is undefined ({@code null}).
     */
    public String get(final String columnName) {
        final int index = columnIndex(columnName);
        if (values[index] == null) {
            throw new IllegalStateException(String.format("the value for column '%s' is undefined", columnName));
        }
        return values[index];
    }

    /**
     * Returns the string value in a column by its name. If there is no such column, returns the default value.
     *
     * @return {@code null} iff {@code defaultValue == null} and there is no column named {@code columnName}.
     */
    public String get(final String columnName, final String defaultValue) {
        final int index = columns.indexOf(columnName);
        return index < 0 ? defaultValue : values[index];
    }

    private int columnIndex(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw formatErrorFactory.apply("there is no such a column: " + columnName);
        }
        return index;
    }

    /**
     * Sets the next string value in the data-line and advances to the following column.
     *
     * @throws IllegalStateException if the next column to set is beyond the last column.
     */
    public DataLine append(final String value) {
        if (nextIndex == values.length) {
            throw new IllegalStateException("gone beyond of the end of the data-line");
        }
        values[nextIndex++] = value;
        return this;
    }

    public DataLine append(final int value) {
        return append(Integer.toString(value));
    }

    public DataLine append(final long value) {
        return append(Long.toString(value));
    }

    public DataLine append(final String... values) {
        for (final String v : Utils.nonNull(values, "the values cannot be null")) {
            append(v);
        }
        return this;
    }
}
