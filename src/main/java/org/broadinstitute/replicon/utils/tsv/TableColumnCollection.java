package org.broadinstitute.replicon.utils.tsv;

import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.Utils;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Represents a list of table columns.
 * <p>
 * Column names are unique, cannot be {@code null} and the first one cannot start with the
 * {@link TableUtils#COMMENT_PREFIX comment prefix}. Instances are immutable.
 * </p>
 */
public final class TableColumnCollection {

    private final List<String> names;

    private final Map<String, Integer> indexByName;

    /**
     * Creates a new table-column collection from a sequence of column names.
     *
     * @throws IllegalArgumentException if {@code names} is {@code null}, contains a {@code null},
     *                                  a repeated name or is empty.
     */
    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(names.clone(), IllegalArgumentException::new)));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Creates a new table-column collection from the constants of an enum, in declaration order.
     * The column name is each constant's {@link Object#toString}.
     */
    public TableColumnCollection(final Class<? extends Enum<?>> enumClass) {
        this(Stream.of(Utils.nonNull(enumClass, "the enum class cannot be null").getEnumConstants())
                .map(Object::toString)
                .toArray(String[]::new));
    }

    public List<String> names() {
        return names;
    }

    public String nameAt(final int index) {
        Utils.validIndex(index, names.size());
        return names.get(index);
    }

    /**
     * Returns the index of a column by its name, or -1 if there is no such column.
     */
    public int indexOf(final String name) {
        Utils.nonNull(name, "the column name cannot be null");
        return indexByName.getOrDefault(name, -1);
    }

    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "cannot be null"));
    }

    public boolean containsAll(final String... names) {
        return Stream.of(Utils.nonNull(names, "names cannot be null")).allMatch(this::contains);
    }

    /**
     * Fails with a {@link UserException.MissingColumn} naming the first absent column and
     * listing the available ones.
     *
     * @param source a description of the table, typically its path, used in the error message.
     * @param required the column names that must be present.
     */
    public void requireAll(final String source, final String... required) {
        for (final String name : Utils.nonNull(required, "required names cannot be null")) {
            if (!contains(name)) {
                throw new UserException.MissingColumn(source, name, names);
            }
        }
    }

    public int columnCount() {
        return names.size();
    }

    /**
     * Checks the validity of a list of column names.
     * <p>
     * The exception factory is used to produce the error when the names are empty, repeated or
     * the first one looks like a comment.
     * </p>
     *
     * @return the same array.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");

        if (columnNames.length == 0) {
            throw Utils.nonNull(exceptionFactory.apply("there must be at least one column"));
        }
        final Set<String> columnNameSet = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String columnName = Utils.nonNull(columnNames[i], "no column name can be null: e.g. " + i + " element");
            if (!columnNameSet.add(columnName)) {
                throw Utils.nonNull(exceptionFactory.apply("more than one column have the same name: " + columnNames[i]), "exception factory produces null exceptions");
            }
        }
        if (columnNames[0].startsWith(TableUtils.COMMENT_PREFIX)) {
            throw Utils.nonNull(exceptionFactory.apply("the first column name cannot start with the comment prefix"), "exception factory produces null exceptions");
        }
        return columnNames;
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
