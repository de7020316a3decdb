package org.broadinstitute.replicon.tools.replicon.formats;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.utils.Utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * All-hits tables of a classifier run, one directory per reference database:
 * {@code <all-hits-dir>/<database>/tables/<assembly>_all.tsv}.
 * <p>
 * The table of an assembly is {@code <assembly>_all.tsv}, or else the first (by name) file
 * {@code <assembly>*_all.tsv}. Tables are loaded once per database and assembly. A hit for a contig is a line
 * containing the contig id whose fourth tab separated field is not blank; lines with a blank fourth field are
 * placeholders for contigs without hits.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 */
public final class ClassifierHitsIndex {

    public static final String TABLES_DIRECTORY = "tables";
    public static final String ALL_HITS_SUFFIX = "_all.tsv";
    public static final String HEADER_PREFIX = "assembly_id";

    private static final int HIT_FIELD_INDEX = 3;

    private final SortedMap<String, Path> tablesByDatabase;

    private final Map<String, List<String>> linesCache = new HashMap<>();

    public ClassifierHitsIndex(final SortedMap<String, Path> tablesByDatabase) {
        this.tablesByDatabase = ImmutableSortedMap.copyOfSorted(Utils.nonNull(tablesByDatabase));
    }

    /**
     * Finds the database directories under {@code allHitsDir} that hold at least one all-hits table.
     */
    public static ClassifierHitsIndex discover(final Path allHitsDir) {
        Utils.nonNull(allHitsDir, "the all-hits directory cannot be null");
        if (!Files.isDirectory(allHitsDir)) {
            throw new UserException.CouldNotReadInputFile(allHitsDir, "It is not a directory");
        }
        final SortedMap<String, Path> tables = new TreeMap<>();
        try (final Stream<Path> children = Files.list(allHitsDir)) {
            for (final Path child : children.sorted().collect(Collectors.toList())) {
                final Path tablesDir = child.resolve(TABLES_DIRECTORY);
                if (Files.isDirectory(child) && Files.isDirectory(tablesDir) && !allHitsTables(tablesDir, "").isEmpty()) {
                    tables.put(child.getFileName().toString(), tablesDir);
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(allHitsDir, e);
        }
        return new ClassifierHitsIndex(tables);
    }

    public Set<String> getDatabases() {
        return tablesByDatabase.keySet();
    }

    public boolean isEmpty() {
        return tablesByDatabase.isEmpty();
    }

    /**
     * @return the table lines of an assembly in a database; empty if there is no table.
     */
    public List<String> tableLines(final String database, final String assemblyId) {
        final Path tablesDir = tablesByDatabase.get(database);
        Utils.validateArg(tablesDir != null, () -> "unknown database " + database);
        return linesCache.computeIfAbsent(database + "\u0000" + assemblyId, k -> loadLines(tablesDir, assemblyId));
    }

    /**
     * @return the table header line, if the assembly table has one.
     */
    public Optional<String> header(final String database, final String assemblyId) {
        final List<String> lines = tableLines(database, assemblyId);
        return !lines.isEmpty() && lines.get(0).startsWith(HEADER_PREFIX) ? Optional.of(lines.get(0)) : Optional.empty();
    }

    public List<String> hits(final String database, final String assemblyId, final String contigId) {
        Utils.nonNull(contigId, "the contig id cannot be null");
        return tableLines(database, assemblyId).stream()
                .filter(line -> line.contains(contigId) && isHit(line))
                .collect(Collectors.toList());
    }

    private static boolean isHit(final String line) {
        final String[] fields = line.split("\t");
        return fields.length > HIT_FIELD_INDEX && !fields[HIT_FIELD_INDEX].trim().isEmpty();
    }

    private static List<String> loadLines(final Path tablesDir, final String assemblyId) {
        Path table = tablesDir.resolve(assemblyId + ALL_HITS_SUFFIX);
        if (!Files.isRegularFile(table)) {
            final List<Path> candidates = allHitsTables(tablesDir, assemblyId);
            if (candidates.isEmpty()) {
                return ImmutableList.of();
            }
            table = candidates.get(0);
        }
        try {
            return ImmutableList.copyOf(Files.readAllLines(table, StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(table, e);
        }
    }

    private static List<Path> allHitsTables(final Path tablesDir, final String prefix) {
        final List<Path> result = new ArrayList<>();
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(tablesDir, p -> {
            final String name = p.getFileName().toString();
            return name.startsWith(prefix) && name.endsWith(ALL_HITS_SUFFIX);
        })) {
            stream.forEach(result::add);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(tablesDir, e);
        }
        Collections.sort(result);
        return result;
    }
}
