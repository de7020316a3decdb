package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.tools.replicon.placement.AssemblyPlacement;
import org.broadinstitute.replicon.tools.replicon.placement.ChromosomeListEntry;
import org.broadinstitute.replicon.tools.replicon.placement.UnlocalisedListEntry;
import org.broadinstitute.replicon.utils.Utils;
import org.broadinstitute.replicon.utils.tsv.TableColumnCollection;
import org.broadinstitute.replicon.utils.tsv.TableUtils;
import org.broadinstitute.replicon.utils.tsv.TableWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the submission lists of an assembly as headerless tab separated files:
 * <ul>
 *     <li>{@code <assembly>.chromosome_list.tsv}: {@code OBJECT_NAME CHROMOSOME_NAME CHROMOSOME_TYPE};</li>
 *     <li>{@code <assembly>.unlocalised_list.tsv}: {@code OBJECT_NAME CHROMOSOME_NAME}, only when the assembly has
 *     unlocalised fragments.</li>
 * </ul>
 */
public final class PlacementListWriter {

    public static final String CHROMOSOME_LIST_SUFFIX = ".chromosome_list.tsv";
    public static final String UNLOCALISED_LIST_SUFFIX = ".unlocalised_list.tsv";

    static final TableColumnCollection CHROMOSOME_LIST_COLUMNS =
            new TableColumnCollection("OBJECT_NAME", "CHROMOSOME_NAME", "CHROMOSOME_TYPE");
    static final TableColumnCollection UNLOCALISED_LIST_COLUMNS =
            new TableColumnCollection("OBJECT_NAME", "CHROMOSOME_NAME");

    private PlacementListWriter() {}

    public static Path chromosomeListPath(final Path outputDir, final String assemblyId) {
        return outputDir.resolve(assemblyId + CHROMOSOME_LIST_SUFFIX);
    }

    public static Path unlocalisedListPath(final Path outputDir, final String assemblyId) {
        return outputDir.resolve(assemblyId + UNLOCALISED_LIST_SUFFIX);
    }

    /**
     * Writes the list files of an assembly with at least one placement.
     *
     * @return the files written.
     */
    public static List<Path> write(final Path outputDir, final AssemblyPlacement placement) {
        Utils.nonNull(outputDir, "the output directory cannot be null");
        Utils.nonNull(placement, "the placement cannot be null");
        Utils.validateArg(placement.hasPlacements(), () -> "no placement to write for " + placement.getAssemblyId());

        final List<Path> written = new ArrayList<>(2);
        final Path chromosomeList = chromosomeListPath(outputDir, placement.getAssemblyId());
        try (final TableWriter<ChromosomeListEntry> writer = TableUtils.writer(newWriter(chromosomeList),
                CHROMOSOME_LIST_COLUMNS, TableUtils.COLUMN_SEPARATOR, false,
                (entry, dataLine) -> dataLine.append(entry.getObjectName(), entry.getChromosomeName(), entry.getChromosomeType()))) {
            writer.writeAllRecords(placement.getChromosomeEntries());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(chromosomeList.toFile(), e);
        }
        written.add(chromosomeList);

        if (!placement.getUnlocalisedEntries().isEmpty()) {
            final Path unlocalisedList = unlocalisedListPath(outputDir, placement.getAssemblyId());
            try (final TableWriter<UnlocalisedListEntry> writer = TableUtils.writer(newWriter(unlocalisedList),
                    UNLOCALISED_LIST_COLUMNS, TableUtils.COLUMN_SEPARATOR, false,
                    (entry, dataLine) -> dataLine.append(entry.getObjectName(), entry.getChromosomeName()))) {
                writer.writeAllRecords(placement.getUnlocalisedEntries());
            } catch (final IOException e) {
                throw new UserException.CouldNotCreateOutputFile(unlocalisedList.toFile(), e);
            }
            written.add(unlocalisedList);
        }
        return written;
    }

    private static Writer newWriter(final Path path) throws IOException {
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }
}
