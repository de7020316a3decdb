package org.broadinstitute.replicon.tools.replicon.formats;

import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.tools.replicon.comparison.ManualOverrides;
import org.broadinstitute.replicon.utils.io.IOUtils;
import org.broadinstitute.replicon.utils.tsv.TableReader;
import org.broadinstitute.replicon.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a manual override table with columns {@code assembly_id}, {@code contig_id} and {@code resolved_call}.
 * Rows with an empty assembly or contig id are ignored; a repeated fragment keeps its last override.
 */
public final class OverrideTableReader {

    public static final String RESOLVED_CALL = "resolved_call";

    private OverrideTableReader() {}

    public static ManualOverrides read(final Path path) {
        IOUtils.assertFileIsReadable(path);
        final Map<FragmentKey, String> overrides = new LinkedHashMap<>();
        try (final TableReader<Map.Entry<FragmentKey, String>> reader = TableUtils.reader(path,
                (columns, formatExceptionFactory) -> {
                    columns.requireAll(path.getFileName().toString(),
                            FragmentColumns.ASSEMBLY_ID, FragmentColumns.CONTIG_ID, RESOLVED_CALL);
                    return dataLine -> {
                        final String assemblyId = dataLine.get(FragmentColumns.ASSEMBLY_ID).trim();
                        final String contigId = dataLine.get(FragmentColumns.CONTIG_ID).trim();
                        if (assemblyId.isEmpty() || contigId.isEmpty()) {
                            return null;
                        }
                        return new AbstractMap.SimpleImmutableEntry<>(new FragmentKey(assemblyId, contigId),
                                dataLine.get(RESOLVED_CALL).trim());
                    };
                })) {
            reader.stream().forEach(e -> overrides.put(e.getKey(), e.getValue()));
        } catch (final IOException | UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
        return new ManualOverrides(overrides);
    }
}
