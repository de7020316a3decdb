package org.broadinstitute.replicon.tools.replicon.formats;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import org.broadinstitute.replicon.utils.Utils;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Replicon of every (isolate index, scaffold index) pair of a pangenome.
 * <p>
 * Scaffold names read {@code ISOLATE_REPLICON_contig_N}; the replicon is everything between the isolate and the
 * first {@code contig} part, lower-cased. A replicon that looks like a sequence accession (e.g.
 * {@code cp019844.1}) is translated through the accession lookup when it is known there.
 * </p>
 */
public final class ScaffoldRepliconLookup {

    public static final String UNKNOWN_REPLICON = "unknown";

    static final Pattern ACCESSION_LIKE = Pattern.compile("^[a-z]{2}\\d{6}\\.\\d+$");

    private static final String CONTIG_PART = "contig";

    private final Table<String, String, String> replicons;

    public ScaffoldRepliconLookup(final Table<String, String, String> replicons) {
        this.replicons = ImmutableTable.copyOf(Utils.nonNull(replicons, "the replicon table cannot be null"));
    }

    /**
     * @param isolateIndex  the isolate part of a gene id.
     * @param scaffoldIndex the scaffold part of a gene id.
     */
    public Optional<String> lookup(final String isolateIndex, final String scaffoldIndex) {
        return Optional.ofNullable(replicons.get(isolateIndex, scaffoldIndex));
    }

    public int size() {
        return replicons.size();
    }

    /**
     * @return the distinct replicons, sorted.
     */
    public SortedSet<String> uniqueReplicons() {
        return new TreeSet<>(replicons.values());
    }

    public static String parseRepliconFromScaffold(final String scaffoldName) {
        return parseRepliconFromScaffold(scaffoldName, ImmutableMap.of());
    }

    /**
     * @param accessionLookup lower-case accession to replicon name.
     * @return {@value #UNKNOWN_REPLICON} if the name has no replicon part.
     */
    public static String parseRepliconFromScaffold(final String scaffoldName, final Map<String, String> accessionLookup) {
        Utils.nonNull(scaffoldName, "the scaffold name cannot be null");
        Utils.nonNull(accessionLookup, "the accession lookup cannot be null");
        final String replicon = repliconPart(scaffoldName);
        if (replicon == null) {
            return UNKNOWN_REPLICON;
        }
        if (ACCESSION_LIKE.matcher(replicon).matches() && accessionLookup.containsKey(replicon)) {
            return accessionLookup.get(replicon);
        }
        return replicon;
    }

    /**
     * @return whether the replicon part of the scaffold name looks like an accession.
     */
    static boolean hasAccessionReplicon(final String scaffoldName) {
        final String replicon = repliconPart(scaffoldName);
        return replicon != null && ACCESSION_LIKE.matcher(replicon).matches();
    }

    private static String repliconPart(final String scaffoldName) {
        final String[] parts = scaffoldName.split("_", -1);
        int contigIndex = -1;
        for (int i = 0; i < parts.length; i++) {
            if (CONTIG_PART.equalsIgnoreCase(parts[i])) {
                contigIndex = i;
                break;
            }
        }
        if (contigIndex >= 0) {
            return contigIndex > 1 ? String.join("_", Arrays.asList(parts).subList(1, contigIndex)).toLowerCase(Locale.ROOT) : null;
        }
        return parts.length > 1 ? String.join("_", Arrays.asList(parts).subList(1, parts.length)).toLowerCase(Locale.ROOT) : null;
    }
}
