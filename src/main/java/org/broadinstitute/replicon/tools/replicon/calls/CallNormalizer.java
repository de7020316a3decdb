package org.broadinstitute.replicon.tools.replicon.calls;

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical forms of raw replicon calls.
 * <p>
 * A raw call is free text such as {@code "lp28-4"}, {@code "cp32-1+5"}, {@code "lp28-4:::lp17"} or
 * {@code "chromosome"}. The normalized form is trimmed and lower-cased; the values {@code na}, {@code nan},
 * {@code none} and {@code unclassified} (in any case) collapse to the empty call {@link #EMPTY_CALL}.
 * </p>
 * <p>
 * A compound call lists several base calls joined by {@link #COMPOUND_SEPARATOR}. A {@code +} inside a call
 * names a fusion replicon and is not a separator.
 * </p>
 */
public final class CallNormalizer {

    /**
     * The normalized form of every missing or unclassified call.
     */
    public static final String EMPTY_CALL = "";

    public static final String COMPOUND_SEPARATOR = ":::";

    public static final String CHROMOSOME = "chromosome";

    private static final Set<String> EMPTY_SENTINELS = ImmutableSet.of("", "na", "nan", "none", "unclassified");

    private static final Pattern TRAILING_SUFFIX_MARKERS = Pattern.compile("\\*+$");

    private CallNormalizer() {}

    /**
     * @param call the raw call, possibly {@code null}.
     * @return never {@code null}; {@link #EMPTY_CALL} for missing or unclassified calls.
     */
    public static String normalize(final String call) {
        if (call == null) {
            return EMPTY_CALL;
        }
        final String lowerCase = call.trim().toLowerCase(Locale.ROOT);
        return EMPTY_SENTINELS.contains(lowerCase) ? EMPTY_CALL : lowerCase;
    }

    public static boolean isEmpty(final String call) {
        return normalize(call).isEmpty();
    }

    public static boolean isChromosome(final String call) {
        return CHROMOSOME.equals(normalize(call));
    }

    /**
     * Trims the call and removes any trailing {@code *} annotation markers.
     */
    public static String stripSuffix(final String call) {
        if (call == null) {
            return EMPTY_CALL;
        }
        return TRAILING_SUFFIX_MARKERS.matcher(call.trim()).replaceAll("").trim();
    }

    /**
     * Splits the normalized call into its base tokens.
     *
     * @return an unmodifiable set in order of appearance; empty for an empty call.
     */
    public static Set<String> splitCompound(final String call) {
        final String normalized = normalize(call);
        if (normalized.isEmpty()) {
            return Collections.emptySet();
        }
        final Set<String> tokens = new LinkedHashSet<>();
        Arrays.stream(normalized.split(Pattern.quote(COMPOUND_SEPARATOR)))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .forEach(tokens::add);
        return Collections.unmodifiableSet(tokens);
    }

    /**
     * Returns the replicon family of a call, for instance {@code lp28} for {@code lp28-4}.
     *
     * @return {@code null} if the call is empty or unclassified.
     */
    public static String familyOf(final String call) {
        final String normalized = normalize(stripSuffix(call));
        if (normalized.isEmpty()) {
            return null;
        }
        return FamilyRuleTable.DEFAULT.familyOf(normalized);
    }
}
