package org.broadinstitute.replicon.tools.replicon.comparison;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.broadinstitute.replicon.exceptions.ResolverException;
import org.broadinstitute.replicon.tools.replicon.calls.CallNormalizer;
import org.broadinstitute.replicon.utils.Utils;

import java.util.List;
import java.util.Objects;

/**
 * Classifies the relationship between the old and the new call of a fragment.
 * <p>
 * Rules are tested in order and the first one whose predicate holds gives the category and the resolved call:
 * </p>
 * <ol>
 *     <li>{@code exact_match}: normalized calls are equal (both empty included);</li>
 *     <li>{@code new_unclassified}: only the new call is empty;</li>
 *     <li>{@code old_unclassified}: only the old call is empty, the new call is kept;</li>
 *     <li>{@code annotation_suffix}: equal once trailing {@code *} markers are removed;</li>
 *     <li>{@code extra_annotation}: the old base tokens are a subset of the new ones;</li>
 *     <li>{@code base_match}: the new base tokens are a subset of the old ones;</li>
 *     <li>{@code partial_overlap}: the base tokens intersect;</li>
 *     <li>{@code same_family_tiebreak}: both calls have the same family;</li>
 *     <li>{@code different}: anything else.</li>
 * </ol>
 * <p>
 * The resolved call is the trimmed old call, with its original case, except for {@code old_unclassified}, which keeps
 * the new call, and for two empty calls, which resolve to the empty call.
 * </p>
 */
public final class CallComparator {

    public static final List<ComparisonRule> DEFAULT_RULES = ImmutableList.of(
            new ComparisonRule(ComparisonCategory.EXACT_MATCH,
                    pair -> pair.getOldNormalized().equals(pair.getNewNormalized()),
                    pair -> pair.isOldEmpty() ? CallNormalizer.EMPTY_CALL : keepOld(pair)),
            new ComparisonRule(ComparisonCategory.NEW_UNCLASSIFIED,
                    pair -> !pair.isOldEmpty() && pair.isNewEmpty(),
                    CallComparator::keepOld),
            new ComparisonRule(ComparisonCategory.OLD_UNCLASSIFIED,
                    pair -> pair.isOldEmpty() && !pair.isNewEmpty(),
                    CallComparator::keepNew),
            new ComparisonRule(ComparisonCategory.ANNOTATION_SUFFIX,
                    pair -> CallNormalizer.stripSuffix(pair.getOldNormalized())
                            .equals(CallNormalizer.stripSuffix(pair.getNewNormalized())),
                    CallComparator::keepOld),
            new ComparisonRule(ComparisonCategory.EXTRA_ANNOTATION,
                    pair -> !pair.getOldTokens().isEmpty() && pair.getNewTokens().containsAll(pair.getOldTokens()),
                    CallComparator::keepOld),
            new ComparisonRule(ComparisonCategory.BASE_MATCH,
                    pair -> !pair.getNewTokens().isEmpty() && pair.getOldTokens().containsAll(pair.getNewTokens()),
                    CallComparator::keepOld),
            new ComparisonRule(ComparisonCategory.PARTIAL_OVERLAP,
                    pair -> !Sets.intersection(pair.getOldTokens(), pair.getNewTokens()).isEmpty(),
                    CallComparator::keepOld),
            new ComparisonRule(ComparisonCategory.SAME_FAMILY_TIEBREAK,
                    CallPair::sameFamily,
                    CallComparator::keepOld),
            new ComparisonRule(ComparisonCategory.DIFFERENT,
                    pair -> true,
                    CallComparator::keepOld));

    private final List<ComparisonRule> rules;

    public CallComparator() {
        this(DEFAULT_RULES);
    }

    public CallComparator(final List<ComparisonRule> rules) {
        Utils.nonNull(rules, "the rules cannot be null");
        Utils.validateArg(!rules.isEmpty(), "there must be at least one rule");
        Utils.containsNoNull(rules, "the rules cannot contain null");
        this.rules = ImmutableList.copyOf(rules);
    }

    public List<ComparisonRule> getRules() {
        return rules;
    }

    /**
     * @param oldCall the raw old call, may be {@code null}.
     * @param newCall the raw new call, may be {@code null}.
     */
    public Categorization categorize(final String oldCall, final String newCall) {
        final CallPair pair = new CallPair(oldCall, newCall);
        for (final ComparisonRule rule : rules) {
            if (rule.matches(pair)) {
                return new Categorization(rule.getCategory(), rule.resolve(pair));
            }
        }
        throw new ResolverException.ShouldNeverReachHereException("no comparison rule matches " + pair);
    }

    private static String keepOld(final CallPair pair) {
        return pair.getOldCall().trim();
    }

    private static String keepNew(final CallPair pair) {
        return pair.getNewCall().trim();
    }

    /**
     * A category and the call picked for the fragment.
     */
    public static final class Categorization {
        private final ComparisonCategory category;
        private final String resolvedCall;

        public Categorization(final ComparisonCategory category, final String resolvedCall) {
            this.category = Utils.nonNull(category);
            this.resolvedCall = Utils.nonNull(resolvedCall);
        }

        public ComparisonCategory getCategory() {
            return category;
        }

        public String getResolvedCall() {
            return resolvedCall;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final Categorization that = (Categorization) o;
            return category == that.category && resolvedCall.equals(that.resolvedCall);
        }

        @Override
        public int hashCode() {
            return Objects.hash(category, resolvedCall);
        }

        @Override
        public String toString() {
            return category + ":" + resolvedCall;
        }
    }
}
