package org.broadinstitute.replicon.tools.replicon.calls;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.broadinstitute.replicon.utils.Utils;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered list of {@link FamilyRule}s. The first rule that yields a family wins; the last rule always does.
 *
 * <ol>
 *     <li>{@code sentinel}: placeholder labels such as {@code unknown} or {@code multi-replicon} are their own family.</li>
 *     <li>{@code chromosome}: the chromosome is its own family.</li>
 *     <li>{@code fusion}: for a fused call ({@code +}, {@code -cp} or {@code -lp}) the family of the component before
 *     the earliest join.</li>
 *     <li>{@code prefix}: the leading run of letters followed by digits, e.g. {@code lp28} for {@code lp28-4}.</li>
 *     <li>{@code identity}: the call itself.</li>
 * </ol>
 */
public final class FamilyRuleTable {

    public static final String SENTINEL_RULE = "sentinel";
    public static final String CHROMOSOME_RULE = "chromosome";
    public static final String FUSION_RULE = "fusion";
    public static final String PREFIX_RULE = "prefix";
    public static final String IDENTITY_RULE = "identity";

    static final Set<String> SENTINEL_FAMILIES = ImmutableSet.of("unknown", "unmatched", "multi-replicon", "unknownreplicon");

    private static final Pattern FAMILY_PREFIX = Pattern.compile("^([a-z]+\\d+)");

    private static final List<String> FUSION_JOINS = ImmutableList.of("+", "-cp", "-lp");

    public static final FamilyRuleTable DEFAULT = new FamilyRuleTable(ImmutableList.of(
            new FamilyRule(SENTINEL_RULE, call -> SENTINEL_FAMILIES.contains(call) ? Optional.of(call) : Optional.empty()),
            new FamilyRule(CHROMOSOME_RULE, call -> CallNormalizer.CHROMOSOME.equals(call) ? Optional.of(CallNormalizer.CHROMOSOME) : Optional.empty()),
            new FamilyRule(FUSION_RULE, FamilyRuleTable::fusionFamily),
            new FamilyRule(PREFIX_RULE, FamilyRuleTable::leadingPrefix),
            new FamilyRule(IDENTITY_RULE, Optional::of)));

    private final List<FamilyRule> rules;

    public FamilyRuleTable(final List<FamilyRule> rules) {
        Utils.nonNull(rules, "the rules cannot be null");
        Utils.validateArg(!rules.isEmpty(), "there must be at least one rule");
        Utils.containsNoNull(rules, "the rules cannot contain null");
        this.rules = ImmutableList.copyOf(rules);
    }

    public List<FamilyRule> getRules() {
        return rules;
    }

    /**
     * @param normalizedCall a non-empty normalized call, see {@link CallNormalizer#normalize}.
     * @return the family given by the first matching rule.
     * @throws IllegalStateException if no rule applies; never happens with {@link #DEFAULT}.
     */
    public String familyOf(final String normalizedCall) {
        Utils.nonEmpty(normalizedCall, "the call cannot be null or empty");
        for (final FamilyRule rule : rules) {
            final Optional<String> family = rule.apply(normalizedCall);
            if (family.isPresent()) {
                return family.get();
            }
        }
        throw new IllegalStateException("no family rule applies to " + normalizedCall);
    }

    private static Optional<String> fusionFamily(final String call) {
        int earliest = -1;
        for (final String join : FUSION_JOINS) {
            final int position = call.indexOf(join);
            if (position >= 0 && (earliest < 0 || position < earliest)) {
                earliest = position;
            }
        }
        return earliest < 0 ? Optional.empty() : leadingPrefix(call.substring(0, earliest));
    }

    private static Optional<String> leadingPrefix(final String call) {
        final Matcher matcher = FAMILY_PREFIX.matcher(call);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
