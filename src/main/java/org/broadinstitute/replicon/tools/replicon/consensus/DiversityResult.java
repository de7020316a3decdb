package org.broadinstitute.replicon.tools.replicon.consensus;

import org.broadinstitute.replicon.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spread of a gene cluster's calls over replicon families.
 * <p>
 * The cross-family score is the Shannon entropy of the family distribution normalized by its maximum, so it is
 * 0 when all calls share one family and 1 when they are evenly spread.
 * </p>
 */
public final class DiversityResult {

    private final Map<String, Integer> familyCounts;
    private final String topFamily;
    private final double familyConsensusFraction;
    private final double crossFamilyScore;

    public DiversityResult(final Map<String, Integer> familyCounts, final String topFamily,
                           final double familyConsensusFraction, final double crossFamilyScore) {
        this.familyCounts = Collections.unmodifiableMap(new LinkedHashMap<>(Utils.nonNull(familyCounts)));
        this.topFamily = Utils.nonNull(topFamily);
        Utils.validateArg(crossFamilyScore >= 0 && crossFamilyScore <= 1, "the cross-family score must be in [0, 1]");
        this.familyConsensusFraction = familyConsensusFraction;
        this.crossFamilyScore = crossFamilyScore;
    }

    /**
     * Result with no family at all, labelled with the given top family.
     */
    public static DiversityResult none(final String topFamily) {
        return new DiversityResult(Collections.emptyMap(), topFamily, 0.0, 0.0);
    }

    public Map<String, Integer> getFamilyCounts() {
        return familyCounts;
    }

    public int getNumberOfFamilies() {
        return familyCounts.size();
    }

    public String getTopFamily() {
        return topFamily;
    }

    public double getFamilyConsensusFraction() {
        return familyConsensusFraction;
    }

    public boolean isSingleFamily() {
        return familyCounts.size() <= 1;
    }

    public double getCrossFamilyScore() {
        return crossFamilyScore;
    }

    public String getDetail() {
        return CountFormatting.detail(familyCounts);
    }

    @Override
    public String toString() {
        return String.format("%s (families=%d, frac=%s, score=%s)", topFamily, getNumberOfFamilies(),
                familyConsensusFraction, crossFamilyScore);
    }
}
