package org.broadinstitute.replicon.tools.replicon.comparison;

import org.broadinstitute.replicon.utils.Utils;

/**
 * Parameters of a comparison run.
 */
public final class ComparisonSettings {

    public static final ComparisonSettings DEFAULT = new ComparisonSettings(0);

    private final long autoChromosomeBp;

    /**
     * @param autoChromosomeBp length threshold of the chromosome heuristics; 0 disables them.
     */
    public ComparisonSettings(final long autoChromosomeBp) {
        Utils.validateArg(autoChromosomeBp >= 0, "the auto-chromosome threshold cannot be negative");
        this.autoChromosomeBp = autoChromosomeBp;
    }

    public long getAutoChromosomeBp() {
        return autoChromosomeBp;
    }

    public boolean isAutoChromosomeEnabled() {
        return autoChromosomeBp > 0;
    }

    @Override
    public String toString() {
        return "ComparisonSettings{autoChromosomeBp=" + autoChromosomeBp + "}";
    }
}
