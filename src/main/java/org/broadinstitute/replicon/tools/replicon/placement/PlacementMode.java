package org.broadinstitute.replicon.tools.replicon.placement;

import org.broadinstitute.barclay.argparser.CommandLineParser;

/**
 * How fragments are placed on replicons.
 */
public enum PlacementMode implements CommandLineParser.ClpEnum {
    CLASSIFIED("Every classified fragment is placed; the longest per replicon goes to the chromosome list, the others to the unlocalised list."),
    COMPLETE("Only fragments passing the reference coverage, query coverage and identity thresholds are placed.");

    private final String description;

    PlacementMode(final String description) {
        this.description = description;
    }

    @Override
    public String getHelpDoc() {
        return description;
    }
}
