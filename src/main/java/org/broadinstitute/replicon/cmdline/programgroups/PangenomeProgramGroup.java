package org.broadinstitute.replicon.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that annotate pangenome gene clusters.
 */
public final class PangenomeProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() { return "Pangenome"; }

    @Override
    public String getDescription() { return "Tools that annotate pangenome gene clusters with replicon evidence"; }
}
