package org.broadinstitute.replicon.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that compare, resolve and place replicon identity calls of genome assemblies.
 */
public final class RepliconResolutionProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() { return "Replicon Resolution"; }

    @Override
    public String getDescription() { return "Tools that reconcile replicon calls and prepare chromosome placement lists"; }
}
