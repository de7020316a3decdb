package org.broadinstitute.replicon;

import com.google.common.collect.ImmutableSet;
import org.broadinstitute.replicon.exceptions.UserException;
import org.broadinstitute.replicon.testutils.BaseTest;
import org.broadinstitute.replicon.tools.replicon.AnnotateGeneClusterReplicons;
import org.broadinstitute.replicon.tools.replicon.CompareRepliconCalls;
import org.broadinstitute.replicon.tools.replicon.GenerateChromosomeLists;
import org.broadinstitute.replicon.tools.replicon.JoinCallsWithAlignmentStats;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Set;

public final class MainUnitTest extends BaseTest {

    private static final Set<Class<?>> TOOLS = ImmutableSet.of(CompareRepliconCalls.class, GenerateChromosomeLists.class,
            AnnotateGeneClusterReplicons.class, JoinCallsWithAlignmentStats.class);

    @Test
    public void testSuggestionForMisspelledTool() {
        final String message = new Main().getSuggestedAlternateCommand(TOOLS, "CompareRepliconCall");
        Assert.assertTrue(message.startsWith("'CompareRepliconCall' is not a valid command."), message);
        Assert.assertTrue(message.contains("Did you mean this?"), message);
        Assert.assertTrue(message.contains("CompareRepliconCalls"), message);
        Assert.assertFalse(message.contains("GenerateChromosomeLists"), message);
    }

    @Test
    public void testNoSuggestionForUnrelatedCommand() {
        final String message = new Main().getSuggestedAlternateCommand(TOOLS, "Xyzzy");
        Assert.assertFalse(message.contains("Did you mean"), message);
    }

    @Test
    public void testUnknownToolIsAUserError() {
        final UserException ex = Assert.expectThrows(UserException.class,
                () -> new Main().instanceMain(new String[]{"GenerateChromosomeList"}));
        Assert.assertTrue(ex.getMessage().contains("GenerateChromosomeLists"), ex.getMessage());
    }

    @Test
    public void testNoArgumentsPrintsUsage() {
        Assert.assertNull(new Main().instanceMain(new String[0]));
    }

    @Test
    public void testProgramPropertiesPresent() {
        for (final Class<?> tool : TOOLS) {
            Assert.assertNotNull(Main.getProgramProperty(tool), tool.getSimpleName());
        }
    }
}
