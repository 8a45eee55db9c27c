package org.janelia.epochreg.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.stage.PipelineStage;

/**
 * Flags that select which pipeline stages run.
 *
 * @author Eric Trautman
 */
public class StageParameters
        implements Serializable {

    @Parameter(names = "--doSetup", description = "(1) Copy exposures into epoch directories", arity = 0)
    public boolean doSetup = false;

    @Parameter(names = "--doRefIm", description = "(2) Build the WCS reference image", arity = 0)
    public boolean doRefIm = false;

    @Parameter(names = "--doDriz1", description = "(3) Combine each visit in its native orientation", arity = 0)
    public boolean doDriz1 = false;

    @Parameter(names = "--doReg", description = "(4) Register visit combinations to the reference", arity = 0)
    public boolean doReg = false;

    @Parameter(names = "--doDriz2", description = "(5) Combine registered exposures of each epoch", arity = 0)
    public boolean doDriz2 = false;

    @Parameter(names = "--doDiff", description = "(6) Subtract the template epoch", arity = 0)
    public boolean doDiff = false;

    @Parameter(names = "--doStack", description = "(7) Stack epochs (not included in --doAll)", arity = 0)
    public boolean doStack = false;

    @Parameter(names = "--doAll", description = "Run stages 1 through 6", arity = 0)
    public boolean doAll = false;

    /**
     * @return enabled stages in execution order.
     */
    public List<PipelineStage> getEnabledStages() {
        final List<PipelineStage> stages = new ArrayList<>();
        addIfEnabled(stages, PipelineStage.SETUP, doSetup);
        addIfEnabled(stages, PipelineStage.BUILD_REFERENCE, doRefIm);
        addIfEnabled(stages, PipelineStage.NATIVE_COMBINE, doDriz1);
        addIfEnabled(stages, PipelineStage.REGISTER, doReg);
        addIfEnabled(stages, PipelineStage.REGISTERED_COMBINE, doDriz2);
        addIfEnabled(stages, PipelineStage.DIFFERENCE, doDiff);
        if (doStack) {
            stages.add(PipelineStage.STACK);
        }
        return stages;
    }

    public boolean isEnabled(final PipelineStage stage) {
        return getEnabledStages().contains(stage);
    }

    private void addIfEnabled(final List<PipelineStage> stages,
                              final PipelineStage stage,
                              final boolean flag) {
        if (doAll || flag) {
            stages.add(stage);
        }
    }
}
