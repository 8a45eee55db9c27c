package org.janelia.epochreg.stage;

import java.util.function.Supplier;

/**
 * Stages of the registration pipeline in execution order,
 * with a convenience {@link #toStep()} builder.
 *
 * @author Eric Trautman
 */
public enum PipelineStage {

    SETUP(1, SetupStep::new),
    BUILD_REFERENCE(2, BuildReferenceStep::new),
    NATIVE_COMBINE(3, NativeCombineStep::new),
    REGISTER(4, RegisterStep::new),
    REGISTERED_COMBINE(5, RegisteredCombineStep::new),
    DIFFERENCE(6, DifferenceStep::new),
    STACK(7, StackStep::new);

    private final int number;
    private final Supplier<PipelineStep> stepSupplier;

    PipelineStage(final int number,
                  final Supplier<PipelineStep> stepSupplier) {
        this.number = number;
        this.stepSupplier = stepSupplier;
    }

    public int getNumber() {
        return number;
    }

    public PipelineStep toStep() {
        return stepSupplier.get();
    }

    @Override
    public String toString() {
        return "(" + number + ") " + name();
    }
}
