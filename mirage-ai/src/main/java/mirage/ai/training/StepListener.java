package mirage.ai.training;

import mirage.ai.env.StepResult;

/** Observer of every environment step a collector drives. */
@FunctionalInterface
public interface StepListener {
    StepListener NONE = result -> { };

    void onStep(StepResult result);
}
