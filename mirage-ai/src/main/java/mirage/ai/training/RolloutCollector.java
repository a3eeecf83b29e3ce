package mirage.ai.training;

import java.util.Random;

import com.google.common.base.Preconditions;

import mirage.ai.config.ConfigurationException;
import mirage.ai.env.Environment;
import mirage.ai.env.StepResult;
import mirage.ai.nn.ActionChoice;
import mirage.ai.registry.Agent;

/**
 * Drives one agent through one episode of a single-participant environment,
 * starting from {@link Environment#reset()} and stopping at {@code done} or
 * {@code horizon}, whichever comes first. Only reads the agent.
 */
public class RolloutCollector {

    public Trajectory collect(Agent agent, Environment env, int horizon, boolean deterministic, Random rng) {
        return collect(agent, env, horizon, deterministic, rng, StepListener.NONE);
    }

    public Trajectory collect(Agent agent, Environment env, int horizon, boolean deterministic,
                              Random rng, StepListener listener) {
        Preconditions.checkArgument(horizon >= 1, "horizon must be >= 1: %s", horizon);
        Preconditions.checkArgument(env.getParticipantCount() == 1,
                "rollouts need a single-participant environment, use MatchRunner for two");
        checkDimensions(agent, env);

        Trajectory trajectory = new Trajectory();
        double[] state = env.reset();
        boolean done = false;
        for (int t = 0; t < horizon && !done; t++) {
            ActionChoice choice = agent.selectAction(state, deterministic, rng);
            StepResult result = env.step(choice.getAction());
            done = result.isDone();
            trajectory.add(new Trajectory.Step(state, choice.getAction(), choice.getLogProb(),
                    choice.getValue(), result.getReward(), done));
            listener.onStep(result);
            state = result.getState();
        }
        trajectory.setBootstrapValue(done ? 0.0 : agent.evaluate(state).getValue());
        return trajectory;
    }

    static void checkDimensions(Agent agent, Environment env) {
        if (agent.getStateDim() != env.getStateDim() || agent.getActionDim() != env.getActionDim()) {
            throw new ConfigurationException("agent " + agent.getKey() + " is " + agent.getStateDim() + "x"
                    + agent.getActionDim() + ", environment is " + env.getStateDim() + "x" + env.getActionDim());
        }
    }
}
