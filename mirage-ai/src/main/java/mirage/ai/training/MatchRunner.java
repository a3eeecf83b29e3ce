package mirage.ai.training;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import mirage.ai.env.AbstractEnvironment;
import mirage.ai.env.StepResult;
import mirage.ai.nn.ActionChoice;
import mirage.ai.registry.Agent;

/**
 * Runs two agents alternately against one two-participant environment.
 * Agent {@code i} always acts for participant {@code i}; each gets its own
 * trajectory whose steps are its own turns.
 */
public class MatchRunner {
    private static final Logger log = LoggerFactory.getLogger(MatchRunner.class);

    /**
     * @param rounds maximum number of rounds; a round is one turn per participant
     */
    public Match run(Agent first, Agent second, AbstractEnvironment env, int rounds,
                     boolean deterministic, Random rng) {
        Preconditions.checkArgument(env.getParticipantCount() == 2, "matches need two participants");
        Preconditions.checkArgument(rounds >= 1, "rounds must be >= 1: %s", rounds);
        Agent[] agents = {first, second};
        for (Agent a : agents) {
            RolloutCollector.checkDimensions(a, env);
        }

        List<List<StepResult>> logs = List.of(new ArrayList<>(), new ArrayList<>());
        Trajectory[] trajectories = {new Trajectory(), new Trajectory()};
        PendingStep[] pending = new PendingStep[2];

        double[] state = env.reset();
        boolean done = false;
        int turns = 0;
        while (!done && turns < rounds * 2) {
            int actor = env.getActiveIndex();
            if (pending[actor] != null) {
                trajectories[actor].add(pending[actor].toStep(false));
            }
            ActionChoice choice = agents[actor].selectAction(state, deterministic, rng);
            StepResult result = env.step(choice.getAction());
            logs.get(actor).add(result);
            pending[actor] = new PendingStep(state, choice, result.getReward());
            done = result.isDone();
            state = result.getState();
            turns++;
        }

        for (int p = 0; p < 2; p++) {
            if (pending[p] != null) {
                trajectories[p].add(pending[p].toStep(done));
            }
            trajectories[p].setBootstrapValue(done ? 0.0 : agents[p].evaluate(env.observe(p)).getValue());
        }
        log.debug("Match {} vs {} ended after {} turns (done={})", first.getKey(), second.getKey(), turns, done);
        return new Match(logs, trajectories, env.snapshot(0).getStep(), done);
    }

    private static final class PendingStep {
        private final double[] state;
        private final ActionChoice choice;
        private final double reward;

        PendingStep(double[] state, ActionChoice choice, double reward) {
            this.state = state;
            this.choice = choice;
            this.reward = reward;
        }

        Trajectory.Step toStep(boolean done) {
            return new Trajectory.Step(state, choice.getAction(), choice.getLogProb(), choice.getValue(), reward, done);
        }
    }

    /**
     * Per-participant step logs and trajectories of one match.
     */
    public static final class Match {
        private final List<List<StepResult>> logs;
        private final Trajectory[] trajectories;
        private final int turns;
        private final boolean terminated;

        Match(List<List<StepResult>> logs, Trajectory[] trajectories, int turns, boolean terminated) {
            this.logs = logs;
            this.trajectories = trajectories;
            this.turns = turns;
            this.terminated = terminated;
        }

        public List<StepResult> getLog(int participant) {
            return Collections.unmodifiableList(logs.get(participant));
        }

        public Trajectory getTrajectory(int participant) {
            return trajectories[participant];
        }

        public double getTotal(int participant) {
            return trajectories[participant].totalReward();
        }

        public int getTurns() {
            return turns;
        }

        /** True when the environment reported done (step horizon or a participant at zero health). */
        public boolean isTerminated() {
            return terminated;
        }

        public Verdict getVerdict() {
            return Verdict.of(getTotal(0), getTotal(1));
        }

        public RelationshipChange getRelationshipChange() {
            return RelationshipChange.of(getTotal(0), getTotal(1));
        }

        /** Index of the participant with the higher total, or -1 on a tie. */
        public int getWinner() {
            int cmp = Double.compare(getTotal(0), getTotal(1));
            return cmp == 0 ? -1 : (cmp > 0 ? 0 : 1);
        }
    }
}
