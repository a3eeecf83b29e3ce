package mirage.ai.env;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Shared state machine for the environment variants. Participants take turns
 * in index order; each step resolves the active participant's action, applies
 * the actor's own consequences, lets the variant couple the outcome into the
 * partner's state, then drifts the actor's pressures.
 *
 * <p>Random draws per step are fixed (one outcome draw, three pressure draws),
 * so a seeded environment replays identically for the same action sequence.
 */
public abstract class AbstractEnvironment implements Environment {
    /** Health at or below this counts as zero. */
    static final double DEPLETED_HEALTH = 1e-9;

    private final List<CharacterProfile> profiles;
    private final StateEncoder encoder;
    private final ActionCatalog catalog;
    private final int maxSteps;
    private final Random rng;
    private final Set<Scenario> scenarios = EnumSet.noneOf(Scenario.class);

    private final EpisodicState[] states;
    private Phase phase = Phase.FRESH;
    private int stepCount;
    private int activeIndex;

    protected AbstractEnvironment(List<CharacterProfile> profiles, StateEncoder encoder,
                                  ActionCatalog catalog, int maxSteps, Random rng) {
        Preconditions.checkArgument(!profiles.isEmpty() && profiles.size() <= 2,
                "1 or 2 participants supported, got %s", profiles.size());
        Preconditions.checkArgument(maxSteps >= 1, "maxSteps must be >= 1: %s", maxSteps);
        this.profiles = ImmutableList.copyOf(profiles);
        this.encoder = Preconditions.checkNotNull(encoder, "encoder");
        this.catalog = Preconditions.checkNotNull(catalog, "catalog");
        this.maxSteps = maxSteps;
        this.rng = Preconditions.checkNotNull(rng, "rng");
        this.states = new EpisodicState[profiles.size()];
    }

    /**
     * Partner coupling for two-party variants; null means none.
     */
    protected Coupling coupling() {
        return null;
    }

    /**
     * Variant hook to rescale the reward once the outcome is known.
     */
    protected Outcome adjustOutcome(int actor, Outcome outcome) {
        return outcome;
    }

    /** Presets applied on every subsequent reset. */
    public void setScenarios(Set<Scenario> presets) {
        scenarios.clear();
        scenarios.addAll(presets);
    }

    public Set<Scenario> getScenarios() {
        return Collections.unmodifiableSet(scenarios);
    }

    @Override
    public int getStateDim() {
        return encoder.dimension();
    }

    @Override
    public int getActionDim() {
        return catalog.size();
    }

    @Override
    public ActionCatalog getCatalog() {
        return catalog;
    }

    @Override
    public Phase getPhase() {
        return phase;
    }

    @Override
    public int getParticipantCount() {
        return profiles.size();
    }

    @Override
    public int getActiveIndex() {
        return activeIndex;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public int getStepCount() {
        return stepCount;
    }

    public CharacterProfile getProfile(int participant) {
        return profiles.get(participant);
    }

    @Override
    public double[] reset() {
        for (int i = 0; i < states.length; i++) {
            EpisodicState s = EpisodicState.initial(profiles.get(i));
            for (Scenario sc : scenarios) {
                sc.apply(s);
            }
            states[i] = s;
        }
        stepCount = 0;
        activeIndex = 0;
        phase = Phase.ACTIVE;
        return observe(activeIndex);
    }

    @Override
    public StepResult step(int action) {
        if (phase != Phase.ACTIVE) {
            throw new InvalidStateException(phase);
        }
        if (action < 0 || action >= catalog.size()) {
            throw new OutOfRangeActionException(action, catalog.size());
        }

        int actor = activeIndex;
        ActionSpec spec = catalog.get(action);
        EpisodicState actorState = states[actor];

        Outcome outcome = adjustOutcome(actor, OutcomeModel.resolve(spec, profiles.get(actor), actorState, rng));
        OutcomeModel.applyToActor(outcome, actorState);

        Coupling coupling = coupling();
        if (coupling != null && states.length == 2) {
            int partner = 1 - actor;
            Pair<EpisodicState, EpisodicState> coupled = coupling.apply(outcome, actorState, states[partner]);
            states[actor] = coupled.getLeft();
            states[partner] = coupled.getRight();
            actorState = states[actor];
        }

        OutcomeModel.driftPressures(actorState, rng);

        stepCount++;
        for (EpisodicState s : states) {
            s.setStep(stepCount);
        }
        actorState.append(new EpisodicState.HistoryEntry(stepCount, spec.getLabel(), outcome.getLabel(),
                outcome.isSuccess(), outcome.getReward()));

        boolean done = stepCount >= maxSteps;
        for (EpisodicState s : states) {
            if (s.getHealth() <= DEPLETED_HEALTH) {
                done = true;
            }
        }
        if (done) {
            phase = Phase.TERMINATED;
        }
        activeIndex = (actor + 1) % states.length;
        return new StepResult(observe(activeIndex), outcome.getReward(), done, actor, action, outcome);
    }

    @Override
    public EpisodicState snapshot(int participant) {
        Preconditions.checkState(phase != Phase.FRESH, "environment has not been reset");
        return states[participant].copy();
    }

    /** Encoded observation for one participant. */
    public double[] observe(int participant) {
        Preconditions.checkState(phase != Phase.FRESH, "environment has not been reset");
        return encoder.encode(profiles.get(participant), states[participant]);
    }
}
