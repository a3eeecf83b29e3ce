package mirage.ai.env;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;

/**
 * Mutable per-episode state of one participant. Owned by exactly one
 * environment; anything handed out of the environment is a {@link #copy()}.
 * All scalars live in [0, 1].
 */
public final class EpisodicState {

    /** One appended record per step this participant acted in. */
    public static final class HistoryEntry {
        private final int step;
        private final String action;
        private final String outcome;
        private final boolean success;
        private final double reward;

        public HistoryEntry(int step, String action, String outcome, boolean success, double reward) {
            this.step = step;
            this.action = action;
            this.outcome = outcome;
            this.success = success;
            this.reward = reward;
        }

        public int getStep() { return step; }
        public String getAction() { return action; }
        public String getOutcome() { return outcome; }
        public boolean isSuccess() { return success; }
        public double getReward() { return reward; }
    }

    private double health;
    private double energy;
    private double wealth;
    private double reputation;
    private double happiness;
    private double stress;
    private double trust;
    private final EnumMap<Emotion, Double> emotions = new EnumMap<>(Emotion.class);
    private final EnumMap<Pressure, Double> pressures = new EnumMap<>(Pressure.class);
    private int step;
    private final List<HistoryEntry> history = new ArrayList<>();

    private EpisodicState() { }

    /**
     * Fresh state at reset: full health and energy, social scalars and
     * emotions from the profile baseline, mild starting pressures.
     */
    public static EpisodicState initial(CharacterProfile profile) {
        EpisodicState s = new EpisodicState();
        s.health = 1.0;
        s.energy = 1.0;
        s.wealth = profile.social(Social.WEALTH);
        s.reputation = profile.social(Social.REPUTATION);
        s.happiness = 0.5;
        s.stress = 0.1;
        s.trust = profile.social(Social.TRUST);
        for (Emotion e : Emotion.values()) {
            s.emotions.put(e, profile.emotion(e));
        }
        for (Pressure p : Pressure.values()) {
            s.pressures.put(p, p.getInitial());
        }
        s.step = 0;
        return s;
    }

    public EpisodicState copy() {
        EpisodicState c = new EpisodicState();
        c.health = health;
        c.energy = energy;
        c.wealth = wealth;
        c.reputation = reputation;
        c.happiness = happiness;
        c.stress = stress;
        c.trust = trust;
        c.emotions.putAll(emotions);
        c.pressures.putAll(pressures);
        c.step = step;
        c.history.addAll(history);
        return c;
    }

    static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    public double getHealth() { return health; }
    public double getEnergy() { return energy; }
    public double getWealth() { return wealth; }
    public double getReputation() { return reputation; }
    public double getHappiness() { return happiness; }
    public double getStress() { return stress; }
    public double getTrust() { return trust; }
    public int getStep() { return step; }

    public double emotion(Emotion e) {
        return emotions.get(e);
    }

    public double pressure(Pressure p) {
        return pressures.get(p);
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    void adjustHealth(double delta) { health = clamp(health + delta, 0.0, 1.0); }
    void adjustEnergy(double delta) { energy = clamp(energy + delta, 0.1, 1.0); }
    void adjustWealth(double delta) { wealth = clamp(wealth + delta, 0.0, 1.0); }
    void adjustReputation(double delta) { reputation = clamp(reputation + delta, 0.0, 1.0); }
    void adjustHappiness(double delta) { happiness = clamp(happiness + delta, 0.1, 1.0); }
    void adjustStress(double delta) { stress = clamp(stress + delta, 0.0, 1.0); }
    void adjustTrust(double delta) { trust = clamp(trust + delta, 0.0, 1.0); }

    void adjustEmotion(Emotion e, double delta) {
        emotions.put(e, clamp(emotions.get(e) + delta, 0.0, 1.0));
    }

    void setEmotion(Emotion e, double v) {
        emotions.put(e, clamp(v, 0.0, 1.0));
    }

    void setPressure(Pressure p, double v) {
        pressures.put(p, clamp(v, 0.0, 1.0));
    }

    void setStep(int step) {
        this.step = step;
    }

    void append(HistoryEntry entry) {
        history.add(entry);
    }

    @Override
    public String toString() {
        return String.format("EpisodicState{step=%d, health=%.2f, energy=%.2f, wealth=%.2f, reputation=%.2f,"
                        + " happiness=%.2f, stress=%.2f, trust=%.2f, emotions=%s, pressures=%s}",
                step, health, energy, wealth, reputation, happiness, stress, trust, emotions, pressures);
    }
}
