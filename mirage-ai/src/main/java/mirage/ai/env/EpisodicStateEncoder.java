package mirage.ai.env;

/**
 * Encoder for the character environments.
 *
 * Layout (total 20):
 *   [0..6]    health, energy, wealth, reputation, happiness, stress, trust
 *   [7..11]   personality O, C, E, A, N
 *   [12..15]  emotions joy, anger, sadness, fear
 *   [16..19]  pressures threat, opportunity, social, time
 */
public final class EpisodicStateEncoder implements StateEncoder {

    public static final int DIMENSION = 20;

    private static final int ATTR_OFFSET = 0;
    private static final int TRAIT_OFFSET = 7;
    private static final int EMOTION_OFFSET = TRAIT_OFFSET + Trait.values().length;      // 12
    private static final int PRESSURE_OFFSET = EMOTION_OFFSET + Emotion.values().length; // 16

    @Override
    public int dimension() {
        return DIMENSION;
    }

    @Override
    public double[] encode(CharacterProfile profile, EpisodicState state) {
        double[] v = new double[DIMENSION];

        v[ATTR_OFFSET]     = state.getHealth();
        v[ATTR_OFFSET + 1] = state.getEnergy();
        v[ATTR_OFFSET + 2] = state.getWealth();
        v[ATTR_OFFSET + 3] = state.getReputation();
        v[ATTR_OFFSET + 4] = state.getHappiness();
        v[ATTR_OFFSET + 5] = state.getStress();
        v[ATTR_OFFSET + 6] = state.getTrust();

        Trait[] traits = Trait.values();
        for (int i = 0; i < traits.length; i++) {
            v[TRAIT_OFFSET + i] = profile.trait(traits[i]);
        }
        Emotion[] emotions = Emotion.values();
        for (int i = 0; i < emotions.length; i++) {
            v[EMOTION_OFFSET + i] = state.emotion(emotions[i]);
        }
        Pressure[] pressures = Pressure.values();
        for (int i = 0; i < pressures.length; i++) {
            v[PRESSURE_OFFSET + i] = state.pressure(pressures[i]);
        }
        return v;
    }
}
