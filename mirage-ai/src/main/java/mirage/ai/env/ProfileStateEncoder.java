package mirage.ai.env;

/**
 * Compact encoder used by the duel arena: who the character is plus how
 * they currently feel and stand.
 *
 * Layout (total 18):
 *   [0..4]    personality O, C, E, A, N
 *   [5..9]    elemental affinity metal, wood, water, fire, earth
 *   [10..13]  current emotions joy, anger, sadness, fear
 *   [14..17]  reputation, trust, wealth (current), status (profile)
 *
 * Element weights summing above 1 are treated as counts and normalized to
 * proportions.
 */
public final class ProfileStateEncoder implements StateEncoder {

    public static final int DIMENSION = 18;

    @Override
    public int dimension() {
        return DIMENSION;
    }

    @Override
    public double[] encode(CharacterProfile profile, EpisodicState state) {
        double[] v = new double[DIMENSION];
        int i = 0;
        for (Trait t : Trait.values()) {
            v[i++] = profile.trait(t);
        }

        double total = 0.0;
        for (Element e : Element.values()) {
            total += profile.element(e);
        }
        double scale = total > 1.0 ? 1.0 / total : 1.0;
        for (Element e : Element.values()) {
            v[i++] = profile.element(e) * scale;
        }

        for (Emotion e : Emotion.values()) {
            v[i++] = state.emotion(e);
        }

        v[i++] = state.getReputation();
        v[i++] = state.getTrust();
        v[i++] = state.getWealth();
        v[i] = profile.social(Social.STATUS);
        return v;
    }
}
