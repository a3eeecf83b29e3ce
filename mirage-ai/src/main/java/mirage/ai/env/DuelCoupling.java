package mirage.ai.env;

import org.apache.commons.lang3.tuple.Pair;

/**
 * Partner effects in the duel arena.
 *
 * <ul>
 *   <li>compromise (either branch): opponent trust +0.03</li>
 *   <li>clash (either branch): opponent anger +0.05; on success also health -0.15</li>
 *   <li>successful threaten: opponent fear +0.1, stress +0.05</li>
 *   <li>successful plead: opponent sadness +0.05, anger -0.05</li>
 *   <li>cold_shoulder (either branch): opponent stress +0.05</li>
 * </ul>
 */
public final class DuelCoupling implements Coupling {

    @Override
    public Pair<EpisodicState, EpisodicState> apply(Outcome outcome, EpisodicState actor, EpisodicState partner) {
        EpisodicState a = actor.copy();
        EpisodicState p = partner.copy();
        boolean success = outcome.isSuccess();

        switch (outcome.getAction().getLabel()) {
            case "compromise":
                p.adjustTrust(0.03);
                break;
            case "clash":
                p.adjustEmotion(Emotion.ANGER, 0.05);
                if (success) {
                    p.adjustHealth(-0.15);
                }
                break;
            case "threaten":
                if (success) {
                    p.adjustEmotion(Emotion.FEAR, 0.1);
                    p.adjustStress(0.05);
                }
                break;
            case "plead":
                if (success) {
                    p.adjustEmotion(Emotion.SADNESS, 0.05);
                    p.adjustEmotion(Emotion.ANGER, -0.05);
                }
                break;
            case "cold_shoulder":
                p.adjustStress(0.05);
                break;
            default:
                break;
        }
        return Pair.of(a, p);
    }
}
