package mirage.ai.env;

import org.apache.commons.lang3.tuple.Pair;

/**
 * Partner effects in the interaction variant. Only the partner's copy is
 * changed; the actor's consequences were already applied by the outcome model.
 *
 * <ul>
 *   <li>successful cooperate / share / help: partner trust +0.05, joy +0.05</li>
 *   <li>compromise (either branch): partner trust +0.03</li>
 *   <li>successful attack: partner health -0.1, fear +0.1; failed attack: partner anger +0.05</li>
 *   <li>withhold / refuse / ignore (either branch): partner trust -0.03, anger +0.05</li>
 *   <li>successful compete: partner happiness -0.05</li>
 * </ul>
 */
public final class InteractionCoupling implements Coupling {

    @Override
    public Pair<EpisodicState, EpisodicState> apply(Outcome outcome, EpisodicState actor, EpisodicState partner) {
        EpisodicState a = actor.copy();
        EpisodicState p = partner.copy();
        boolean success = outcome.isSuccess();

        switch (outcome.getAction().getLabel()) {
            case "cooperate":
            case "share":
            case "help":
                if (success) {
                    p.adjustTrust(0.05);
                    p.adjustEmotion(Emotion.JOY, 0.05);
                }
                break;
            case "compromise":
                p.adjustTrust(0.03);
                break;
            case "attack":
                if (success) {
                    p.adjustHealth(-0.1);
                    p.adjustEmotion(Emotion.FEAR, 0.1);
                } else {
                    p.adjustEmotion(Emotion.ANGER, 0.05);
                }
                break;
            case "withhold":
            case "refuse":
            case "ignore":
                p.adjustTrust(-0.03);
                p.adjustEmotion(Emotion.ANGER, 0.05);
                break;
            case "compete":
                if (success) {
                    p.adjustHappiness(-0.05);
                }
                break;
            default:
                break;
        }
        return Pair.of(a, p);
    }
}
