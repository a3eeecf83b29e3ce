package mirage.ai.env;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Situation presets layered on top of the reset state.
 */
public enum Scenario {
    DANGER("danger", "threat", "battle", "fight") {
        @Override
        void apply(EpisodicState s) {
            s.setPressure(Pressure.THREAT, 0.8);
            s.setEmotion(Emotion.FEAR, 0.6);
        }
    },
    OPPORTUNITY("opportunity", "lucky", "luck", "discovery") {
        @Override
        void apply(EpisodicState s) {
            s.setPressure(Pressure.OPPORTUNITY, 0.8);
            s.setEmotion(Emotion.JOY, 0.6);
        }
    },
    URGENT("urgent", "deadline", "hurry", "emergency") {
        @Override
        void apply(EpisodicState s) {
            s.setPressure(Pressure.TIME, 0.8);
        }
    },
    SOCIAL("social", "crowd", "public", "party") {
        @Override
        void apply(EpisodicState s) {
            s.setPressure(Pressure.SOCIAL, 0.7);
        }
    },
    BETRAYAL("betrayal", "betrayed", "anger", "angry") {
        @Override
        void apply(EpisodicState s) {
            s.setEmotion(Emotion.ANGER, 0.7);
        }
    },
    LOSS("loss", "grief", "sad", "mourning") {
        @Override
        void apply(EpisodicState s) {
            s.setEmotion(Emotion.SADNESS, 0.7);
        }
    };

    private final String[] keywords;

    Scenario(String... keywords) {
        this.keywords = keywords;
    }

    abstract void apply(EpisodicState s);

    /**
     * Every preset whose keywords appear in a free-text description.
     * Unknown text yields an empty set.
     */
    public static Set<Scenario> parse(String description) {
        Set<Scenario> found = EnumSet.noneOf(Scenario.class);
        if (description == null || description.isBlank()) {
            return found;
        }
        String text = description.toLowerCase(Locale.ROOT);
        for (Scenario s : values()) {
            for (String k : s.keywords) {
                if (text.contains(k)) {
                    found.add(s);
                    break;
                }
            }
        }
        return found;
    }
}
