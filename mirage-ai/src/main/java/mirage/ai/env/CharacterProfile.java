package mirage.ai.env;

import java.util.EnumMap;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * Read-only character inputs for one episode. Validated once, in
 * {@link Builder#build()}; unset fields take the neutral default of their
 * group (personality 0.5, element 0.2, emotion 0.25, social 0.5).
 */
public final class CharacterProfile {
    /** Separates an identity key from an agent-variant suffix; not allowed in identity keys. */
    public static final char VARIANT_SEPARATOR = '#';

    private final String identityKey;
    private final String name;
    private final EnumMap<Trait, Double> traits;
    private final EnumMap<Element, Double> elements;
    private final EnumMap<Emotion, Double> emotions;
    private final EnumMap<Social, Double> social;

    private CharacterProfile(Builder b) {
        this.identityKey = b.identityKey;
        this.name = b.name != null ? b.name : b.identityKey;
        this.traits = new EnumMap<>(b.traits);
        this.elements = new EnumMap<>(b.elements);
        this.emotions = new EnumMap<>(b.emotions);
        this.social = new EnumMap<>(b.social);
    }

    public static Builder builder(String identityKey) {
        return new Builder(identityKey);
    }

    public String getIdentityKey() {
        return identityKey;
    }

    public String getName() {
        return name;
    }

    public double trait(Trait t) {
        return traits.getOrDefault(t, Trait.NEUTRAL);
    }

    public double element(Element e) {
        return elements.getOrDefault(e, Element.NEUTRAL);
    }

    public double emotion(Emotion e) {
        return emotions.getOrDefault(e, Emotion.NEUTRAL);
    }

    public double social(Social s) {
        return social.getOrDefault(s, Social.NEUTRAL);
    }

    public double openness() { return trait(Trait.OPENNESS); }
    public double conscientiousness() { return trait(Trait.CONSCIENTIOUSNESS); }
    public double extraversion() { return trait(Trait.EXTRAVERSION); }
    public double agreeableness() { return trait(Trait.AGREEABLENESS); }
    public double neuroticism() { return trait(Trait.NEUROTICISM); }

    /** Copy of this profile under another key, with everything else kept. */
    public Builder toBuilder() {
        Builder b = new Builder(identityKey).name(name);
        b.traits.putAll(traits);
        b.elements.putAll(elements);
        b.emotions.putAll(emotions);
        b.social.putAll(social);
        return b;
    }

    @Override
    public String toString() {
        return "CharacterProfile{" + identityKey + ", traits=" + traits + "}";
    }

    public static final class Builder {
        private final String identityKey;
        private String name;
        private final Map<Trait, Double> traits = new EnumMap<>(Trait.class);
        private final Map<Element, Double> elements = new EnumMap<>(Element.class);
        private final Map<Emotion, Double> emotions = new EnumMap<>(Emotion.class);
        private final Map<Social, Double> social = new EnumMap<>(Social.class);

        private Builder(String identityKey) {
            this.identityKey = identityKey;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder trait(Trait t, double v) {
            traits.put(t, v);
            return this;
        }

        public Builder element(Element e, double v) {
            elements.put(e, v);
            return this;
        }

        public Builder emotion(Emotion e, double v) {
            emotions.put(e, v);
            return this;
        }

        public Builder social(Social s, double v) {
            social.put(s, v);
            return this;
        }

        public CharacterProfile build() {
            Preconditions.checkArgument(identityKey != null && !identityKey.isBlank(),
                    "identity key must not be blank");
            Preconditions.checkArgument(identityKey.indexOf(VARIANT_SEPARATOR) < 0,
                    "identity key must not contain '%s': %s", VARIANT_SEPARATOR, identityKey);
            traits.forEach((k, v) -> checkUnit("personality " + k, v));
            emotions.forEach((k, v) -> checkUnit("emotion " + k, v));
            social.forEach((k, v) -> checkUnit("social " + k, v));
            elements.forEach((k, v) -> Preconditions.checkArgument(v != null && Double.isFinite(v) && v >= 0,
                    "element %s must be a finite non-negative weight: %s", k, v));
            return new CharacterProfile(this);
        }

        private static void checkUnit(String what, Double v) {
            Preconditions.checkArgument(v != null && v >= 0.0 && v <= 1.0,
                    "%s must be in [0, 1]: %s", what, v);
        }
    }
}
