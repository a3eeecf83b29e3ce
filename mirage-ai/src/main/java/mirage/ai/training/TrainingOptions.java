package mirage.ai.training;

import java.time.Duration;

/**
 * Optional knobs of a training run: a wall-clock budget, a progress
 * listener and a trajectory export.
 */
public final class TrainingOptions {
    private final Duration timeout;
    private final EpisodeListener listener;
    private final TrajectoryWriter writer;

    private TrainingOptions(Builder b) {
        this.timeout = b.timeout;
        this.listener = b.listener;
        this.writer = b.writer;
    }

    public static TrainingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Null means no deadline. */
    public Duration getTimeout() {
        return timeout;
    }

    public EpisodeListener getListener() {
        return listener;
    }

    /** Null means no export. */
    public TrajectoryWriter getWriter() {
        return writer;
    }

    public static final class Builder {
        private Duration timeout;
        private EpisodeListener listener = EpisodeListener.NONE;
        private TrajectoryWriter writer;

        private Builder() { }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder listener(EpisodeListener listener) {
            this.listener = listener != null ? listener : EpisodeListener.NONE;
            return this;
        }

        public Builder writer(TrajectoryWriter writer) {
            this.writer = writer;
            return this;
        }

        public TrainingOptions build() {
            return new TrainingOptions(this);
        }
    }
}
