package mirage.ai.env;

public enum Phase {
    FRESH,
    ACTIVE,
    TERMINATED
}
