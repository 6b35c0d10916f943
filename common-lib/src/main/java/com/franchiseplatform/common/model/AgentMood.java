package com.franchiseplatform.common.model;

/**
 * Agent disposition toward the user's team. Declared worst to best, so
 * {@link #ordinal()} ordering is ANGRY &lt; NEUTRAL &lt; INTERESTED &lt; EXCITED.
 */
public enum AgentMood {
    ANGRY,
    NEUTRAL,
    INTERESTED,
    EXCITED;

    /** One step toward {@code target}; unchanged when already there. */
    public AgentMood stepToward(AgentMood target) {
        if (this == target) return this;
        int next = ordinal() + (target.ordinal() > ordinal() ? 1 : -1);
        return values()[next];
    }

    public AgentMood worsen(int steps) {
        return values()[Math.max(0, ordinal() - steps)];
    }

    public AgentMood improve() {
        return values()[Math.min(values().length - 1, ordinal() + 1)];
    }

    public boolean isWorseThan(AgentMood other) {
        return ordinal() < other.ordinal();
    }
}
