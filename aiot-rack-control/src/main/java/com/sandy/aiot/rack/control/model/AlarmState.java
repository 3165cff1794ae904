package com.sandy.aiot.rack.control.model;

import java.util.Arrays;
import java.util.Collection;

/**
 * Single alarm slot of a rack. Declaration order is the wire code (0..3) and also the
 * priority: {@code OVERHEAT > BREAK_IN > DOOR_OPEN > OFF}. All precedence decisions go
 * through {@link #outranks(AlarmState)} and {@link #highest(Collection)}.
 */
public enum AlarmState {
    OFF(0, 0),
    DOOR_OPEN(1, 1),
    BREAK_IN(2, 2),
    OVERHEAT(3, 3);

    private final int code;
    private final int rank;

    AlarmState(int code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    public int code() {
        return code;
    }

    public boolean outranks(AlarmState other) {
        return rank > other.rank;
    }

    public static AlarmState fromCode(int code) {
        return Arrays.stream(values())
                .filter(s -> s.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown alarm code: " + code));
    }

    /** Highest-priority cause among the active ones, {@link #OFF} when none is active. */
    public static AlarmState highest(Collection<AlarmState> active) {
        AlarmState best = OFF;
        for (AlarmState s : active) {
            if (s != null && s.outranks(best)) best = s;
        }
        return best;
    }
}
