package com.roundpilot.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named screen regions every source must define in the layout file.
 */
public enum RegionRole {
    PHASE("phase"),
    SCORE("score"),
    MY_MONEY("my_money"),
    OTHER_COUNT("other_count"),
    OTHER_MONEY("other_money");

    private final String key;

    RegionRole(String key) {
        this.key = key;
    }

    /** Key used in the layout file. */
    public String key() {
        return key;
    }

    public static Optional<RegionRole> fromKey(String key) {
        return Arrays.stream(values()).filter(r -> r.key.equals(key)).findFirst();
    }
}
