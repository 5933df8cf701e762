package com.segments.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The fixed segment classifications, in reporting order.
 * Each key maps from exactly one raw segment label.
 */
public enum Category {

    NEW_USERS("new_users", "New Users"),
    INACTIVE("inactive", "Inactive"),
    CORE_GAMERS("core_gamers", "Core Gamer"),
    STARTERS("starters", "Starters"),
    REGULARS("regulars", "Regular"),
    CASUALS("casuals", "Casual"),
    PREVIOUSLY_ACTIVE_LAST_3M("previously_active_last_3m", "Previously Active (last 3 months)"),
    PREVIOUSLY_ACTIVE_BEFORE_3M("previously_active_before_3m", "Previously Active (before 3 months)");

    private final String key;
    private final String label;

    Category(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public static List<String> keys() {
        return Arrays.stream(values()).map(Category::getKey).collect(Collectors.toList());
    }
}
