package com.driveplot.core.model;

import java.util.List;

public enum TrafficModel {
    OPTIMISTIC("optimistic"),
    PESSIMISTIC("pessimistic"),
    BEST_GUESS("best_guess");

    public static final List<TrafficModel> SAMPLED = List.of(OPTIMISTIC, PESSIMISTIC);

    private final String apiValue;

    TrafficModel(String apiValue) {
        this.apiValue = apiValue;
    }

    public String apiValue() {
        return apiValue;
    }
}
