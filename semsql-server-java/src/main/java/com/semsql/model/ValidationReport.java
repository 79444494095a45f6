package com.semsql.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class ValidationReport {
    private final boolean fanOutSafe;
    private final List<FanOutMarker> fanOutMarkers;
    private final List<String> joinDecisions;

    public ValidationReport(boolean fanOutSafe, List<FanOutMarker> fanOutMarkers, List<String> joinDecisions) {
        this.fanOutSafe = fanOutSafe;
        this.fanOutMarkers = List.copyOf(fanOutMarkers);
        this.joinDecisions = List.copyOf(joinDecisions);
    }

    @JsonProperty("fan_out_safe")
    public boolean isFanOutSafe() {
        return fanOutSafe;
    }

    @JsonProperty("fan_out_markers")
    public List<FanOutMarker> getFanOutMarkers() {
        return fanOutMarkers;
    }

    @JsonProperty("join_decisions")
    public List<String> getJoinDecisions() {
        return joinDecisions;
    }
}
