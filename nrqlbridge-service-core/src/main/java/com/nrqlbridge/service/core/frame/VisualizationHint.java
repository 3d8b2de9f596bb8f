package com.nrqlbridge.service.core.frame;

public enum VisualizationHint {
    TABLE("table"),
    GRAPH("graph");

    private final String wireName;

    VisualizationHint(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
