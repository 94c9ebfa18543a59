package com.example.llmexplorer.graph;

import com.example.llmexplorer.fingerprint.StateFingerprint;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * 一步探索留下的边，只追加不去重
 */
@Getter
@AllArgsConstructor
public class GraphEdge {

    private final int step;
    @JsonIgnore
    private final GraphNode source;
    private final ActionDescriptor action;
    @JsonIgnore
    private final GraphNode destination;
    private final EdgeOutcome outcome;
    private final Instant timestamp;

    public int getSourceId() {
        return source.getId();
    }

    public int getDestinationId() {
        return destination.getId();
    }

    public String getSourceScreen() {
        return source.getScreenName();
    }

    public String getDestinationScreen() {
        return destination.getScreenName();
    }

    public StateFingerprint getSourceFingerprint() {
        return source.getFingerprint();
    }

    public StateFingerprint getDestinationFingerprint() {
        return destination.getFingerprint();
    }

    public boolean isSelfLoop() {
        return source == destination;
    }
}
