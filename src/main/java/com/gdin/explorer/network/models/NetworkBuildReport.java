package com.gdin.explorer.network.models;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

@Value
@Builder
public class NetworkBuildReport {
    String pipeline;
    String snapshotLocation;
    int totalNodes;
    int totalEdges;
    boolean emptyGraph;
    Map<EntityType, Integer> skippedRecords;
    Set<EntityType> missingCollections;
    Map<String, Double> workflowSeconds;
    double totalSeconds;

    public int getTotalSkippedRecords() {
        return skippedRecords == null ? 0 : skippedRecords.values().stream().mapToInt(Integer::intValue).sum();
    }
}
