package com.gdin.explorer.network.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 前端消费的网络快照。nodes 按 (degree desc, id asc)，edges 按 (source, target) 排序。
 */
@Value
@Jacksonized
@Builder
@JsonPropertyOrder({"nodes", "edges", "meta"})
public class GraphSnapshot {

    @JsonProperty("nodes")
    List<NodeOutput> nodes;

    @JsonProperty("edges")
    List<EdgeRecord> edges;

    @JsonProperty("meta")
    Meta meta;

    @Value
    @Jacksonized
    @Builder
    @JsonPropertyOrder({"generatedAt", "totalNodes", "totalEdges", "supportedTypes", "weightMin", "typePairs"})
    public static class Meta {

        // 唯一的非确定字段，测试中固定 Clock
        @JsonProperty("generatedAt")
        String generatedAt;

        @JsonProperty("totalNodes")
        int totalNodes;

        @JsonProperty("totalEdges")
        int totalEdges;

        @JsonProperty("supportedTypes")
        List<String> supportedTypes;

        @JsonProperty("weightMin")
        int weightMin;

        @JsonProperty("typePairs")
        List<List<String>> typePairs;
    }
}
