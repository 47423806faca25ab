package com.gdin.explorer.network.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
@JsonPropertyOrder({"id", "type", "label", "count", "degree"})
public class NodeOutput {

    @JsonProperty("id")
    String id;

    @JsonProperty("type")
    String type;

    @JsonProperty("label")
    String label;

    @JsonProperty("count")
    int count;

    // 只统计剪枝后保留的边
    @JsonProperty("degree")
    int degree;

    public static NodeOutput of(EntityRecord record, int degree) {
        return NodeOutput.builder()
                .id(record.getNodeId())
                .type(record.getType().getTag())
                .label(record.getLabel())
                .count(record.getDeclaredCount())
                .degree(degree)
                .build();
    }
}
