package com.gdin.explorer.network.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder
@JsonPropertyOrder({"source", "target", "type", "weight", "articleIds"})
public class EdgeRecord {

    @JsonProperty("source")
    String source;

    @JsonProperty("target")
    String target;

    @JsonProperty("type")
    String relationType;

    @JsonProperty("weight")
    int weight;

    @JsonProperty("articleIds")
    List<String> articleIds;

    @JsonIgnore
    public EdgeKey getKey() {
        return EdgeKey.of(source, target);
    }
}
