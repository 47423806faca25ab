package com.gdin.explorer.network.index.pipeline.context;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class PipelineRunStats {

    // 按执行顺序记录
    private final Map<String, Double> workflowSeconds = new LinkedHashMap<>();

    @Setter
    private double totalSeconds;
}
