package com.gdin.explorer.network.index.pipeline.context;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一次构建的全部中间状态。每次运行新建，运行结束即丢弃。
 */
@Getter
public class PipelineRunContext {

    private final PipelineRunStats stats = new PipelineRunStats();
    private final Map<String, Object> state = new HashMap<>();

    public void put(String key, Object value) { state.put(key, value); }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) { return (T) state.get(key); }

    /**
     * 上一步必须已经写入的状态；缺失说明流水线顺序配置错误。
     */
    public <T> T require(String key) {
        T value = get(key);
        if (value == null) throw new IllegalStateException("pipeline state missing: " + key);
        return value;
    }

    public Set<String> keySet() {
        return state.keySet();
    }
}
