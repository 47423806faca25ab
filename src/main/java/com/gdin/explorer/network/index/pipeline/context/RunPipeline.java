package com.gdin.explorer.network.index.pipeline.context;

import com.gdin.explorer.network.index.pipeline.Pipeline;
import com.gdin.explorer.network.index.pipeline.WorkflowFunctionOutput;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 顺序执行流水线。任一步骤异常即停止，后续步骤（包括持久化）不会执行。
 * 每步结束后记录耗时以及该步新写入 context 的状态键。
 */
@Slf4j
public class RunPipeline<C> {

    public List<PipelineRunResult> run(Pipeline<C> pipeline, C config, PipelineRunContext context) {
        long start = System.nanoTime();
        List<PipelineRunResult> results = new ArrayList<>();
        List<String> completed = new ArrayList<>();
        String current = null;

        log.info("网络构建流水线开始：pipeline={}, steps={}", pipeline.getName(), pipeline.stepNames());
        try {
            for (Pipeline.Step<C> step : pipeline) {
                current = step.getName();
                Set<String> before = new TreeSet<>(context.keySet());
                long t0 = System.nanoTime();
                log.info("Start: {}", current);

                WorkflowFunctionOutput out = step.getFn().run(config, context);

                double sec = (System.nanoTime() - t0) / 1_000_000_000.0;
                context.getStats().getWorkflowSeconds().put(current, sec);
                Set<String> produced = new TreeSet<>(context.keySet());
                produced.removeAll(before);
                log.info("Done: {} ({}s) produced={}", current, String.format("%.2f", sec), produced);

                results.add(PipelineRunResult.builder()
                        .workflow(current)
                        .result(out == null ? null : out.getResult())
                        .context(context)
                        .errors(null)
                        .build());
                completed.add(current);
            }

            context.getStats().setTotalSeconds((System.nanoTime() - start) / 1_000_000_000.0);
            log.info("网络构建流水线完成：pipeline={}, total={}s", pipeline.getName(),
                    String.format("%.2f", context.getStats().getTotalSeconds()));
            return results;

        } catch (Exception e) {
            log.error("网络构建中止，快照未写出：pipeline={}, failedStep={}, completed={}",
                    pipeline.getName(), current, completed, e);
            results.add(PipelineRunResult.builder()
                    .workflow(current)
                    .result(null)
                    .context(context)
                    .errors(List.of(e))
                    .build());
            context.getStats().setTotalSeconds((System.nanoTime() - start) / 1_000_000_000.0);
            return results;
        }
    }
}
