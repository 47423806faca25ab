package com.gdin.explorer.network.index.pipeline;

import com.gdin.explorer.network.index.pipeline.context.PipelineRunContext;

/**
 * 网络构建中的一个步骤。
 * 从 context 读取上一步写入的状态（require），把本步结果写回 context。
 * 抛出任何异常都会中止整条流水线，之后的步骤（包括写快照）不再执行。
 */
@FunctionalInterface
public interface WorkflowFunction<C> {
    WorkflowFunctionOutput run(C config, PipelineRunContext context) throws Exception;
}
