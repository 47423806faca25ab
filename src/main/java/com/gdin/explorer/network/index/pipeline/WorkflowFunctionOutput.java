package com.gdin.explorer.network.index.pipeline;

import lombok.Value;

@Value
public class WorkflowFunctionOutput {
    Object result;

    public static WorkflowFunctionOutput done(String workflow) {
        return new WorkflowFunctionOutput(workflow + "_done");
    }
}
