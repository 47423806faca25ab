package com.gdin.explorer.network.index.run;

import com.gdin.explorer.network.models.NetworkBuildReport;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * gdin.map.network.run-on-startup=true 时，启动后执行一次构建。
 * 可用 --pipeline=full 覆盖配置中的流水线。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "gdin.map.network", name = "run-on-startup", havingValue = "true")
public class NetworkBuildCommand implements ApplicationRunner {

    @Resource
    private NetworkIndexRunner networkIndexRunner;

    @Override
    public void run(ApplicationArguments args) {
        List<String> pipeline = args.getOptionValues("pipeline");
        NetworkBuildReport report = (pipeline == null || pipeline.isEmpty())
                ? networkIndexRunner.run()
                : networkIndexRunner.run(pipeline.get(0));
        if (report.isEmptyGraph()) {
            log.warn("网络快照为空（totalEdges=0），请检查 weightMin / typePairs 配置或输入数据");
        }
        if (report.getTotalSkippedRecords() > 0) {
            log.warn("跳过异常实体记录：{}", report.getSkippedRecords());
        }
        log.info("各步骤耗时：{}", report.getWorkflowSeconds());
    }
}
