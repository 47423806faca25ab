package com.gdin.explorer.network.index.run;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.explorer.network.catalog.EntityCatalogSnapshot;
import com.gdin.explorer.network.config.properties.NetworkProperties;
import com.gdin.explorer.network.exception.NetworkBuildException;
import com.gdin.explorer.network.index.pipeline.Pipeline;
import com.gdin.explorer.network.index.pipeline.PipelineFactory;
import com.gdin.explorer.network.index.pipeline.context.PipelineRunContext;
import com.gdin.explorer.network.index.pipeline.context.PipelineRunResult;
import com.gdin.explorer.network.index.pipeline.context.RunPipeline;
import com.gdin.explorer.network.models.EntityType;
import com.gdin.explorer.network.models.GraphSnapshot;
import com.gdin.explorer.network.models.NetworkBuildReport;
import com.gdin.explorer.network.models.TypePair;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 每次调用都从零重建：新建上下文，执行整条流水线，返回构建报告。
 * 任一步骤失败抛出 {@link NetworkBuildException}，此时快照未写出。
 */
@Slf4j
@Service
public class NetworkIndexRunner {
    @Resource
    private NetworkProperties networkProperties;

    @Resource
    private PipelineFactory<Object> factory;

    public NetworkBuildReport run() {
        return run(networkProperties.getPipeline());
    }

    public NetworkBuildReport run(String pipelineName) {
        PipelineRunContext ctx = new PipelineRunContext();

        // ==============配置校验（在任何输出之前）==============
        List<TypePair> typePairs = TypePair.parseAll(networkProperties.getTypePairs());
        if (typePairs.isEmpty()) throw new IllegalArgumentException("typePairs 不能为空");
        int weightMin = networkProperties.getWeightMin() == null ? 0 : networkProperties.getWeightMin();
        if (weightMin < 0) throw new IllegalArgumentException("weightMin must be >= 0: " + weightMin);
        List<EntityType> supportedTypes = parseSupportedTypes(networkProperties.getSupportedTypes());

        // ==============路径==============
        Path dataDir = Path.of(networkProperties.getDataDir());
        ctx.put("entities_dir", StrUtil.isBlank(networkProperties.getEntitiesDir())
                ? dataDir.resolve("entities")
                : Path.of(networkProperties.getEntitiesDir()));
        ctx.put("output_file", StrUtil.isBlank(networkProperties.getOutputFile())
                ? dataDir.resolve("networks").resolve("global.json").toString()
                : networkProperties.getOutputFile());
        // ==============build_entity_collections==============
        ctx.put("articles_file", dataDir.resolve(networkProperties.getArticlesFile()));
        ctx.put("index_file", dataDir.resolve(networkProperties.getIndexFile()));
        // ==============build_network==============
        ctx.put("supported_types", supportedTypes);
        ctx.put("type_pairs", typePairs);
        ctx.put("weight_min", weightMin);
        ctx.put("parallelism", networkProperties.getParallelism());

        Pipeline<Object> pipeline = factory.createPipeline(pipelineName);
        List<PipelineRunResult> results = new RunPipeline<>().run(pipeline, null, ctx);

        for (PipelineRunResult result : results) {
            if (result.hasErrors()) {
                throw new NetworkBuildException(result.getWorkflow(), result.getErrors().get(0));
            }
        }

        NetworkBuildReport report = toReport(pipelineName, ctx);
        log.info(
                "网络构建完成：pipeline={}, nodes={}, edges={}, skippedRecords={}, missingCollections={}, file={}",
                report.getPipeline(),
                report.getTotalNodes(),
                report.getTotalEdges(),
                report.getTotalSkippedRecords(),
                report.getMissingCollections(),
                report.getSnapshotLocation()
        );
        return report;
    }

    private NetworkBuildReport toReport(String pipelineName, PipelineRunContext ctx) {
        EntityCatalogSnapshot catalog = ctx.get("catalog");
        GraphSnapshot snapshot = ctx.get("snapshot");
        int totalNodes = snapshot == null ? 0 : snapshot.getMeta().getTotalNodes();
        int totalEdges = snapshot == null ? 0 : snapshot.getMeta().getTotalEdges();
        return NetworkBuildReport.builder()
                .pipeline(pipelineName)
                .snapshotLocation(ctx.get("snapshot_location"))
                .totalNodes(totalNodes)
                .totalEdges(totalEdges)
                .emptyGraph(totalEdges == 0)
                .skippedRecords(catalog == null ? new EnumMap<>(EntityType.class) : catalog.getSkippedRecords())
                .missingCollections(catalog == null ? EnumSet.noneOf(EntityType.class) : catalog.getMissingTypes())
                .workflowSeconds(new LinkedHashMap<>(ctx.getStats().getWorkflowSeconds()))
                .totalSeconds(ctx.getStats().getTotalSeconds())
                .build();
    }

    private List<EntityType> parseSupportedTypes(List<String> tags) {
        if (CollectionUtil.isEmpty(tags)) return List.of(EntityType.values());
        return tags.stream()
                .map(EntityType::fromTag)
                .distinct()
                .collect(Collectors.toList());
    }
}
