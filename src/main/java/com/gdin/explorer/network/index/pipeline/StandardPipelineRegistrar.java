package com.gdin.explorer.network.index.pipeline;

import com.gdin.explorer.network.catalog.EntityCatalogSnapshot;
import com.gdin.explorer.network.catalog.JsonFileEntityCatalog;
import com.gdin.explorer.network.index.workflows.*;
import com.gdin.explorer.network.models.ArticleEntityIndex;
import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.EntityType;
import com.gdin.explorer.network.models.NodeOutput;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class StandardPipelineRegistrar {
    public static final String PIPELINE_NETWORK = "network";
    public static final String PIPELINE_FULL = "full";

    @Resource
    private BuildEntityCollectionsWorkflow buildEntityCollectionsWorkflow;
    @Resource
    private LoadEntityCatalogWorkflow loadEntityCatalogWorkflow;
    @Resource
    private BuildArticleIndexWorkflow buildArticleIndexWorkflow;
    @Resource
    private AccumulateEdgesWorkflow accumulateEdgesWorkflow;
    @Resource
    private PruneEdgesWorkflow pruneEdgesWorkflow;
    @Resource
    private AssembleNodesWorkflow assembleNodesWorkflow;
    @Resource
    private PersistSnapshotWorkflow persistSnapshotWorkflow;

    @Resource
    public PipelineFactory<Object> factory;

    @PostConstruct
    public void init() {

        // 0) build_entity_collections：articles.json + index.json -> entities/*.json
        factory.register("build_entity_collections", (cfg, ctx) -> {
            Map<EntityType, Integer> counts = buildEntityCollectionsWorkflow.run(
                    ctx.require("articles_file"),
                    ctx.require("index_file"),
                    ctx.require("entities_dir")
            );
            ctx.put("entity_collection_counts", counts);
            return WorkflowFunctionOutput.done("build_entity_collections");
        });

        // 1) load_entity_catalog
        factory.register("load_entity_catalog", (cfg, ctx) -> {
            Path entitiesDir = ctx.require("entities_dir");
            EntityCatalogSnapshot catalog = loadEntityCatalogWorkflow.run(
                    new JsonFileEntityCatalog(entitiesDir),
                    ctx.require("supported_types")
            );
            ctx.put("catalog", catalog);
            return WorkflowFunctionOutput.done("load_entity_catalog");
        });

        // 2) build_article_index
        factory.register("build_article_index", (cfg, ctx) -> {
            ArticleEntityIndex index = buildArticleIndexWorkflow.run(ctx.require("catalog"));
            ctx.put("article_index", index);
            return WorkflowFunctionOutput.done("build_article_index");
        });

        // 3) accumulate_edges
        factory.register("accumulate_edges", (cfg, ctx) -> {
            List<EdgeRecord> edges = accumulateEdgesWorkflow.run(
                    ctx.require("article_index"),
                    ctx.require("type_pairs"),
                    ctx.get("parallelism")
            );
            ctx.put("edges", edges);
            return WorkflowFunctionOutput.done("accumulate_edges");
        });

        // 4) prune_edges：只在累加全部完成后执行一次
        factory.register("prune_edges", (cfg, ctx) -> {
            Integer weightMin = ctx.require("weight_min");
            List<EdgeRecord> kept = pruneEdgesWorkflow.run(ctx.require("edges"), weightMin);
            ctx.put("pruned_edges", kept);
            return WorkflowFunctionOutput.done("prune_edges");
        });

        // 5) assemble_nodes
        factory.register("assemble_nodes", (cfg, ctx) -> {
            List<NodeOutput> nodes = assembleNodesWorkflow.run(
                    ctx.require("pruned_edges"),
                    ctx.require("catalog")
            );
            ctx.put("nodes", nodes);
            return WorkflowFunctionOutput.done("assemble_nodes");
        });

        // 6) persist_snapshot
        factory.register("persist_snapshot", (cfg, ctx) -> {
            Integer weightMin = ctx.require("weight_min");
            PersistSnapshotWorkflow.Result result = persistSnapshotWorkflow.run(
                    ctx.require("nodes"),
                    ctx.require("pruned_edges"),
                    ctx.require("supported_types"),
                    weightMin,
                    ctx.require("type_pairs"),
                    ctx.require("output_file")
            );
            ctx.put("snapshot", result.getSnapshot());
            ctx.put("snapshot_location", result.getLocation());
            return WorkflowFunctionOutput.done("persist_snapshot");
        });

        List<String> networkSteps = List.of(
                "load_entity_catalog",
                "build_article_index",
                "accumulate_edges",
                "prune_edges",
                "assemble_nodes",
                "persist_snapshot"
        );

        // pipeline：只从已有的实体集合构图
        factory.registerPipeline(PIPELINE_NETWORK, networkSteps);

        // pipeline：先由 articles.json / index.json 生成实体集合，再构图
        factory.registerPipeline(PIPELINE_FULL, concat("build_entity_collections", networkSteps));
    }

    private static List<String> concat(String first, List<String> rest) {
        List<String> all = new ArrayList<>();
        all.add(first);
        all.addAll(rest);
        return all;
    }
}
