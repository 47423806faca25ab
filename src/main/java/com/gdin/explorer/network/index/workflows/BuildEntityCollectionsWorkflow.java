package com.gdin.explorer.network.index.workflows;

import com.gdin.explorer.network.index.EntityCollectionBuilder;
import com.gdin.explorer.network.models.EntityType;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;

/**
 * 输入：articles.json, index.json
 * 输出：entities 目录下各类型集合文件
 */
@Slf4j
@Service
public class BuildEntityCollectionsWorkflow {

    @Resource
    private EntityCollectionBuilder entityCollectionBuilder;

    public Map<EntityType, Integer> run(Path articlesFile, Path indexFile, Path entitiesDir) throws Exception {
        log.info(
                "开始生成实体集合：articles={}, index={}, entitiesDir={}",
                articlesFile,
                indexFile,
                entitiesDir
        );
        Map<EntityType, Integer> counts = entityCollectionBuilder.build(articlesFile, indexFile, entitiesDir);
        log.info("实体集合生成完成：{}", counts);
        return counts;
    }
}
