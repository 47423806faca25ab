package com.gdin.explorer.network.index.workflows;

import com.gdin.explorer.network.catalog.EntityCatalogSnapshot;
import com.gdin.explorer.network.index.ArticleEntityIndexBuilder;
import com.gdin.explorer.network.models.ArticleEntityIndex;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class BuildArticleIndexWorkflow {

    @Resource
    private ArticleEntityIndexBuilder articleEntityIndexBuilder;

    public ArticleEntityIndex run(EntityCatalogSnapshot catalog) {
        ArticleEntityIndex index = articleEntityIndexBuilder.build(catalog.getRecordsByType());
        log.info("文章索引构建完成：articles={}, associations={}", index.size(), index.associationCount());
        return index;
    }
}
