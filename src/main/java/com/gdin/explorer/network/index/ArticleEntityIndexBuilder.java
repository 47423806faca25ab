package com.gdin.explorer.network.index;

import com.gdin.explorer.network.models.ArticleEntityIndex;
import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.EntityType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 把 实体 -> 文章 的关系反转为 文章 -> 类型 -> 实体。
 * 没有任何文章的实体不会出现在索引中，也就不可能成为边的端点。
 */
@Component
public class ArticleEntityIndexBuilder {

    public ArticleEntityIndex build(Map<EntityType, List<EntityRecord>> catalogsByType) {
        ArticleEntityIndex index = new ArticleEntityIndex();
        if (catalogsByType == null) return index;
        for (Map.Entry<EntityType, List<EntityRecord>> entry : catalogsByType.entrySet()) {
            for (EntityRecord record : entry.getValue()) {
                for (String articleId : record.getArticleIds()) {
                    index.add(articleId, record.getType(), record.getNodeId());
                }
            }
        }
        return index;
    }
}
