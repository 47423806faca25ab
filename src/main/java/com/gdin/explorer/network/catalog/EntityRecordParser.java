package com.gdin.explorer.network.catalog;

import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.explorer.network.exception.MalformedRecordException;
import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.EntityType;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 把实体集合中的一条原始 JSON 记录校验并转换为 {@link EntityRecord}。
 * 输入字段：id, name, relatedArticleIds, articleCount(可选)。
 */
public class EntityRecordParser {

    public static final String KEY_ID = "id";
    public static final String KEY_NAME = "name";
    public static final String KEY_RELATED_ARTICLE_IDS = "relatedArticleIds";
    public static final String KEY_ARTICLE_COUNT = "articleCount";

    public EntityRecord parse(EntityType type, JSONObject raw) {
        if (raw == null) throw new MalformedRecordException("record is null");

        String id = readId(raw.get(KEY_ID));
        Object name = raw.get(KEY_NAME);
        if (!(name instanceof String) || StrUtil.isBlank((String) name)) {
            throw new MalformedRecordException("missing name for id " + id);
        }

        Set<String> articleIds = readArticleIds(id, raw.get(KEY_RELATED_ARTICLE_IDS));
        int declaredCount = readDeclaredCount(id, raw.get(KEY_ARTICLE_COUNT), articleIds.size());

        return EntityRecord.builder()
                .nodeId(type.nodeId(id))
                .type(type)
                .label((String) name)
                .declaredCount(declaredCount)
                .articleIds(articleIds)
                .build();
    }

    private String readId(Object value) {
        if (value instanceof String && StrUtil.isNotBlank((String) value)) return ((String) value).trim();
        if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) return value.toString();
        throw new MalformedRecordException("missing or invalid id: " + value);
    }

    private Set<String> readArticleIds(String id, Object value) {
        Set<String> articleIds = new LinkedHashSet<>();
        if (value == null) return articleIds;
        if (!(value instanceof List)) {
            throw new MalformedRecordException("relatedArticleIds is not an array for id " + id);
        }
        for (Object articleId : (List<?>) value) {
            if (!(articleId instanceof String) || StrUtil.isBlank((String) articleId)) {
                throw new MalformedRecordException("non-string article id " + articleId + " for id " + id);
            }
            articleIds.add(((String) articleId).trim());
        }
        return articleIds;
    }

    private int readDeclaredCount(String id, Object value, int fallback) {
        if (value == null) return fallback;
        if (value instanceof Integer || value instanceof Long) {
            long count = ((Number) value).longValue();
            if (count >= 0 && count <= Integer.MAX_VALUE) return (int) count;
        }
        throw new MalformedRecordException("invalid articleCount " + value + " for id " + id);
    }
}
