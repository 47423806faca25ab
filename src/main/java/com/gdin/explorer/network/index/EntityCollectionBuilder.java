package com.gdin.explorer.network.index;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.util.ReUtil;
import cn.hutool.core.util.StrUtil;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.explorer.network.exception.MissingSourceException;
import com.gdin.explorer.network.models.EntityType;
import com.gdin.explorer.network.storage.SnapshotStorage;
import com.gdin.explorer.network.util.IOUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 由导出的 articles.json + index.json 生成各类型实体集合文件：
 *
 * 1. 按文章的 subject（竖线分隔）建立 实体名 -> 文章 id 映射；
 * 2. 遍历 index.json，按 Type 归类，关联不到任何文章的实体丢弃；
 * 3. 地点额外带上 coordinates / country / coordinatesRaw；
 * 4. 每个集合按 name 排序后写出。
 */
@Slf4j
@Component
public class EntityCollectionBuilder {

    private static final String KEY_ARTICLE_ID = "o:id";
    private static final String KEY_SUBJECT = "subject";
    private static final String KEY_TYPE = "Type";
    private static final String KEY_TITLE = "Titre";
    private static final String KEY_COORDINATES = "Coordonnées";
    private static final String KEY_COUNTRY = "Country";

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final SnapshotStorage storage;

    public EntityCollectionBuilder(SnapshotStorage storage) {
        this.storage = storage;
    }

    public Map<EntityType, Integer> build(Path articlesFile, Path indexFile, Path entitiesDir) throws IOException {
        JSONArray articles = readRequiredArray(articlesFile);
        JSONArray indexEntries = readRequiredArray(indexFile);
        log.info("Loaded {} articles and {} index entries", articles.size(), indexEntries.size());

        Map<String, Set<String>> entityArticles = buildEntityArticleMap(articles);
        log.info("Found {} unique entities mentioned across articles", entityArticles.size());

        Map<EntityType, List<JSONObject>> byType = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) byType.put(type, new ArrayList<>());

        for (int i = 0; i < indexEntries.size(); i++) {
            JSONObject entry = indexEntries.getJSONObject(i);
            if (entry == null) continue;
            Optional<EntityType> type = EntityType.fromIndexLabel(entry.getString(KEY_TYPE));
            if (type.isEmpty()) continue;

            String name = StrUtil.nullToEmpty(entry.getString(KEY_TITLE));
            Set<String> related = entityArticles.get(name);
            if (related == null || related.isEmpty()) continue;

            JSONObject record = new JSONObject();
            record.put("id", StrUtil.nullToEmpty(entry.getString(KEY_ARTICLE_ID)));
            record.put("name", name);
            record.put("relatedArticleIds", new ArrayList<>(related));
            record.put("articleCount", related.size());
            if (type.get() == EntityType.LOCATION) {
                String coordinatesRaw = StrUtil.trimToEmpty(entry.getString(KEY_COORDINATES));
                String country = StrUtil.trimToEmpty(entry.getString(KEY_COUNTRY));
                record.put("coordinates", parseCoordinates(coordinatesRaw).orElse(null));
                record.put("country", StrUtil.emptyToNull(country));
                record.put("coordinatesRaw", coordinatesRaw);
            }
            byType.get(type.get()).add(record);
        }

        Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
        for (Map.Entry<EntityType, List<JSONObject>> entry : byType.entrySet()) {
            List<JSONObject> entities = entry.getValue();
            entities.sort(Comparator.comparing((JSONObject o) -> o.getString("name")));
            Path out = entitiesDir.resolve(entry.getKey().getFileName());
            storage.save(out.toString(), IOUtil.jsonSerializeWithNoType(entities, true));
            counts.put(entry.getKey(), entities.size());
            log.info("Saved {} {} -> {}", entities.size(), entry.getKey().getCollectionName(), out);
        }
        return counts;
    }

    private Map<String, Set<String>> buildEntityArticleMap(JSONArray articles) {
        Map<String, Set<String>> entityArticles = new HashMap<>();
        for (int i = 0; i < articles.size(); i++) {
            JSONObject article = articles.getJSONObject(i);
            if (article == null) continue;
            String articleId = StrUtil.nullToEmpty(article.getString(KEY_ARTICLE_ID));
            String subjects = article.getString(KEY_SUBJECT);
            if (StrUtil.isBlank(subjects)) continue;
            for (String subject : StrUtil.splitTrim(subjects, '|')) {
                entityArticles.computeIfAbsent(subject, k -> new TreeSet<>()).add(articleId);
            }
        }
        return entityArticles;
    }

    private JSONArray readRequiredArray(Path path) {
        File file = path == null ? null : path.toFile();
        if (file == null || !file.isFile()) {
            throw new MissingSourceException(String.valueOf(path), "required data source not found");
        }
        try {
            JSONArray array = JSON.parseArray(FileUtil.readUtf8String(file));
            if (array == null) throw new MissingSourceException(path.toString(), "required data source is empty");
            return array;
        } catch (JSONException | IORuntimeException e) {
            throw new MissingSourceException(path.toString(), "required data source is unreadable", e);
        }
    }

    /**
     * 解析 "(lat, lng)" / "[lat, lng]" / "lat, lng"。
     * 只接受普通十进制数（不接受 NaN、十六进制、d/f 后缀），超出经纬度范围返回空。
     */
    static Optional<List<Double>> parseCoordinates(String raw) {
        if (StrUtil.isBlank(raw)) return Optional.empty();
        String cleaned = StrUtil.removeAll(raw, '(', ')', '[', ']').trim();
        List<String> parts = StrUtil.split(cleaned, ',', true, false);
        if (parts.size() < 2) return Optional.empty();
        if (!ReUtil.isMatch(DECIMAL, parts.get(0)) || !ReUtil.isMatch(DECIMAL, parts.get(1))) return Optional.empty();

        double lat = Double.parseDouble(parts.get(0));
        double lng = Double.parseDouble(parts.get(1));
        if (!(lat >= -90 && lat <= 90 && lng >= -180 && lng <= 180)) return Optional.empty();
        return Optional.of(List.of(lat, lng));
    }
}
