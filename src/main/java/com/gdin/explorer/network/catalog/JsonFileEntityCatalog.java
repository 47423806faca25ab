package com.gdin.explorer.network.catalog;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.IORuntimeException;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.explorer.network.exception.MalformedRecordException;
import com.gdin.explorer.network.exception.MissingSourceException;
import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.EntityType;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 从实体目录读取 {type}s.json（persons.json, organizations.json ...）。
 */
@Slf4j
public class JsonFileEntityCatalog implements EntityCatalog {

    private final Path entitiesDir;
    private final EntityRecordParser parser;

    public JsonFileEntityCatalog(Path entitiesDir) {
        this(entitiesDir, new EntityRecordParser());
    }

    public JsonFileEntityCatalog(Path entitiesDir, EntityRecordParser parser) {
        this.entitiesDir = entitiesDir;
        this.parser = parser;
    }

    @Override
    public CatalogLoadResult loadCollection(EntityType type) {
        if (entitiesDir == null || !Files.isDirectory(entitiesDir)) {
            throw new MissingSourceException(String.valueOf(entitiesDir), "entities directory not found");
        }

        File file = entitiesDir.resolve(type.getFileName()).toFile();
        if (!file.isFile()) {
            log.warn("实体集合缺失，按空集合处理：type={}, file={}", type.getTag(), file);
            return CatalogLoadResult.missing(type);
        }

        JSONArray array;
        try {
            array = JSON.parseArray(FileUtil.readUtf8String(file));
        } catch (JSONException | IORuntimeException e) {
            log.warn("实体集合不可读，按空集合处理：type={}, file={}, reason={}", type.getTag(), file, e.getMessage());
            return CatalogLoadResult.missing(type);
        }
        if (array == null) {
            log.warn("实体集合为空文件，按空集合处理：type={}, file={}", type.getTag(), file);
            return CatalogLoadResult.missing(type);
        }

        List<EntityRecord> records = new ArrayList<>(array.size());
        Set<String> seenNodeIds = new HashSet<>();
        int skipped = 0;
        for (int i = 0; i < array.size(); i++) {
            Object raw = array.get(i);
            try {
                if (!(raw instanceof JSONObject)) throw new MalformedRecordException("record is not an object");
                EntityRecord record = parser.parse(type, (JSONObject) raw);
                if (!seenNodeIds.add(record.getNodeId())) {
                    throw new MalformedRecordException("duplicated id " + record.getNodeId());
                }
                records.add(record);
            } catch (MalformedRecordException e) {
                skipped++;
                log.debug("跳过异常实体记录：type={}, index={}, reason={}", type.getTag(), i, e.getMessage());
            }
        }

        if (skipped > 0) {
            log.warn("实体集合存在异常记录：type={}, skipped={}", type.getTag(), skipped);
        }
        log.info("加载实体集合：type={}, records={}, skipped={}", type.getTag(), records.size(), skipped);

        return CatalogLoadResult.builder()
                .type(type)
                .records(records)
                .skipped(skipped)
                .missing(false)
                .build();
    }
}
