package com.gdin.explorer.network.catalog;

import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.EntityType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 简单的内存实现。仅用于测试/本地开发。未放入的类型视为缺失。
 */
public class InMemoryEntityCatalog implements EntityCatalog {

    private final Map<EntityType, List<EntityRecord>> collections = new EnumMap<>(EntityType.class);

    public InMemoryEntityCatalog put(EntityType type, List<EntityRecord> records) {
        collections.put(type, new ArrayList<>(records));
        return this;
    }

    @Override
    public CatalogLoadResult loadCollection(EntityType type) {
        List<EntityRecord> records = collections.get(type);
        if (records == null) return CatalogLoadResult.missing(type);
        return CatalogLoadResult.builder()
                .type(type)
                .records(List.copyOf(records))
                .skipped(0)
                .missing(false)
                .build();
    }
}
