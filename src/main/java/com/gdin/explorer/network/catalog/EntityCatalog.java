package com.gdin.explorer.network.catalog;

import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.EntityType;

import java.util.Collection;
import java.util.List;

/**
 * 按类型加载实体集合。某个类型的集合缺失时返回空集合，不应阻止其它类型构图。
 */
public interface EntityCatalog {

    /**
     * 加载单个类型的集合，并给出跳过 / 缺失情况。
     * @throws com.gdin.explorer.network.exception.MissingSourceException 整个实体数据源不可用
     */
    CatalogLoadResult loadCollection(EntityType type);

    default List<EntityRecord> load(EntityType type) {
        return loadCollection(type).getRecords();
    }

    default EntityCatalogSnapshot loadAll(Collection<EntityType> types) {
        EntityCatalogSnapshot snapshot = new EntityCatalogSnapshot();
        for (EntityType type : types) {
            snapshot.add(loadCollection(type));
        }
        return snapshot;
    }
}
