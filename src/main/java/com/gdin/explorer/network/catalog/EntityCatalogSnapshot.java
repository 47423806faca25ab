package com.gdin.explorer.network.catalog;

import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.EntityType;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次构建中加载到内存的全部实体集合，外加每个类型的加载情况。
 */
@Getter
public class EntityCatalogSnapshot {

    private final Map<EntityType, List<EntityRecord>> recordsByType = new EnumMap<>(EntityType.class);
    private final Map<EntityType, Integer> skippedRecords = new EnumMap<>(EntityType.class);
    private final Set<EntityType> missingTypes = EnumSet.noneOf(EntityType.class);

    public void add(CatalogLoadResult result) {
        recordsByType.put(result.getType(), result.getRecords());
        skippedRecords.put(result.getType(), result.getSkipped());
        if (result.isMissing()) missingTypes.add(result.getType());
    }

    public List<EntityRecord> records(EntityType type) {
        return recordsByType.getOrDefault(type, Collections.emptyList());
    }

    /**
     * nodeId -> 记录，供节点组装阶段查找 label / count。
     */
    public Map<String, EntityRecord> recordsByNodeId() {
        Map<String, EntityRecord> byId = new LinkedHashMap<>();
        recordsByType.values().forEach(list -> list.forEach(r -> byId.put(r.getNodeId(), r)));
        return byId;
    }

    public int totalRecords() {
        return recordsByType.values().stream().mapToInt(List::size).sum();
    }

    public int totalSkipped() {
        return skippedRecords.values().stream().mapToInt(Integer::intValue).sum();
    }
}
