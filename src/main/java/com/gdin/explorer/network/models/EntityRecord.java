package com.gdin.explorer.network.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * 已校验的实体记录。articleIds 为权威数据，保持插入顺序且不重复。
 */
@Value
@Builder
public class EntityRecord {
    @NonNull
    String nodeId;

    @NonNull
    EntityType type;

    @NonNull
    String label;

    int declaredCount;

    @Singular
    Set<String> articleIds;
}
