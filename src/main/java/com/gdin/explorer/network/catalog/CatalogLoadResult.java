package com.gdin.explorer.network.catalog;

import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.EntityType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CatalogLoadResult {
    EntityType type;
    List<EntityRecord> records;
    // 未通过校验或重复 id 被跳过的记录数
    int skipped;
    // 集合文件缺失或不可读，按空集合处理
    boolean missing;

    public static CatalogLoadResult missing(EntityType type) {
        return CatalogLoadResult.builder()
                .type(type)
                .records(List.of())
                .skipped(0)
                .missing(true)
                .build();
    }
}
