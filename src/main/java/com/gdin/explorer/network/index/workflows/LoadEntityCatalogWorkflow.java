package com.gdin.explorer.network.index.workflows;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.explorer.network.catalog.EntityCatalog;
import com.gdin.explorer.network.catalog.EntityCatalogSnapshot;
import com.gdin.explorer.network.models.EntityType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class LoadEntityCatalogWorkflow {

    public EntityCatalogSnapshot run(EntityCatalog catalog, List<EntityType> supportedTypes) {
        if (catalog == null) throw new IllegalStateException("catalog 不能为空");
        if (CollectionUtil.isEmpty(supportedTypes)) throw new IllegalStateException("supportedTypes 不能为空");

        EntityCatalogSnapshot snapshot = catalog.loadAll(supportedTypes);

        if (!snapshot.getMissingTypes().isEmpty()) {
            log.warn("部分实体集合缺失，图将只覆盖其余类型：missing={}", snapshot.getMissingTypes());
        }
        log.info(
                "实体加载完成：records={}, skipped={}, missing={}",
                snapshot.totalRecords(),
                snapshot.totalSkipped(),
                snapshot.getMissingTypes().size()
        );
        return snapshot;
    }
}
