package com.gdin.explorer.network.index.workflows;

import com.gdin.explorer.network.index.EdgePruner;
import com.gdin.explorer.network.models.EdgeRecord;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class PruneEdgesWorkflow {

    @Resource
    private EdgePruner edgePruner;

    public List<EdgeRecord> run(List<EdgeRecord> edges, int weightMin) {
        List<EdgeRecord> kept = edgePruner.prune(edges, weightMin);
        log.info("剪枝完成：weightMin={}, before={}, after={}", weightMin, edges.size(), kept.size());
        if (kept.isEmpty()) {
            log.warn("剪枝后没有任何边，将写出空网络快照（totalEdges=0）");
        }
        return kept;
    }
}
