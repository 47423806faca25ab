package com.gdin.explorer.network.index.workflows;

import com.gdin.explorer.network.index.GraphSnapshotSerializer;
import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.EntityType;
import com.gdin.explorer.network.models.GraphSnapshot;
import com.gdin.explorer.network.models.NodeOutput;
import com.gdin.explorer.network.models.TypePair;
import com.gdin.explorer.network.storage.SnapshotStorage;
import jakarta.annotation.Resource;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class PersistSnapshotWorkflow {

    @Resource
    private GraphSnapshotSerializer graphSnapshotSerializer;

    @Resource
    private SnapshotStorage snapshotStorage;

    @Value
    public static class Result {
        GraphSnapshot snapshot;
        String location;
    }

    public Result run(
            List<NodeOutput> nodes,
            List<EdgeRecord> edges,
            List<EntityType> supportedTypes,
            int weightMin,
            List<TypePair> typePairs,
            String outputFile
    ) throws Exception {
        GraphSnapshot snapshot = graphSnapshotSerializer.toSnapshot(nodes, edges, supportedTypes, weightMin, typePairs);
        String location = snapshotStorage.save(outputFile, graphSnapshotSerializer.serialize(snapshot));
        log.info(
                "保存网络快照：nodes={}, edges={}, file={}",
                snapshot.getMeta().getTotalNodes(),
                snapshot.getMeta().getTotalEdges(),
                location
        );
        return new Result(snapshot, location);
    }
}
