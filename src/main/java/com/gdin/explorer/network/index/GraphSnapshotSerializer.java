package com.gdin.explorer.network.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.EntityType;
import com.gdin.explorer.network.models.GraphSnapshot;
import com.gdin.explorer.network.models.NodeOutput;
import com.gdin.explorer.network.models.TypePair;
import com.gdin.explorer.network.util.IOUtil;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 生成排序稳定的快照。除 meta.generatedAt 外，相同输入的输出逐字节一致。
 */
@Component
public class GraphSnapshotSerializer {

    public static final Comparator<NodeOutput> NODE_ORDER = Comparator
            .comparingInt(NodeOutput::getDegree).reversed()
            .thenComparing(NodeOutput::getId);

    public static final Comparator<EdgeRecord> EDGE_ORDER = Comparator
            .comparing(EdgeRecord::getSource)
            .thenComparing(EdgeRecord::getTarget);

    private final Clock clock;

    public GraphSnapshotSerializer(Clock clock) {
        this.clock = clock;
    }

    public GraphSnapshot toSnapshot(
            List<NodeOutput> nodes,
            List<EdgeRecord> edges,
            List<EntityType> supportedTypes,
            int weightMin,
            List<TypePair> typePairs
    ) {
        List<NodeOutput> sortedNodes = nodes.stream().sorted(NODE_ORDER).collect(Collectors.toList());
        List<EdgeRecord> sortedEdges = edges.stream().sorted(EDGE_ORDER).collect(Collectors.toList());

        GraphSnapshot.Meta meta = GraphSnapshot.Meta.builder()
                .generatedAt(Instant.now(clock).toString())
                .totalNodes(sortedNodes.size())
                .totalEdges(sortedEdges.size())
                .supportedTypes(supportedTypes.stream().map(EntityType::getTag).collect(Collectors.toList()))
                .weightMin(weightMin)
                .typePairs(typePairs.stream().map(TypePair::toList).collect(Collectors.toList()))
                .build();

        return GraphSnapshot.builder()
                .nodes(sortedNodes)
                .edges(sortedEdges)
                .meta(meta)
                .build();
    }

    public String serialize(GraphSnapshot snapshot) throws JsonProcessingException {
        return IOUtil.jsonSerializeWithNoType(snapshot, true);
    }
}
