package com.gdin.explorer.network.index;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.EntityType;
import com.gdin.explorer.network.models.GraphSnapshot;
import com.gdin.explorer.network.models.NodeOutput;
import com.gdin.explorer.network.models.TypePair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

public class GraphSnapshotSerializerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-01-15T10:30:00Z"), ZoneOffset.UTC);
    private final GraphSnapshotSerializer serializer = new GraphSnapshotSerializer(clock);

    private static NodeOutput node(String id, int degree) {
        return NodeOutput.builder()
                .id(id)
                .type(id.substring(0, id.indexOf(':')))
                .label(id.toUpperCase())
                .count(5)
                .degree(degree)
                .build();
    }

    private static EdgeRecord edge(String source, String target) {
        return EdgeRecord.builder()
                .source(source)
                .target(target)
                .relationType("person-organization")
                .weight(1)
                .articleIds(List.of("A"))
                .build();
    }

    private final List<TypePair> typePairs = TypePair.parseAll(List.of("person-organization", "person-event"));
    private final List<EntityType> supportedTypes = List.of(EntityType.PERSON, EntityType.ORGANIZATION, EntityType.EVENT);

    @Test
    public void testOrdering() {
        GraphSnapshot snapshot = serializer.toSnapshot(
                List.of(node("person:2", 1), node("organization:9", 3), node("event:4", 1), node("person:1", 3)),
                List.of(edge("organization:9", "person:2"), edge("event:4", "person:1"), edge("organization:9", "person:1")),
                supportedTypes, 2, typePairs);

        Assertions.assertEquals(List.of("organization:9", "person:1", "event:4", "person:2"),
                snapshot.getNodes().stream().map(NodeOutput::getId).collect(Collectors.toList()));
        Assertions.assertEquals(List.of("event:4", "organization:9", "organization:9"),
                snapshot.getEdges().stream().map(EdgeRecord::getSource).collect(Collectors.toList()));
        Assertions.assertEquals("person:1", snapshot.getEdges().get(1).getTarget());

        GraphSnapshot.Meta meta = snapshot.getMeta();
        Assertions.assertEquals("2025-01-15T10:30:00Z", meta.getGeneratedAt());
        Assertions.assertEquals(4, meta.getTotalNodes());
        Assertions.assertEquals(3, meta.getTotalEdges());
        Assertions.assertEquals(2, meta.getWeightMin());
        Assertions.assertEquals(List.of("person", "organization", "event"), meta.getSupportedTypes());
        Assertions.assertEquals(List.of(List.of("person", "organization"), List.of("person", "event")), meta.getTypePairs());
    }

    @Test
    public void testSerializedLayout() throws Exception {
        GraphSnapshot snapshot = serializer.toSnapshot(
                List.of(node("organization:9", 1), node("person:1", 1)),
                List.of(edge("organization:9", "person:1")),
                supportedTypes, 2, typePairs);

        String json = serializer.serialize(snapshot);
        JSONObject parsed = JSON.parseObject(json);

        Assertions.assertEquals(List.of("nodes", "edges", "meta"), List.copyOf(parsed.keySet()));
        JSONObject edge = parsed.getJSONArray("edges").getJSONObject(0);
        Assertions.assertEquals("person-organization", edge.getString("type"));
        Assertions.assertFalse(edge.containsKey("relationType"));
        Assertions.assertFalse(edge.containsKey("key"));
        Assertions.assertEquals(List.of("id", "type", "label", "count", "degree"),
                List.copyOf(parsed.getJSONArray("nodes").getJSONObject(0).keySet()));
    }

    @Test
    public void testSameInputSameBytes() throws Exception {
        List<NodeOutput> nodes = List.of(node("person:1", 1), node("organization:9", 1));
        List<EdgeRecord> edges = List.of(edge("organization:9", "person:1"));

        String first = serializer.serialize(serializer.toSnapshot(nodes, edges, supportedTypes, 2, typePairs));
        String second = serializer.serialize(serializer.toSnapshot(
                List.of(nodes.get(1), nodes.get(0)), edges, supportedTypes, 2, typePairs));

        Assertions.assertEquals(first, second);
    }

    @Test
    public void testEmptyGraphStillHasMeta() throws Exception {
        GraphSnapshot snapshot = serializer.toSnapshot(List.of(), List.of(), supportedTypes, 5, typePairs);
        JSONObject parsed = JSON.parseObject(serializer.serialize(snapshot));

        Assertions.assertTrue(parsed.getJSONArray("nodes").isEmpty());
        Assertions.assertTrue(parsed.getJSONArray("edges").isEmpty());
        Assertions.assertEquals(0, parsed.getJSONObject("meta").getIntValue("totalEdges"));
        Assertions.assertEquals(5, parsed.getJSONObject("meta").getIntValue("weightMin"));
    }
}
