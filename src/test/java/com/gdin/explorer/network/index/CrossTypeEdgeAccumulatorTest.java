package com.gdin.explorer.network.index;

import com.gdin.explorer.network.models.ArticleEntityIndex;
import com.gdin.explorer.network.models.EdgeKey;
import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.EntityType;
import com.gdin.explorer.network.models.TypePair;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class CrossTypeEdgeAccumulatorTest {

    private final ArticleEntityIndexBuilder indexBuilder = new ArticleEntityIndexBuilder();
    private final CrossTypeEdgeAccumulator accumulator = new CrossTypeEdgeAccumulator();
    private final EdgePruner pruner = new EdgePruner();

    static EntityRecord record(EntityType type, String id, String label, String... articleIds) {
        return EntityRecord.builder()
                .nodeId(type.nodeId(id))
                .type(type)
                .label(label)
                .declaredCount(articleIds.length)
                .articleIds(List.of(articleIds))
                .build();
    }

    private ArticleEntityIndex index(EntityRecord... records) {
        Map<EntityType, List<EntityRecord>> byType = new EnumMap<>(EntityType.class);
        for (EntityRecord r : records) {
            byType.computeIfAbsent(r.getType(), k -> new ArrayList<>()).add(r);
        }
        return indexBuilder.build(byType);
    }

    @Test
    public void testPersonOrganizationCooccurrence() {
        ArticleEntityIndex index = index(
                record(EntityType.PERSON, "1", "P1", "A", "B"),
                record(EntityType.ORGANIZATION, "9", "O9", "A", "B", "C")
        );

        List<EdgeRecord> edges = accumulator
                .accumulate(index, TypePair.parseAll(List.of("person-organization")))
                .toEdgeRecords();

        Assertions.assertEquals(1, edges.size());
        EdgeRecord edge = edges.get(0);
        // "organization:9" < "person:1"
        Assertions.assertEquals("organization:9", edge.getSource());
        Assertions.assertEquals("person:1", edge.getTarget());
        Assertions.assertEquals("person-organization", edge.getRelationType());
        Assertions.assertEquals(2, edge.getWeight());
        Assertions.assertEquals(List.of("A", "B"), edge.getArticleIds());

        Assertions.assertEquals(1, pruner.prune(edges, 2).size());
        Assertions.assertTrue(pruner.prune(edges, 3).isEmpty());
    }

    @Test
    public void testCartesianProductWithinOneArticle() {
        ArticleEntityIndex index = index(
                record(EntityType.PERSON, "1", "P1", "X"),
                record(EntityType.PERSON, "2", "P2", "X"),
                record(EntityType.LOCATION, "5", "L5", "X")
        );

        List<EdgeRecord> edges = accumulator
                .accumulate(index, TypePair.parseAll(List.of("person-location")))
                .toEdgeRecords();

        Assertions.assertEquals(2, edges.size());
        Assertions.assertEquals(EdgeKey.of("location:5", "person:1"), edges.get(0).getKey());
        Assertions.assertEquals(EdgeKey.of("location:5", "person:2"), edges.get(1).getKey());
        edges.forEach(e -> {
            Assertions.assertEquals(1, e.getWeight());
            Assertions.assertEquals(List.of("X"), e.getArticleIds());
        });
    }

    @Test
    public void testSameTypeEntitiesAreNeverLinked() {
        ArticleEntityIndex index = index(
                record(EntityType.PERSON, "1", "P1", "A", "B"),
                record(EntityType.PERSON, "2", "P2", "A", "B")
        );

        EdgeAccumulator acc = accumulator.accumulate(index, TypePair.parseAll(List.of(
                "person-organization", "person-event", "person-location")));

        Assertions.assertEquals(0, acc.size());
    }

    @Test
    public void testReversedRulesCountArticleOnce() {
        // 两条方向相反的规则会在同一篇文章里产生同一条边
        ArticleEntityIndex index = index(
                record(EntityType.PERSON, "1", "P1", "A"),
                record(EntityType.ORGANIZATION, "9", "O9", "A")
        );

        List<EdgeRecord> edges = accumulator
                .accumulate(index, TypePair.parseAll(List.of("organization-person", "person-organization")))
                .toEdgeRecords();

        Assertions.assertEquals(1, edges.size());
        Assertions.assertEquals(1, edges.get(0).getWeight());
        Assertions.assertEquals(List.of("A"), edges.get(0).getArticleIds());
        // 配置中靠前的规则决定 type
        Assertions.assertEquals("organization-person", edges.get(0).getRelationType());
    }

    @Test
    public void testWeightEqualsDistinctArticleCount() {
        ArticleEntityIndex index = index(
                record(EntityType.PERSON, "1", "P1", "A", "B", "C", "D"),
                record(EntityType.PERSON, "2", "P2", "B", "D"),
                record(EntityType.EVENT, "7", "E7", "A", "D"),
                record(EntityType.SUBJECT, "3", "S3", "C", "D"),
                record(EntityType.ORGANIZATION, "9", "O9", "A", "B", "D")
        );

        List<EdgeRecord> edges = accumulator
                .accumulate(index, TypePair.parseAll(List.of(
                        "person-organization", "person-event", "person-subject",
                        "organization-event", "organization-subject", "event-subject")))
                .toEdgeRecords();

        Assertions.assertFalse(edges.isEmpty());
        for (EdgeRecord edge : edges) {
            Assertions.assertTrue(edge.getSource().compareTo(edge.getTarget()) < 0, edge.getSource() + " / " + edge.getTarget());
            Assertions.assertEquals(edge.getArticleIds().size(), edge.getWeight());
            Assertions.assertEquals(edge.getArticleIds().size(), Set.copyOf(edge.getArticleIds()).size());
        }
        Assertions.assertEquals(edges.size(), edges.stream().map(EdgeRecord::getKey).distinct().count());
    }

    @Test
    public void testEntityWithoutArticlesProducesNoEdge() {
        ArticleEntityIndex index = index(
                record(EntityType.PERSON, "1", "P1"),
                record(EntityType.ORGANIZATION, "9", "O9", "A")
        );

        Assertions.assertEquals(1, index.size());
        Assertions.assertEquals(0, accumulator.accumulate(index, TypePair.parseAll(List.of("person-organization"))).size());
    }

    @Test
    public void testParallelMatchesSequential() {
        List<EntityRecord> records = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            records.add(record(EntityType.PERSON, String.valueOf(i), "P" + i,
                    "a" + (i % 17), "a" + (i % 11), "a" + (i % 5)));
            records.add(record(EntityType.LOCATION, String.valueOf(i), "L" + i,
                    "a" + (i % 13), "a" + (i % 7)));
            records.add(record(EntityType.EVENT, String.valueOf(i), "E" + i, "a" + (i % 3)));
        }
        ArticleEntityIndex index = index(records.toArray(new EntityRecord[0]));
        List<TypePair> rules = TypePair.parseAll(List.of("person-location", "person-event", "event-location"));

        List<EdgeRecord> sequential = accumulator.accumulate(index, rules, 1).toEdgeRecords();
        List<EdgeRecord> parallel = accumulator.accumulate(index, rules, 4).toEdgeRecords();

        log.info("sequential edges={}", sequential.size());
        Assertions.assertEquals(sequential, parallel);
    }

    @Test
    public void testEmptyRulesOrIndex() {
        Assertions.assertEquals(0, accumulator.accumulate(new ArticleEntityIndex(), TypePair.parseAll(List.of("person-event"))).size());
        Assertions.assertEquals(0, accumulator.accumulate(index(record(EntityType.PERSON, "1", "P1", "A")), List.of()).size());
    }
}
