package com.gdin.explorer.network.index.run;

import cn.hutool.core.io.FileUtil;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.gdin.explorer.network.config.properties.NetworkProperties;
import com.gdin.explorer.network.models.EntityType;
import com.gdin.explorer.network.models.NetworkBuildReport;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.File;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@SpringBootTest
@ActiveProfiles("test")
public class NetworkIndexRunnerTest {

    @Resource
    private NetworkIndexRunner networkIndexRunner;

    @Resource
    private NetworkProperties networkProperties;

    private JSONObject readSnapshot(NetworkBuildReport report) {
        return JSON.parseObject(FileUtil.readUtf8String(new File(report.getSnapshotLocation())));
    }

    private static List<String> column(JSONArray array, String key) {
        return array.stream().map(o -> ((JSONObject) o).getString(key)).collect(Collectors.toList());
    }

    @Test
    public void testBuildNetworkFromFixtureCollections() {
        NetworkBuildReport report = networkIndexRunner.run("network");
        log.info("report: {}", report);

        Assertions.assertEquals(5, report.getTotalNodes());
        Assertions.assertEquals(4, report.getTotalEdges());
        Assertions.assertFalse(report.isEmptyGraph());
        Assertions.assertEquals(2, report.getSkippedRecords().get(EntityType.PERSON));
        Assertions.assertEquals(EnumSet.of(EntityType.SUBJECT, EntityType.LOCATION), report.getMissingCollections());
        Assertions.assertTrue(report.getWorkflowSeconds().containsKey("persist_snapshot"));

        JSONObject snapshot = readSnapshot(report);
        JSONArray edges = snapshot.getJSONArray("edges");
        Assertions.assertEquals(List.of("event:20", "organization:10", "organization:9", "organization:9"), column(edges, "source"));
        Assertions.assertEquals(List.of("person:2", "person:2", "person:1", "person:2"), column(edges, "target"));
        Assertions.assertEquals(List.of("person-event", "person-organization", "person-organization", "person-organization"),
                column(edges, "type"));

        JSONObject first = edges.getJSONObject(2);
        Assertions.assertEquals(2, first.getIntValue("weight"));
        Assertions.assertEquals(List.of("A", "B"), first.getJSONArray("articleIds").toJavaList(String.class));

        JSONArray nodes = snapshot.getJSONArray("nodes");
        Assertions.assertEquals(List.of("person:2", "organization:9", "event:20", "organization:10", "person:1"), column(nodes, "id"));
        JSONObject top = nodes.getJSONObject(0);
        Assertions.assertEquals("Cheikh Anta Diop", top.getString("label"));
        Assertions.assertEquals("person", top.getString("type"));
        Assertions.assertEquals(3, top.getIntValue("count"));
        Assertions.assertEquals(3, top.getIntValue("degree"));

        JSONObject meta = snapshot.getJSONObject("meta");
        Assertions.assertEquals(5, meta.getIntValue("totalNodes"));
        Assertions.assertEquals(4, meta.getIntValue("totalEdges"));
        Assertions.assertEquals(2, meta.getIntValue("weightMin"));
        Assertions.assertEquals(10, meta.getJSONArray("typePairs").size());
        Assertions.assertNotNull(meta.getString("generatedAt"));
    }

    @Test
    public void testHighThresholdWritesEmptySnapshot() {
        Integer original = networkProperties.getWeightMin();
        try {
            networkProperties.setWeightMin(3);
            NetworkBuildReport report = networkIndexRunner.run("network");

            Assertions.assertTrue(report.isEmptyGraph());
            Assertions.assertEquals(0, report.getTotalNodes());
            JSONObject snapshot = readSnapshot(report);
            Assertions.assertTrue(snapshot.getJSONArray("nodes").isEmpty());
            Assertions.assertTrue(snapshot.getJSONArray("edges").isEmpty());
            Assertions.assertEquals(3, snapshot.getJSONObject("meta").getIntValue("weightMin"));
        } finally {
            networkProperties.setWeightMin(original);
        }
    }

    @Test
    public void testInvalidConfigurationRejectedBeforeBuild() {
        List<String> original = networkProperties.getTypePairs();
        try {
            networkProperties.setTypePairs(List.of("person-person"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> networkIndexRunner.run("network"));

            networkProperties.setTypePairs(List.of());
            Assertions.assertThrows(IllegalArgumentException.class, () -> networkIndexRunner.run("network"));
        } finally {
            networkProperties.setTypePairs(original);
        }
        Assertions.assertThrows(IllegalArgumentException.class, () -> networkIndexRunner.run("unknown"));
    }
}
