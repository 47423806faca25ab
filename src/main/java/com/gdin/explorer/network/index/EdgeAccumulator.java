package com.gdin.explorer.network.index;

import com.gdin.explorer.network.models.EdgeKey;
import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.TypePair;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 边累加状态，按规范化边键聚合。
 * 每条边维护已见文章集合，同一篇文章对同一条边只计一次，weight 恒等于文章数。
 */
public class EdgeAccumulator {

    private final Map<EdgeKey, Accumulation> edges = new LinkedHashMap<>();

    /**
     * 记录 key 在 articleId 中的一次共现。
     * @param ruleIndex 产生该共现的规则在配置中的下标，下标最小的规则决定边的 type
     */
    public void record(EdgeKey key, int ruleIndex, TypePair rule, String articleId) {
        Accumulation acc = edges.computeIfAbsent(key, k -> new Accumulation(ruleIndex, rule.getLabel()));
        acc.preferRule(ruleIndex, rule.getLabel());
        acc.articleIds.add(articleId);
    }

    /**
     * 合并另一段文章范围的累加结果。按文章顺序依次合并时，articleIds 的首见顺序与单线程一致。
     */
    public EdgeAccumulator merge(EdgeAccumulator other) {
        for (Map.Entry<EdgeKey, Accumulation> entry : other.edges.entrySet()) {
            Accumulation theirs = entry.getValue();
            Accumulation mine = edges.computeIfAbsent(entry.getKey(), k -> new Accumulation(theirs.ruleIndex, theirs.relationType));
            mine.preferRule(theirs.ruleIndex, theirs.relationType);
            mine.articleIds.addAll(theirs.articleIds);
        }
        return this;
    }

    public int size() {
        return edges.size();
    }

    /**
     * 按 (source, target) 升序输出。
     */
    public List<EdgeRecord> toEdgeRecords() {
        List<EdgeRecord> out = new ArrayList<>(edges.size());
        edges.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> out.add(EdgeRecord.builder()
                        .source(e.getKey().getSource())
                        .target(e.getKey().getTarget())
                        .relationType(e.getValue().relationType)
                        .weight(e.getValue().articleIds.size())
                        .articleIds(List.copyOf(e.getValue().articleIds))
                        .build()));
        return out;
    }

    private static class Accumulation {
        private int ruleIndex;
        private String relationType;
        private final Set<String> articleIds = new LinkedHashSet<>();

        private Accumulation(int ruleIndex, String relationType) {
            this.ruleIndex = ruleIndex;
            this.relationType = relationType;
        }

        private void preferRule(int index, String label) {
            if (index < ruleIndex) {
                ruleIndex = index;
                relationType = label;
            }
        }
    }
}
