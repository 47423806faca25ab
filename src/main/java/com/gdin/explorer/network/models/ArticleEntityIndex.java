package com.gdin.explorer.network.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * articleId -> (type -> nodeIds)。
 * 文章按 id 升序遍历，桶内 nodeId 升序，保证后续累加顺序稳定。
 */
public class ArticleEntityIndex {

    private final TreeMap<String, EnumMap<EntityType, SortedSet<String>>> buckets = new TreeMap<>();

    public void add(String articleId, EntityType type, String nodeId) {
        buckets.computeIfAbsent(articleId, k -> new EnumMap<>(EntityType.class))
                .computeIfAbsent(type, k -> new TreeSet<>())
                .add(nodeId);
    }

    public List<String> articleIds() {
        return new ArrayList<>(buckets.keySet());
    }

    public Set<String> nodes(String articleId, EntityType type) {
        Map<EntityType, SortedSet<String>> byType = buckets.get(articleId);
        if (byType == null) return Collections.emptySet();
        SortedSet<String> nodes = byType.get(type);
        return nodes == null ? Collections.emptySet() : Collections.unmodifiableSet(nodes);
    }

    public int size() {
        return buckets.size();
    }

    public long associationCount() {
        return buckets.values().stream()
                .flatMap(m -> m.values().stream())
                .mapToLong(Set::size)
                .sum();
    }
}
