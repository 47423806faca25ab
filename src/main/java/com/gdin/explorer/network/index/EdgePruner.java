package com.gdin.explorer.network.index;

import com.gdin.explorer.network.models.EdgeRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 在累加完成后一次性剪掉 weight < weightMin 的边。
 */
@Component
public class EdgePruner {

    public List<EdgeRecord> prune(List<EdgeRecord> edges, int weightMin) {
        if (weightMin < 0) throw new IllegalArgumentException("weightMin must be >= 0: " + weightMin);
        if (edges == null) return List.of();
        return edges.stream()
                .filter(e -> e.getWeight() >= weightMin)
                .collect(Collectors.toList());
    }
}
