package com.gdin.explorer.network.index;

import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.EntityRecord;
import com.gdin.explorer.network.models.NodeOutput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 只保留出现在剪枝后边上的实体，degree = 关联的保留边数。排序由序列化阶段负责。
 */
@Component
public class NodeAssembler {

    public List<NodeOutput> assemble(List<EdgeRecord> prunedEdges, Map<String, EntityRecord> nodeInfoById) {
        Map<String, Integer> degree = new LinkedHashMap<>();
        for (EdgeRecord edge : prunedEdges) {
            degree.merge(edge.getSource(), 1, Integer::sum);
            degree.merge(edge.getTarget(), 1, Integer::sum);
        }

        List<NodeOutput> nodes = new ArrayList<>(degree.size());
        for (Map.Entry<String, Integer> entry : degree.entrySet()) {
            EntityRecord record = nodeInfoById.get(entry.getKey());
            if (record == null) {
                throw new IllegalStateException("edge endpoint not found in entity catalog: " + entry.getKey());
            }
            nodes.add(NodeOutput.of(record, entry.getValue()));
        }
        return nodes;
    }
}
