package com.gdin.explorer.network.index.workflows;

import com.gdin.explorer.network.catalog.EntityCatalogSnapshot;
import com.gdin.explorer.network.index.NodeAssembler;
import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.NodeOutput;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class AssembleNodesWorkflow {

    @Resource
    private NodeAssembler nodeAssembler;

    public List<NodeOutput> run(List<EdgeRecord> prunedEdges, EntityCatalogSnapshot catalog) {
        List<NodeOutput> nodes = nodeAssembler.assemble(prunedEdges, catalog.recordsByNodeId());
        log.info("节点组装完成：nodes={}, dropped={}", nodes.size(), catalog.totalRecords() - nodes.size());
        return nodes;
    }
}
