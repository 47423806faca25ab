package com.gdin.explorer.network.index.workflows;

import com.gdin.explorer.network.index.CrossTypeEdgeAccumulator;
import com.gdin.explorer.network.index.EdgeAccumulator;
import com.gdin.explorer.network.models.ArticleEntityIndex;
import com.gdin.explorer.network.models.EdgeRecord;
import com.gdin.explorer.network.models.TypePair;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class AccumulateEdgesWorkflow {

    @Resource
    private CrossTypeEdgeAccumulator crossTypeEdgeAccumulator;

    public List<EdgeRecord> run(ArticleEntityIndex index, List<TypePair> typePairs, Integer parallelism) {
        int threads = parallelism == null ? 1 : Math.max(1, parallelism);
        log.info(
                "开始累加共现边：articles={}, typePairs={}, parallelism={}",
                index.size(),
                typePairs,
                threads
        );
        EdgeAccumulator accumulator = crossTypeEdgeAccumulator.accumulate(index, typePairs, threads);
        log.info("共现边累加完成：edges={}", accumulator.size());
        return accumulator.toEdgeRecords();
    }
}
