package com.gdin.explorer.network.index;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.collection.ListUtil;
import com.gdin.explorer.network.models.ArticleEntityIndex;
import com.gdin.explorer.network.models.EdgeKey;
import com.gdin.explorer.network.models.TypePair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 按配置的类型对规则，在每篇文章内对两个类型桶做笛卡尔积，累加共现边。
 *
 * 1. 文章按 id 升序遍历，规则按配置顺序遍历；
 * 2. 每对 (n1, n2) 规范化为 (min, max)；
 * 3. 同一篇文章对同一条边只计一次；
 * 4. 并行时按连续文章区间分片，各自累加后按区间顺序合并，结果与单线程一致。
 */
@Slf4j
@Component
public class CrossTypeEdgeAccumulator {

    public EdgeAccumulator accumulate(ArticleEntityIndex index, List<TypePair> rules) {
        return accumulate(index, rules, 1);
    }

    public EdgeAccumulator accumulate(ArticleEntityIndex index, List<TypePair> rules, int parallelism) {
        if (index == null || CollectionUtil.isEmpty(rules)) return new EdgeAccumulator();

        List<String> articleIds = index.articleIds();
        int threads = Math.max(1, Math.min(parallelism, articleIds.size()));
        if (threads == 1) {
            return accumulateRange(index, rules, articleIds);
        }

        int chunkSize = (articleIds.size() + threads - 1) / threads;
        List<List<String>> ranges = ListUtil.partition(articleIds, chunkSize);
        log.debug("并行累加共现边：articles={}, ranges={}, threads={}", articleIds.size(), ranges.size(), threads);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<EdgeAccumulator>> futures = new ArrayList<>();
            for (List<String> range : ranges) {
                futures.add(CompletableFuture.supplyAsync(() -> accumulateRange(index, rules, range), pool));
            }

            EdgeAccumulator merged = new EdgeAccumulator();
            for (CompletableFuture<EdgeAccumulator> future : futures) {
                merged.merge(future.join());
            }
            return merged;
        } finally {
            pool.shutdown();
        }
    }

    private EdgeAccumulator accumulateRange(ArticleEntityIndex index, List<TypePair> rules, List<String> articleIds) {
        EdgeAccumulator acc = new EdgeAccumulator();
        for (String articleId : articleIds) {
            for (int r = 0; r < rules.size(); r++) {
                TypePair rule = rules.get(r);
                Set<String> left = index.nodes(articleId, rule.getFirst());
                if (left.isEmpty()) continue;
                Set<String> right = index.nodes(articleId, rule.getSecond());
                if (right.isEmpty()) continue;

                for (String n1 : left) {
                    for (String n2 : right) {
                        acc.record(EdgeKey.of(n1, n2), r, rule, articleId);
                    }
                }
            }
        }
        return acc;
    }
}
