package com.gdin.explorer.network.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "gdin.map.network")
@Component
public class NetworkProperties implements Serializable {
    // =============== 通用 ================
    // 启动后自动执行一次构建
    private Boolean runOnStartup = false;
    // 启动时执行的流水线：network / full
    private String pipeline = "network";

    // =============== 输入输出路径 ================
    private String dataDir = "omeka-map-explorer/static/data";
    // 为空时取 {dataDir}/entities
    private String entitiesDir;
    // 为空时取 {dataDir}/networks/global.json
    private String outputFile;
    // 仅 full 流水线使用
    private String articlesFile = "articles.json";
    private String indexFile = "index.json";

    // =============== build_network ================
    // 边的最小权重（共同出现的文章数）
    private Integer weightMin = 2;
    // 有向类型对规则，按配置顺序决定边的 type
    private List<String> typePairs = List.of(
            "person-organization",
            "person-event",
            "person-subject",
            "person-location",
            "organization-event",
            "organization-subject",
            "organization-location",
            "event-subject",
            "event-location",
            "subject-location"
    );
    // 参与加载的实体类型
    private List<String> supportedTypes = List.of("person", "organization", "event", "subject", "location");
    // 累加阶段的并行度，1 为单线程
    private Integer parallelism = 1;
}
