package com.gdin.explorer.network.models;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 实体类型。
 * tag 用于 nodeId 前缀与输出中的 type 字段；fileName 是实体集合文件名；
 * indexLabel 对应导出的 index.json 中的 "Type" 取值。
 */
@Getter
public enum EntityType {
    PERSON("person", "persons", "Personnes"),
    ORGANIZATION("organization", "organizations", "Organisations"),
    EVENT("event", "events", "Événements"),
    SUBJECT("subject", "subjects", "Sujets"),
    LOCATION("location", "locations", "Lieux");

    private final String tag;
    private final String collectionName;
    private final String indexLabel;

    EntityType(String tag, String collectionName, String indexLabel) {
        this.tag = tag;
        this.collectionName = collectionName;
        this.indexLabel = indexLabel;
    }

    public String getFileName() {
        return collectionName + ".json";
    }

    public String nodeId(String id) {
        return tag + ":" + id;
    }

    public static EntityType fromTag(String tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + tag));
    }

    public static Optional<EntityType> fromIndexLabel(String label) {
        return Arrays.stream(values())
                .filter(t -> t.indexLabel.equals(label))
                .findFirst();
    }
}
