package com.gdin.explorer.network.models;

import cn.hutool.core.util.StrUtil;
import lombok.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 有向类型对规则 (typeA, typeB)，文本形式 "typeA-typeB" 同时作为边的 type。
 */
@Value
public class TypePair {
    EntityType first;
    EntityType second;

    public TypePair(EntityType first, EntityType second) {
        if (first == null || second == null) throw new IllegalArgumentException("type pair needs two types");
        if (first == second) throw new IllegalArgumentException("type pair must cross two distinct types: " + first.getTag());
        this.first = first;
        this.second = second;
    }

    public String getLabel() {
        return first.getTag() + "-" + second.getTag();
    }

    public List<String> toList() {
        return List.of(first.getTag(), second.getTag());
    }

    public static TypePair parse(String text) {
        List<String> parts = StrUtil.splitTrim(text, '-');
        if (parts.size() != 2) throw new IllegalArgumentException("type pair must look like 'person-organization': " + text);
        return new TypePair(EntityType.fromTag(parts.get(0)), EntityType.fromTag(parts.get(1)));
    }

    /**
     * 解析配置中的规则列表，保持配置顺序；重复规则视为配置错误。
     */
    public static List<TypePair> parseAll(List<String> texts) {
        List<TypePair> rules = new ArrayList<>();
        Set<TypePair> seen = new HashSet<>();
        if (texts == null) return rules;
        for (String text : texts) {
            TypePair rule = parse(text);
            if (!seen.add(rule)) throw new IllegalArgumentException("duplicated type pair: " + rule.getLabel());
            rules.add(rule);
        }
        return rules;
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
