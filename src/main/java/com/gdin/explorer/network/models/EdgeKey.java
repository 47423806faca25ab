package com.gdin.explorer.network.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 无向边键：(a,b) 与 (b,a) 统一为 (min,max)。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EdgeKey implements Comparable<EdgeKey> {
    String source;
    String target;

    public static EdgeKey of(String a, String b) {
        if (a == null || b == null) throw new IllegalArgumentException("edge endpoint must not be null");
        int cmp = a.compareTo(b);
        if (cmp == 0) throw new IllegalArgumentException("self pair is not an edge: " + a);
        return cmp < 0 ? new EdgeKey(a, b) : new EdgeKey(b, a);
    }

    public boolean touches(String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }

    @Override
    public int compareTo(EdgeKey o) {
        int c = source.compareTo(o.source);
        return c != 0 ? c : target.compareTo(o.target);
    }
}
