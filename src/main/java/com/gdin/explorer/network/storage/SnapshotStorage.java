package com.gdin.explorer.network.storage;

import java.io.IOException;

/**
 * 快照 / 实体集合的写出。实现方需保证失败时不留下半个文件。
 */
public interface SnapshotStorage {

    /**
     * @param location 目标位置（文件路径）
     * @param content 完整内容
     * @return 实际写入的位置
     */
    String save(String location, String content) throws IOException;
}
