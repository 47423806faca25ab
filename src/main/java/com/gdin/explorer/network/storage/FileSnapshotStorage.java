package com.gdin.explorer.network.storage;

import cn.hutool.core.io.FileUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 先写同目录临时文件，再整体替换目标文件。
 */
@Slf4j
@Service
public class FileSnapshotStorage implements SnapshotStorage {

    @Override
    public String save(String location, String content) throws IOException {
        Path target = Path.of(location).toAbsolutePath();
        File parent = FileUtil.mkdir(target.getParent().toFile());
        Path tmp = Files.createTempFile(parent.toPath(), target.getFileName().toString(), ".tmp");
        try {
            FileUtil.writeUtf8String(content, tmp.toFile());
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("文件系统不支持原子替换，改为普通替换：{}", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("写出文件：{} ({} chars)", target, content.length());
        return target.toString();
    }
}
