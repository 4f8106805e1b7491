package me.golemcore.arena.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Replaces a file's content so that readers see either the old or the new
 * version, never a partial write.
 */
@Component
@Slf4j
public class AtomicFileWriter {

    public void writeText(Path target, String content) throws IOException {
        Path tempPath = target.resolveSibling(target.getFileName() + ".tmp");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        try {
            writeSynced(tempPath, bytes);
        } catch (IOException | RuntimeException e) {
            discardTemp(tempPath, e);
            throw e;
        }

        if (Files.size(tempPath) != bytes.length) {
            Files.deleteIfExists(tempPath);
            throw new IOException("Verification failed: size mismatch for " + tempPath);
        }

        try {
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("[Storage] wrote {} bytes to {}", bytes.length, target);
    }

    void writeSynced(Path tempPath, byte[] bytes) throws IOException {
        try (OutputStream os = Files.newOutputStream(tempPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.SYNC);
                FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
            os.write(bytes);
            os.flush();
            channel.force(true);
        }
    }

    private static void discardTemp(Path tempPath, Exception failure) {
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException cleanupError) {
            failure.addSuppressed(cleanupError);
        }
    }
}
