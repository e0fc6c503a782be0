package me.golemcore.archivist.port.outbound;


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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for file storage under the archivist workspace, organized by directory.
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with null when the file is missing.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files under {@code prefix}, relative to {@code directory}.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (JSONL logs).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Write through a synced temporary file and an atomic rename, keeping the
     * previous version as {@code .bak} when {@code backup} is set.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
