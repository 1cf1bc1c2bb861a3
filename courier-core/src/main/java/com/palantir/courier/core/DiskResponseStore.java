/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
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
 */

package com.palantir.courier.core;

import com.palantir.courier.CallKey;
import com.palantir.courier.RawResponse;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.exceptions.SafeUncheckedIoException;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A {@link ResponseStore} that keeps one JSON file per call key digest in a directory. Writes go to a temporary file
 * which is then moved over the target, so readers observe either the previous entry or the new one. Unreadable or
 * corrupt entries are reported as misses.
 */
@ThreadSafe
public final class DiskResponseStore implements ResponseStore {

    private static final SafeLogger log = SafeLoggerFactory.get(DiskResponseStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Clock clock;

    private DiskResponseStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    /** Creates the directory if needed. */
    public static DiskResponseStore create(Path directory) {
        return create(directory, Clock.systemUTC());
    }

    public static DiskResponseStore create(Path directory, Clock clock) {
        Preconditions.checkNotNull(directory, "directory");
        Preconditions.checkNotNull(clock, "clock");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new SafeUncheckedIoException(
                    "Failed to create response store directory", e, UnsafeArg.of("directory", directory));
        }
        return new DiskResponseStore(directory, clock);
    }

    @Override
    public Optional<RawResponse> get(CallKey key) {
        Path file = fileFor(key);
        try {
            return Optional.of(
                    CacheEntryCodec.deserialize(Files.readAllBytes(file)).response());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn(
                    "Failed to read response store entry, treating as a miss",
                    SafeArg.of("descriptor", key.descriptorId()),
                    UnsafeArg.of("file", file),
                    e);
            return Optional.empty();
        }
    }

    @Override
    public void put(CallKey key, RawResponse response) {
        Path file = fileFor(key);
        Path temp = null;
        try {
            byte[] bytes = CacheEntryCodec.serialize(
                    CacheEntry.of(key.digest(), key.descriptorId(), response, clock.instant()));
            temp = Files.createTempFile(directory, key.digest(), ".tmp");
            Files.write(temp, bytes);
            move(temp, file);
        } catch (IOException e) {
            log.warn(
                    "Failed to write response store entry",
                    SafeArg.of("descriptor", key.descriptorId()),
                    UnsafeArg.of("file", file),
                    e);
            deleteQuietly(temp);
        }
    }

    @Override
    public void clear() {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path entry : entries) {
                Files.deleteIfExists(entry);
            }
        } catch (IOException e) {
            throw new SafeUncheckedIoException(
                    "Failed to clear response store", e, UnsafeArg.of("directory", directory));
        }
    }

    Path fileFor(CallKey key) {
        return directory.resolve(key.digest() + SUFFIX);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported, falling back to replace", UnsafeArg.of("target", target), e);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary response store file", UnsafeArg.of("file", temp), e);
        }
    }

    @Override
    public String toString() {
        return "DiskResponseStore{directory=" + directory + '}';
    }
}
