package kaspi.lab.attachmentService.storage;

import kaspi.lab.attachmentService.exception.PathTraversalException;
import kaspi.lab.attachmentService.exception.StorageException;
import kaspi.lab.attachmentService.exception.StorageObjectNotFoundException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Filesystem backend: every key maps to a file under {@code basePath}. Suitable for single-node
 * deployments.
 */
@Slf4j
public class LocalStorageBackend implements StorageBackend {

    private final Path basePath;

    public LocalStorageBackend(Path basePath) {
        try {
            Files.createDirectories(basePath);
            this.basePath = basePath.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot initialize storage root " + basePath, e);
        }
        log.info("LocalStorageBackend initialized at {}", this.basePath);
    }

    Path resolve(String key) {
        StorageKeys.requireSafe(key);
        Path resolved = basePath.resolve(key).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new PathTraversalException(key);
        }
        return resolved;
    }

    @Override
    public Mono<Void> store(String key, byte[] data) {
        return Mono.fromCallable(() -> {
            Path path = resolve(key);
            try {
                Files.createDirectories(path.getParent());
                Files.write(path, data);
            } catch (IOException e) {
                throw new StorageException("Failed to store " + key, e);
            }
            log.debug("Stored {} bytes at {}", data.length, key);
            return path;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<byte[]> retrieve(String key) {
        return Mono.fromCallable(() -> {
            Path path = resolve(key);
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new StorageObjectNotFoundException(key);
            } catch (IOException e) {
                throw new StorageException("Failed to read " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<byte[]> stream(String key, int chunkSize) {
        if (chunkSize <= 0) {
            return Flux.error(new IllegalArgumentException("chunkSize must be positive"));
        }
        return Flux.using(
                        () -> openForRead(key),
                        in -> Flux.<byte[]>generate(sink -> {
                            try {
                                byte[] buf = in.readNBytes(chunkSize);
                                if (buf.length == 0) {
                                    sink.complete();
                                } else {
                                    sink.next(buf);
                                }
                            } catch (IOException e) {
                                sink.error(new StorageException("Failed to stream " + key, e));
                            }
                        }),
                        in -> {
                            try {
                                in.close();
                            } catch (IOException e) {
                                log.warn("Could not close stream for {}", key, e);
                            }
                        })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private InputStream openForRead(String key) {
        Path path = resolve(key);
        try {
            return Files.newInputStream(path);
        } catch (NoSuchFileException e) {
            throw new StorageObjectNotFoundException(key);
        } catch (IOException e) {
            throw new StorageException("Failed to open " + key, e);
        }
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromCallable(() -> {
            Path path = resolve(key);
            try {
                if (Files.deleteIfExists(path)) {
                    log.debug("Deleted {}", key);
                    pruneEmptyParents(path.getParent());
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete " + key, e);
            }
            return path;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    // Удаляем пустые директории шардов вплоть до корня хранилища
    private void pruneEmptyParents(Path dir) {
        Path current = dir;
        while (current != null && !current.equals(basePath) && current.startsWith(basePath)) {
            try {
                Files.delete(current);
            } catch (DirectoryNotEmptyException | NoSuchFileException e) {
                return;
            } catch (IOException e) {
                log.debug("Could not prune directory {}", current, e);
                return;
            }
            current = current.getParent();
        }
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromCallable(() -> Files.isRegularFile(resolve(key)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> appendChunk(String key, byte[] data) {
        return Mono.fromCallable(() -> {
            Path path = resolve(key);
            try {
                Files.createDirectories(path.getParent());
                Files.write(path, data, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new StorageException("Failed to append to " + key, e);
            }
            log.debug("Appended {} bytes to {}", data.length, key);
            return path;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }
}
