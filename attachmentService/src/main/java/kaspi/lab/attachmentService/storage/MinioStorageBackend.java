package kaspi.lab.attachmentService.storage;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import kaspi.lab.attachmentService.exception.StorageException;
import kaspi.lab.attachmentService.exception.StorageObjectNotFoundException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * S3-compatible backend. Keys are used verbatim as object names inside one bucket.
 *
 * <p>{@link #appendChunk} is a read-modify-write of the whole object and is not atomic.
 */
@Slf4j
public class MinioStorageBackend implements StorageBackend {

    private static final String NO_SUCH_KEY = "NoSuchKey";

    private final MinioClient minioClient;
    private final String bucket;
    private volatile boolean bucketReady;

    public MinioStorageBackend(MinioClient minioClient, String bucket) {
        this.minioClient = minioClient;
        this.bucket = bucket;
    }

    private void ensureBucket() throws Exception {
        if (bucketReady) {
            return;
        }
        // Проверяем, есть ли бакет, если нет - создаем
        boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
        if (!found) {
            log.info("Creating MinIO bucket {}", bucket);
            minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
        }
        bucketReady = true;
    }

    @Override
    public Mono<Void> store(String key, byte[] data) {
        return Mono.fromCallable(() -> {
            StorageKeys.requireSafe(key);
            try {
                ensureBucket();
                put(key, data);
            } catch (Exception e) {
                throw new StorageException("Failed to store " + key + " in bucket " + bucket, e);
            }
            log.debug("Uploaded {} bytes to MinIO: bucket={}, object={}", data.length, bucket, key);
            return key;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    private void put(String key, byte[] data) throws Exception {
        try (ByteArrayInputStream in = new ByteArrayInputStream(data)) {
            minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucket)
                    .object(key)
                    .stream(in, data.length, -1)
                    .contentType("application/octet-stream")
                    .build());
        }
    }

    @Override
    public Mono<byte[]> retrieve(String key) {
        return Mono.fromCallable(() -> {
            StorageKeys.requireSafe(key);
            try (GetObjectResponse in = open(key)) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new StorageException("Failed to read " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private GetObjectResponse open(String key) {
        try {
            return minioClient.getObject(GetObjectArgs.builder().bucket(bucket).object(key).build());
        } catch (ErrorResponseException e) {
            if (NO_SUCH_KEY.equals(e.errorResponse().code())) {
                throw new StorageObjectNotFoundException(key);
            }
            throw new StorageException("Failed to open " + key, e);
        } catch (Exception e) {
            throw new StorageException("Failed to open " + key, e);
        }
    }

    @Override
    public Flux<byte[]> stream(String key, int chunkSize) {
        if (chunkSize <= 0) {
            return Flux.error(new IllegalArgumentException("chunkSize must be positive"));
        }
        return Flux.using(
                        () -> (InputStream) open(StorageKeys.requireSafe(key)),
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
                                log.warn("Could not close MinIO stream for {}", key, e);
                            }
                        })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromCallable(() -> {
            StorageKeys.requireSafe(key);
            try {
                minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
            } catch (Exception e) {
                throw new StorageException("Failed to delete " + key, e);
            }
            return key;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromCallable(() -> {
            StorageKeys.requireSafe(key);
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
                return true;
            } catch (ErrorResponseException e) {
                if (NO_SUCH_KEY.equals(e.errorResponse().code())) {
                    return false;
                }
                throw new StorageException("Failed to stat " + key, e);
            } catch (Exception e) {
                throw new StorageException("Failed to stat " + key, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> appendChunk(String key, byte[] data) {
        return exists(key)
                .flatMap(present -> present ? retrieve(key) : Mono.just(new byte[0]))
                .flatMap(existing -> {
                    byte[] joined = new byte[existing.length + data.length];
                    System.arraycopy(existing, 0, joined, 0, existing.length);
                    System.arraycopy(data, 0, joined, existing.length, data.length);
                    return store(key, joined);
                });
    }
}
