package kaspi.lab.attachmentService.config;

import io.minio.MinioClient;
import kaspi.lab.attachmentService.storage.InMemoryStorageBackend;
import kaspi.lab.attachmentService.storage.LocalStorageBackend;
import kaspi.lab.attachmentService.storage.MinioStorageBackend;
import kaspi.lab.attachmentService.storage.StorageBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    public StorageBackend storageBackend(AppAttachmentProperties props) {
        String backend = props.getStorage().getBackend();
        log.info("Using storage backend '{}'", backend);
        return switch (backend) {
            case "local" -> new LocalStorageBackend(Paths.get(props.getStorage().getLocalPath()));
            case "memory" -> new InMemoryStorageBackend();
            case "minio" -> new MinioStorageBackend(minioClient(props.getMinio()), props.getMinio().getBucket());
            default -> throw new IllegalStateException("Unknown storage backend: " + backend);
        };
    }

    private MinioClient minioClient(AppAttachmentProperties.Minio minio) {
        return MinioClient.builder()
                .endpoint(minio.getEndpoint())
                .credentials(minio.getAccessKey(), minio.getSecretKey())
                .build();
    }
}
