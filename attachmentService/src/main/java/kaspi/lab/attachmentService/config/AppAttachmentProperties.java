package kaspi.lab.attachmentService.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@Validated
@ConfigurationProperties(prefix = "app.attachments")
public class AppAttachmentProperties {

    private static final long MB = 1024L * 1024L;

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Minio minio = new Minio();

    @Valid
    private Encryption encryption = new Encryption();

    @Valid
    private SizeLimits sizeLimits = new SizeLimits();

    @Valid
    private Reassembly reassembly = new Reassembly();

    @NotEmpty(message = "Список разрешённых content-type не может быть пустым")
    private List<String> allowedContentTypes = new ArrayList<>(List.of(
            "image/jpeg", "image/png", "image/webp", "image/gif",
            "video/mp4", "video/webm", "video/quicktime",
            "audio/mpeg", "audio/wav", "audio/ogg",
            "application/pdf"));

    @NotNull(message = "TTL для осиротевших вложений должен быть указан")
    @Min(value = 1, message = "TTL должен быть не менее 1 минуты")
    private Long orphanTtlMinutes = 60L;

    @NotNull
    private Duration cleanupInterval = Duration.ofMinutes(5);

    @Min(value = 1, message = "Лимит простой загрузки должен быть положительным")
    private long simpleUploadLimit = 5 * MB;

    @Min(value = 1, message = "Максимальный размер чанка должен быть положительным")
    private long maxChunkSize = 10 * MB;

    @NotNull(message = "TTL идемпотентности должен быть указан")
    @Min(value = 60, message = "TTL должен быть не менее 60 секунд")
    private Long idempotencyTtl = 3600L;

    @NotBlank
    private String eventsTopic = "attachment-events-topic";

    @NotNull
    private Duration outboxCheckInterval = Duration.ofSeconds(5);

    // шифрование и хэширование вне потоков Netty
    @Min(value = 1, message = "Нужен хотя бы один поток для шифрования")
    private int cryptoThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    @Data
    public static class Storage {
        // local | memory | minio
        @NotBlank(message = "Тип хранилища (storage.backend) должен быть указан")
        private String backend = "local";

        @NotBlank(message = "Путь локального хранилища (storage.local-path) должен быть указан")
        private String localPath = "./data/attachments";
    }

    @Data
    public static class Minio {
        private String endpoint = "http://localhost:9000";
        private String accessKey;
        private String secretKey;
        private String bucket = "attachments";
    }

    @Data
    public static class Encryption {
        public static final String DEFAULT_MASTER_KEY = "CHANGE-THIS-IN-PRODUCTION-USE-A-STRONG-RANDOM-KEY";

        @NotBlank(message = "Мастер-ключ (encryption.master-key) должен быть указан")
        private String masterKey = DEFAULT_MASTER_KEY;

        /** Retired master keys, tried in order when unwrapping with the current key fails. */
        private List<String> previousMasterKeys = new ArrayList<>();
    }

    @Data
    public static class SizeLimits {
        @Min(1)
        private long image = 20 * MB;
        @Min(1)
        private long video = 200 * MB;
        @Min(1)
        private long audio = 50 * MB;
        @Min(1)
        private long document = 30 * MB;
    }

    @Data
    public static class Reassembly {
        @Min(1)
        private int threads = 4;
        @Min(1)
        private int queueCapacity = 1000;
    }
}
