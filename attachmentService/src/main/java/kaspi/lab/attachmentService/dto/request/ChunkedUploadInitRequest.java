package kaspi.lab.attachmentService.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

@Builder
public record ChunkedUploadInitRequest(
        @NotBlank(message = "Имя файла должно быть указано") String filename,
        @NotBlank(message = "Content-Type должен быть указан") String contentType,
        @Min(value = 1, message = "Размер файла должен быть положительным") long totalSize,
        @Min(value = 1, message = "Нужен хотя бы один чанк")
        @Max(value = 999_999, message = "Слишком много чанков") int totalChunks
) {}
