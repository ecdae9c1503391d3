package kaspi.lab.attachmentService.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("attachments")
public class AttachmentEntity implements Persistable<UUID> {
    @Id
    private UUID id;
    private Long commentId;
    private Long uploaderId;
    private String uploadSession;
    private String filename;
    private String contentType;
    private Long fileSize;
    private String storageKey;
    private String checksumSha256;
    private String encryptedFileKey;
    private String thumbnailStorageKey;
    private AttachmentStatus status;
    private Integer totalChunks;
    private Integer receivedChunks;
    private Instant createdAt;
    private Instant updatedAt;

    @Transient
    @Builder.Default
    private boolean isNewEntry = false;

    @Override
    public boolean isNew() { return isNewEntry || id == null; }

    public boolean isLinked() {
        return commentId != null;
    }
}
