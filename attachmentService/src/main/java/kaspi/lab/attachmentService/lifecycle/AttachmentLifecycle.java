package kaspi.lab.attachmentService.lifecycle;

import kaspi.lab.attachmentService.domain.AttachmentEntity;
import kaspi.lab.attachmentService.domain.AttachmentStatus;
import kaspi.lab.attachmentService.exception.ChunkIndexOutOfRangeException;
import kaspi.lab.attachmentService.exception.ErrorCode;
import kaspi.lab.attachmentService.exception.InvalidStateException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Guards for the attachment state machine:
 *
 * <pre>
 * init (chunked) -> UPLOADING -> PROCESSING -> READY | QUARANTINED
 * simple upload  ----------------------------> READY
 * </pre>
 *
 * READY and QUARANTINED are terminal. The guards only inspect a loaded row; the persisted
 * transitions are conditional updates in {@code AttachmentRepository}, so a guard passing here
 * does not by itself win a race.
 */
@Component
public class AttachmentLifecycle {

    public void checkTransition(AttachmentStatus from, AttachmentStatus to) {
        if (from == null || !from.canTransitionTo(to)) {
            throw new InvalidStateException("Illegal status transition " + from + " -> " + to);
        }
    }

    public void requireUploading(AttachmentEntity attachment) {
        if (attachment.getStatus() != AttachmentStatus.UPLOADING) {
            throw new InvalidStateException(
                    "Upload " + attachment.getId() + " is not in uploading state (status=" + attachment.getStatus().value() + ")");
        }
    }

    public void requireChunkInRange(AttachmentEntity attachment, int chunkIndex) {
        int total = totalChunks(attachment);
        if (chunkIndex < 0 || chunkIndex >= total) {
            throw new ChunkIndexOutOfRangeException(chunkIndex, total);
        }
    }

    public void requireAllChunksReceived(AttachmentEntity attachment) {
        int received = receivedChunks(attachment);
        int total = totalChunks(attachment);
        if (received != total) {
            throw new InvalidStateException(ErrorCode.CHUNKS_INCOMPLETE,
                    "Missing chunks: received " + received + "/" + total);
        }
    }

    public void requireLinkable(AttachmentEntity attachment) {
        if (attachment.isLinked()) {
            throw new InvalidStateException(ErrorCode.ALREADY_LINKED,
                    "Attachment " + attachment.getId() + " is already linked to comment " + attachment.getCommentId());
        }
        if (attachment.getStatus() != AttachmentStatus.READY) {
            throw new InvalidStateException(
                    "Only ready attachments can be linked (status=" + attachment.getStatus().value() + ")");
        }
    }

    public void requireDeletable(AttachmentEntity attachment) {
        if (attachment.isLinked()) {
            throw new InvalidStateException(ErrorCode.ATTACHMENT_LINKED, ErrorCode.ATTACHMENT_LINKED.getMessage());
        }
    }

    /** Unlinked, abandonable and created strictly before {@code cutoff}. */
    public boolean isOrphaned(AttachmentEntity attachment, Instant cutoff) {
        return !attachment.isLinked()
                && AttachmentStatus.ABANDONABLE.contains(attachment.getStatus())
                && attachment.getCreatedAt() != null
                && attachment.getCreatedAt().isBefore(cutoff);
    }

    public int totalChunks(AttachmentEntity attachment) {
        return attachment.getTotalChunks() == null ? 0 : attachment.getTotalChunks();
    }

    public int receivedChunks(AttachmentEntity attachment) {
        return attachment.getReceivedChunks() == null ? 0 : attachment.getReceivedChunks();
    }
}
