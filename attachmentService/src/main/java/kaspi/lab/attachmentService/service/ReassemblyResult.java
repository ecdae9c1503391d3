package kaspi.lab.attachmentService.service;

import kaspi.lab.attachmentService.domain.AttachmentStatus;

import java.util.UUID;

/**
 * Outcome of one background reassembly. {@code status} is the status the row was left in, or
 * null when the row could not be found; {@code reason} is empty for a ready attachment.
 */
public record ReassemblyResult(UUID attachmentId, AttachmentStatus status, String reason) {

    public static ReassemblyResult ready(UUID attachmentId) {
        return new ReassemblyResult(attachmentId, AttachmentStatus.READY, "");
    }

    public static ReassemblyResult quarantined(UUID attachmentId, String reason) {
        return new ReassemblyResult(attachmentId, AttachmentStatus.QUARANTINED, reason);
    }

    public static ReassemblyResult skipped(UUID attachmentId, AttachmentStatus status, String reason) {
        return new ReassemblyResult(attachmentId, status, reason);
    }

    public boolean isReady() {
        return status == AttachmentStatus.READY;
    }
}
