package kaspi.lab.attachmentService.domain;

import java.util.EnumSet;
import java.util.Set;

public enum AttachmentStatus {
    UPLOADING,
    PROCESSING,
    READY,
    QUARANTINED,
    /**
     * Never persisted: "orphaned" is evaluated as a predicate (unlinked and expired) by the
     * reaper. Kept so the column can hold the value should it ever be written explicitly.
     */
    ORPHANED;

    /** Statuses the reaper may reclaim; PROCESSING rows still belong to a running reassembly. */
    public static final Set<AttachmentStatus> ABANDONABLE = EnumSet.of(UPLOADING, READY, QUARANTINED);

    public boolean isTerminal() {
        return this == READY || this == QUARANTINED;
    }

    public boolean canTransitionTo(AttachmentStatus target) {
        return switch (this) {
            case UPLOADING -> target == PROCESSING;
            case PROCESSING -> target == READY || target == QUARANTINED;
            default -> false;
        };
    }

    public String value() {
        return name().toLowerCase();
    }
}
