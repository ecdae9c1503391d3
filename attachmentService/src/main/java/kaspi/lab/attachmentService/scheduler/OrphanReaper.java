package kaspi.lab.attachmentService.scheduler;

import kaspi.lab.attachmentService.config.AppAttachmentProperties;
import kaspi.lab.attachmentService.domain.AttachmentEntity;
import kaspi.lab.attachmentService.repository.AttachmentRepository;
import kaspi.lab.attachmentService.service.AttachmentStorageCleaner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Reclaims attachments that were never linked to a comment within the TTL. The row goes first,
 * through a conditional delete that re-checks the orphan predicate; storage objects are removed
 * only for rows this sweep actually deleted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrphanReaper {

    private final AttachmentRepository attachmentRepository;
    private final AttachmentStorageCleaner storageCleaner;
    private final AppAttachmentProperties props;

    @Scheduled(fixedDelayString = "${app.attachments.cleanup-interval:5m}")
    public void cleanupOrphans() {
        sweep(Instant.now()).subscribe(
                removed -> {
                    if (removed > 0) {
                        log.info("Cleaned up {} orphaned attachments", removed);
                    }
                },
                e -> log.error("Orphan cleanup failed", e));
    }

    /** Emits the number of rows reclaimed by this pass. */
    public Mono<Long> sweep(Instant now) {
        Instant cutoff = now.minus(Duration.ofMinutes(props.getOrphanTtlMinutes()));
        return attachmentRepository.findOrphanCandidates(cutoff)
                .concatMap(candidate -> reclaim(candidate, cutoff))
                .count();
    }

    private Mono<AttachmentEntity> reclaim(AttachmentEntity candidate, Instant cutoff) {
        return attachmentRepository.deleteIfOrphaned(candidate.getId(), cutoff)
                .flatMap(deleted -> {
                    if (deleted == 0) {
                        // привязали к комментарию между выборкой и удалением
                        log.debug("Attachment {} is no longer an orphan, skipping", candidate.getId());
                        return Mono.<AttachmentEntity>empty();
                    }
                    log.info("Reclaiming orphaned attachment {} (status={}, created={})",
                            candidate.getId(), candidate.getStatus().value(), candidate.getCreatedAt());
                    return storageCleaner.deleteObjects(candidate).thenReturn(candidate);
                })
                .onErrorResume(e -> {
                    log.error("Failed to reclaim orphaned attachment {}", candidate.getId(), e);
                    return Mono.empty();
                });
    }
}
