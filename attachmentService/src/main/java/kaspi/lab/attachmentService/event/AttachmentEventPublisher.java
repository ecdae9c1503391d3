package kaspi.lab.attachmentService.event;

import kaspi.lab.attachmentService.dto.event.AttachmentQuarantinedEvent;
import kaspi.lab.attachmentService.dto.event.AttachmentReadyEvent;
import reactor.core.publisher.Mono;

/**
 * Outbound hook for attachment lifecycle events. Completion of the returned {@code Mono} means the
 * event was accepted for delivery, not that it reached a consumer.
 */
public interface AttachmentEventPublisher {

    Mono<Void> attachmentReady(AttachmentReadyEvent event);

    Mono<Void> attachmentQuarantined(AttachmentQuarantinedEvent event);
}
