package kaspi.lab.attachmentService.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import kaspi.lab.attachmentService.domain.OutboxEntity;
import kaspi.lab.attachmentService.dto.event.AttachmentQuarantinedEvent;
import kaspi.lab.attachmentService.dto.event.AttachmentReadyEvent;
import kaspi.lab.attachmentService.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;

/** Writes events to the outbox table; {@code OutboxRelay} forwards them to Kafka. */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxAttachmentEventPublisher implements AttachmentEventPublisher {

    public static final String ATTACHMENT_READY = "ATTACHMENT_READY";
    public static final String ATTACHMENT_QUARANTINED = "ATTACHMENT_QUARANTINED";

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> attachmentReady(AttachmentReadyEvent event) {
        return enqueue(ATTACHMENT_READY, event);
    }

    @Override
    public Mono<Void> attachmentQuarantined(AttachmentQuarantinedEvent event) {
        return enqueue(ATTACHMENT_QUARANTINED, event);
    }

    private Mono<Void> enqueue(String eventType, Object event) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(event))
                .onErrorMap(JsonProcessingException.class,
                        e -> new IllegalStateException("Failed to serialize outbox event " + eventType, e))
                .flatMap(payload -> outboxRepository.save(OutboxEntity.builder()
                        .eventType(eventType)
                        .payload(payload)
                        .status(OutboxEntity.STATUS_NEW)
                        .createdAt(Instant.now())
                        .build()))
                .doOnNext(saved -> log.debug("Outbox event {} queued as {}", eventType, saved.getId()))
                .then();
    }
}
