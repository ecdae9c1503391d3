package kaspi.lab.attachmentService.scheduler;

import kaspi.lab.attachmentService.config.AppAttachmentProperties;
import kaspi.lab.attachmentService.domain.OutboxEntity;
import kaspi.lab.attachmentService.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@EnableScheduling
@RequiredArgsConstructor
public class OutboxRelay {

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppAttachmentProperties props;

    @Scheduled(fixedDelayString = "${app.attachments.outbox-check-interval:5s}")
    public void processOutbox() {
        relay().subscribe(
                relayed -> {
                    if (relayed > 0) {
                        log.info("Relayed {} outbox events to {}", relayed, props.getEventsTopic());
                    }
                },
                e -> log.error("Outbox relay pass failed", e));
    }

    /**
     * Sends every NEW outbox row and marks it PROCESSED. A failed send leaves the row NEW for the
     * next pass. Emits the number of rows relayed.
     */
    public Mono<Long> relay() {
        return outboxRepository.findAllByStatus(OutboxEntity.STATUS_NEW)
                .concatMap(event -> {
                    log.debug("Relaying event {} ({}) to Kafka", event.getId(), event.getEventType());

                    return Mono.fromFuture(kafkaTemplate.send(props.getEventsTopic(), event.getPayload()))
                            .flatMap(result -> {
                                event.setStatus(OutboxEntity.STATUS_PROCESSED);
                                return outboxRepository.save(event);
                            })
                            .onErrorResume(e -> {
                                log.error("Failed to relay event {}", event.getId(), e);

                                return Mono.empty();
                            });
                })
                .count();
    }
}
