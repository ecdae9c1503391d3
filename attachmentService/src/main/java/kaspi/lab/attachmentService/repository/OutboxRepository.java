package kaspi.lab.attachmentService.repository;

import kaspi.lab.attachmentService.domain.OutboxEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface OutboxRepository extends ReactiveCrudRepository<OutboxEntity, Long> {
    Flux<OutboxEntity> findAllByStatus(String status);
}
