package kaspi.lab.attachmentService.service;

import kaspi.lab.attachmentService.config.AppAttachmentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyGuard {

    private static final String IDEMPOTENCY_PREFIX = "idempotency:attachments:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final AppAttachmentProperties props;

    /**
     * Claims {@code idempotencyKey} for the configured TTL. Emits {@code false} when the key was
     * already claimed; a request without a key is always allowed.
     */
    public Mono<Boolean> tryAcquire(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Mono.just(true);
        }
        Duration ttl = Duration.ofSeconds(props.getIdempotencyTtl());
        return redisTemplate.opsForValue()
                .setIfAbsent(IDEMPOTENCY_PREFIX + idempotencyKey, "1", ttl)
                .defaultIfEmpty(true)
                .onErrorResume(RedisConnectionFailureException.class, e -> {
                    log.warn("Redis unavailable, skipping idempotency check for key {}", idempotencyKey);
                    return Mono.just(true);
                });
    }
}
