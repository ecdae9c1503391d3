package kaspi.lab.attachmentService.service;

import kaspi.lab.attachmentService.config.WorkerSchedulers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.UUID;

/**
 * Runs reassembly off the request path on the bounded reassembly scheduler. Results are published to
 * {@link #results()}; subscribers only see results emitted after they subscribed.
 */
@Slf4j
@Component
public class ReassemblyQueue implements DisposableBean {

    private final ReassemblyWorker worker;
    private final Scheduler scheduler;
    private final Sinks.Many<ReassemblyResult> results = Sinks.many().multicast().directBestEffort();

    public ReassemblyQueue(ReassemblyWorker worker, WorkerSchedulers schedulers) {
        this.worker = worker;
        this.scheduler = schedulers.reassembly();
    }

    public void submit(UUID attachmentId) {
        log.debug("Queueing reassembly of {}", attachmentId);
        worker.reassemble(attachmentId)
                .subscribeOn(scheduler)
                .subscribe(this::publish, e -> {
                    // очередь переполнена или планировщик остановлен
                    log.error("Reassembly of {} could not be scheduled", attachmentId, e);
                    worker.abandon(attachmentId, e).subscribe(this::publish);
                });
    }

    public Flux<ReassemblyResult> results() {
        return results.asFlux();
    }

    private synchronized void publish(ReassemblyResult result) {
        results.tryEmitNext(result);
    }

    @Override
    public void destroy() {
        results.tryEmitComplete();
    }
}
