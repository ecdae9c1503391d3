package kaspi.lab.attachmentService.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Schedulers for CPU-bound attachment work. {@link #reassembly()} is bounded by
 * {@code app.attachments.reassembly.*}; {@link #crypto()} serves per-request encryption,
 * decryption and hashing.
 */
@Slf4j
@Component
public class WorkerSchedulers implements DisposableBean {

    private final Scheduler reassembly;
    private final Scheduler crypto;

    public WorkerSchedulers(AppAttachmentProperties props) {
        AppAttachmentProperties.Reassembly settings = props.getReassembly();
        this.reassembly = Schedulers.newBoundedElastic(
                settings.getThreads(), settings.getQueueCapacity(), "reassembly");
        this.crypto = Schedulers.newParallel("crypto", props.getCryptoThreads());
        log.info("Worker schedulers started: reassembly={} threads, crypto={} threads",
                settings.getThreads(), props.getCryptoThreads());
    }

    public Scheduler reassembly() {
        return reassembly;
    }

    public Scheduler crypto() {
        return crypto;
    }

    @Override
    public void destroy() {
        reassembly.dispose();
        crypto.dispose();
    }
}
