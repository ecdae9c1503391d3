package kaspi.lab.attachmentService.repository;

import kaspi.lab.attachmentService.domain.AttachmentEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

public interface AttachmentRepository extends R2dbcRepository<AttachmentEntity, UUID> {

    Mono<AttachmentEntity> findByIdAndUploaderId(UUID id, Long uploaderId);

    // один ряд на индекс: повторная загрузка чанка обновляет размер, а не добавляет ряд
    @Modifying
    @Query("UPDATE attachment_chunks SET size_bytes = :size, received_at = :now "
            + "WHERE attachment_id = :id AND chunk_index = :chunkIndex")
    Mono<Integer> updateChunkRecord(@Param("id") UUID id, @Param("chunkIndex") int chunkIndex,
                                    @Param("size") long size, @Param("now") Instant now);

    @Modifying
    @Query("INSERT INTO attachment_chunks (attachment_id, chunk_index, size_bytes, received_at) "
            + "VALUES (:id, :chunkIndex, :size, :now)")
    Mono<Integer> insertChunkRecord(@Param("id") UUID id, @Param("chunkIndex") int chunkIndex,
                                    @Param("size") long size, @Param("now") Instant now);

    @Query("SELECT CAST(COALESCE(SUM(size_bytes), 0) AS BIGINT) FROM attachment_chunks "
            + "WHERE attachment_id = :id AND chunk_index <> :chunkIndex")
    Mono<Long> sumChunkBytesExcept(@Param("id") UUID id, @Param("chunkIndex") int chunkIndex);

    /**
     * Derives {@code received_chunks} from the recorded indices. Never lowers the counter, so a
     * recount computed from an older snapshot cannot undo a newer one.
     */
    @Modifying
    @Query("UPDATE attachments SET received_chunks = GREATEST(received_chunks, "
            + "(SELECT COUNT(*) FROM attachment_chunks c WHERE c.attachment_id = :id)), updated_at = :now "
            + "WHERE id = :id AND status = 'UPLOADING'")
    Mono<Integer> recountReceivedChunks(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM attachment_chunks WHERE attachment_id = :id")
    Mono<Integer> deleteChunkRecords(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE attachments SET status = 'PROCESSING', updated_at = :now "
            + "WHERE id = :id AND uploader_id = :uploaderId AND status = 'UPLOADING' "
            + "AND received_chunks = total_chunks")
    Mono<Integer> markProcessing(@Param("id") UUID id, @Param("uploaderId") Long uploaderId, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE attachments SET status = 'READY', file_size = :fileSize, checksum_sha256 = :checksum, "
            + "upload_session = NULL, updated_at = :now WHERE id = :id AND status = 'PROCESSING'")
    Mono<Integer> markReady(@Param("id") UUID id, @Param("fileSize") long fileSize,
                            @Param("checksum") String checksum, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE attachments SET status = 'QUARANTINED', upload_session = NULL, updated_at = :now "
            + "WHERE id = :id AND status = 'PROCESSING'")
    Mono<Integer> markQuarantined(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE attachments SET comment_id = :commentId, updated_at = :now "
            + "WHERE id = :id AND uploader_id = :uploaderId AND comment_id IS NULL AND status = 'READY'")
    Mono<Integer> linkToComment(@Param("id") UUID id, @Param("commentId") Long commentId,
                                @Param("uploaderId") Long uploaderId, @Param("now") Instant now);

    @Query("SELECT * FROM attachments WHERE comment_id IS NULL "
            + "AND status IN ('UPLOADING', 'READY', 'QUARANTINED') AND created_at < :cutoff "
            + "ORDER BY created_at")
    Flux<AttachmentEntity> findOrphanCandidates(@Param("cutoff") Instant cutoff);

    /** Re-checks the orphan predicate atomically, so a row linked since selection survives. */
    @Modifying
    @Query("DELETE FROM attachments WHERE id = :id AND comment_id IS NULL "
            + "AND status IN ('UPLOADING', 'READY', 'QUARANTINED') AND created_at < :cutoff")
    Mono<Integer> deleteIfOrphaned(@Param("id") UUID id, @Param("cutoff") Instant cutoff);

    @Modifying
    @Query("DELETE FROM attachments WHERE id = :id AND uploader_id = :uploaderId AND comment_id IS NULL")
    Mono<Integer> deleteIfUnlinked(@Param("id") UUID id, @Param("uploaderId") Long uploaderId);
}
