package kaspi.lab.attachmentService.mapper;

import kaspi.lab.attachmentService.domain.AttachmentEntity;
import kaspi.lab.attachmentService.dto.event.AttachmentQuarantinedEvent;
import kaspi.lab.attachmentService.dto.event.AttachmentReadyEvent;
import kaspi.lab.attachmentService.dto.response.AttachmentResponse;
import kaspi.lab.attachmentService.dto.response.ChunkedUploadInitResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface AttachmentMapper {

    @Mapping(target = "status", expression = "java(entity.getStatus() == null ? null : entity.getStatus().value())")
    AttachmentResponse toResponse(AttachmentEntity entity);

    @Mapping(target = "uploadId", source = "id")
    ChunkedUploadInitResponse toInitResponse(AttachmentEntity entity);

    @Mapping(target = "attachmentId", source = "id")
    AttachmentReadyEvent toReadyEvent(AttachmentEntity entity);

    @Mapping(target = "attachmentId", source = "entity.id")
    @Mapping(target = "uploaderId", source = "entity.uploaderId")
    @Mapping(target = "filename", source = "entity.filename")
    @Mapping(target = "reason", source = "reason")
    AttachmentQuarantinedEvent toQuarantinedEvent(AttachmentEntity entity, String reason);
}
