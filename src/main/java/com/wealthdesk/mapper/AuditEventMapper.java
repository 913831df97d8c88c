package com.wealthdesk.mapper;

import com.wealthdesk.domain.model.AuditEvent;
import com.wealthdesk.entity.AuditEventEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between AuditEvent and AuditEventEntity.
 *
 * <p>The details map is stored as a JSON string; conversion goes through {@link JsonHelper}.
 */
@Mapper
public interface AuditEventMapper {

    @Mapping(source = "details", target = "detailsJson", qualifiedByName = "mapToJson")
    AuditEventEntity toEntity(AuditEvent auditEvent);

    @Mapping(source = "detailsJson", target = "details", qualifiedByName = "jsonToMap")
    AuditEvent toDomain(AuditEventEntity entity);

    List<AuditEvent> toDomainList(List<AuditEventEntity> entities);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> details) {
        return details == null || details.isEmpty() ? null : JsonHelper.toJson(details);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.toMap(json);
    }
}
