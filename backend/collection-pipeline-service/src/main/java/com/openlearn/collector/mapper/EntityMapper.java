package com.openlearn.collector.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openlearn.collector.dto.AlertDTO;
import com.openlearn.collector.dto.CollectionJobDTO;
import com.openlearn.collector.dto.RecordDTO;
import com.openlearn.collector.entity.Alert;
import com.openlearn.collector.entity.CollectionJob;
import com.openlearn.collector.entity.PersistedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

@Component
public class EntityMapper {

    private static final Logger log = LoggerFactory.getLogger(EntityMapper.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EntityMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CollectionJobDTO toDTO(CollectionJob job) {
        return new CollectionJobDTO(
                job.getId(),
                job.getSourceKey(),
                job.getStatus(),
                job.getTriggerType(),
                job.getAttemptCount(),
                job.getTriggerTime(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getNextRetryAt(),
                job.getReplayOfJobId(),
                job.getItemsFetched(),
                job.getItemsStored(),
                job.getItemsDuplicate(),
                job.getItemErrors(),
                job.getLastError()
        );
    }

    public RecordDTO toDTO(PersistedRecord record) {
        return new RecordDTO(
                record.getId(),
                record.getSourceKey(),
                record.getKind(),
                record.getContentHash(),
                record.getTitle(),
                record.getUrl(),
                parseJson(record.getDerivedFieldsJson()),
                parseJson(record.getPayloadJson()),
                record.getCreatedAt()
        );
    }

    public AlertDTO toDTO(Alert alert) {
        return new AlertDTO(
                alert.getId(),
                alert.getSourceKey(),
                alert.getKind(),
                alert.getThreshold(),
                alert.getObservedValue(),
                alert.getSeverity(),
                alert.getMessage(),
                alert.getCreatedAt()
        );
    }

    private Map<String, Object> parseJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stored JSON. Returning empty map. Data: {}", json, e);
            return Collections.emptyMap();
        }
    }
}
