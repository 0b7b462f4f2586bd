package com.al.clinicalsummary.repository;

import com.al.clinicalsummary.exception.PersistenceException;
import com.al.clinicalsummary.model.CorrelationId;
import com.al.clinicalsummary.model.SummaryRecord;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Upsert keyed by hospitalization id. An existing record keeps its id and creation time.
 * When two first writes race, the unique index rejects one and it is retried as an update.
 */
@Slf4j
abstract class MongoSummaryStore<T, R extends SummaryRecord> implements SummaryStore<T> {

    private static final TypeReference<Map<String, Object>> SECTION_TYPE = new TypeReference<>() {
    };

    private final SummaryGroup group;
    private final MongoRepository<R, String> repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    protected MongoSummaryStore(SummaryGroup group, MongoRepository<R, String> repository,
            ObjectMapper objectMapper, Clock clock) {
        this.group = group;
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    protected abstract Optional<R> findExisting(String hospitalizationId);

    protected abstract R toRecord(CorrelationId correlationId, T summary);

    @Override
    public String upsert(CorrelationId correlationId, T summary) throws PersistenceException {
        try {
            return write(correlationId, summary);
        } catch (DuplicateKeyException e) {
            log.warn("Concurrent insert detected for {} {}, retrying as update", group.getLabel(), correlationId);
            try {
                return write(correlationId, summary);
            } catch (RuntimeException retryFailure) {
                throw new PersistenceException(group,
                        group.getLabel() + " write failed: " + retryFailure.getMessage(), retryFailure);
            }
        } catch (RuntimeException e) {
            throw new PersistenceException(group, group.getLabel() + " write failed: " + e.getMessage(), e);
        }
    }

    private String write(CorrelationId correlationId, T summary) {
        R record = toRecord(correlationId, summary);
        Instant now = clock.instant();

        Optional<R> existing = findExisting(correlationId.getValue());
        if (existing.isPresent()) {
            record.setId(existing.get().getId());
            record.setCreatedAt(existing.get().getCreatedAt());
            log.info("Updating existing {} {} for hospitalization {}", group.getLabel(), record.getId(),
                    correlationId);
        } else {
            record.setCreatedAt(now);
        }
        record.setUpdatedAt(now);

        R saved = repository.save(record);
        log.debug("Saved {} {} for hospitalization {}", group.getLabel(), saved.getId(), correlationId);
        return saved.getId();
    }

    /**
     * JSON shape of a section, or null when the section is absent.
     */
    protected Map<String, Object> toSection(Object section) {
        if (section == null) {
            return null;
        }
        return objectMapper.convertValue(section, SECTION_TYPE);
    }
}
