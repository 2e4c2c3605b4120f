package com.kernelworx.fundraiserservice.store;

import com.kernelworx.common.exception.ConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Persistable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;

/**
 * Writes that carry a precondition.
 * <p>
 * {@link #insertIfAbsent} issues an INSERT and flushes immediately, so a key
 * that already exists fails right here with a
 * {@link org.springframework.dao.DataIntegrityViolationException} instead of
 * being merged over the existing row. The pipeline turns that into a Conflict.
 */
@Component
public class ConditionalWriter {

    private static final Logger log = LoggerFactory.getLogger(ConditionalWriter.class);

    public <T extends Persistable<ID>, ID> T insertIfAbsent(JpaRepository<T, ID> repository, T entity) {
        if (!entity.isNew()) {
            throw new IllegalStateException("insertIfAbsent requires a new entity, got " + entity.getId());
        }
        T saved = repository.saveAndFlush(entity);
        log.debug("Inserted {} with key {}", entity.getClass().getSimpleName(), saved.getId());
        return saved;
    }

    /**
     * Checks the row count of a conditional UPDATE or DELETE.
     */
    public void requireUpdated(int rowsAffected, String conflictMessage) {
        if (rowsAffected == 0) {
            throw new ConflictException(conflictMessage);
        }
    }
}
