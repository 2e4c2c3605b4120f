package com.kernelworx.fundraiserservice.pipeline;

import com.kernelworx.common.exception.ConflictException;
import com.kernelworx.common.exception.FundraiserException;
import com.kernelworx.common.exception.InternalErrorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Maps store failures to domain errors. Failed preconditions (duplicate keys,
 * integrity violations, stale versions) become Conflict; everything else is
 * an internal error whose details stay in the log.
 */
@Component
public class StoreErrorTranslator {

    private static final Logger log = LoggerFactory.getLogger(StoreErrorTranslator.class);

    public FundraiserException translate(DataAccessException ex, String operation) {
        if (ex instanceof DataIntegrityViolationException || ex instanceof OptimisticLockingFailureException) {
            log.warn("Conditional write rejected during {}: {}", operation, ex.getMostSpecificCause().getMessage());
            return new ConflictException("The resource was modified or already exists", ex);
        }
        log.error("Store failure during {}", operation, ex);
        return new InternalErrorException("An unexpected storage error occurred", ex);
    }
}
