package com.williamcallahan.actdb.logging;

import com.williamcallahan.actdb.amender.AppliableModification;
import com.williamcallahan.actdb.service.AmendmentOutcome;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs each step of the amendment pipeline on the {@code PIPELINE} logger, with timings.
 */
@Aspect
@Component
public class AmendmentPipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    // Thread-local storage for run tracking
    private static final ThreadLocal<String> RUN_ID = ThreadLocal.withInitial(() ->
        "RUN-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId()
    );

    /**
     * Log recalculation of a date range
     */
    @Around("execution(* com.williamcallahan.actdb.service.RecalculationService.recalculate(..))")
    public Object logRecalculation(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = RUN_ID.get();
        long startTime = System.currentTimeMillis();
        Object[] args = joinPoint.getArgs();

        PIPELINE_LOG.info("[{}] RECALCULATION {} -> {} - Starting", runId, args[0], args[1]);
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.info("[{}] RECALCULATION - Completed in {}ms", runId, duration);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] RECALCULATION - Failed: {}", runId, e.getMessage());
            throw e;
        } finally {
            RUN_ID.remove();
        }
    }

    /**
     * Log extraction of the modifications of one act
     */
    @Around("execution(* com.williamcallahan.actdb.amender.ModificationExtractor.extract(..))")
    public Object logExtraction(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = RUN_ID.get();
        Object[] args = joinPoint.getArgs();

        PIPELINE_LOG.debug("[{}] STEP 1: EXTRACTION - {} on {}", runId, args[0], args[1]);
        try {
            Object result = joinPoint.proceed();
            if (result instanceof List<?> modifications && !modifications.isEmpty()) {
                PIPELINE_LOG.info("[{}] STEP 1: EXTRACTION - {} modifications from {} on {}",
                    runId, modifications.size(), args[0], args[1]);
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 1: EXTRACTION - Failed for {}: {}", runId, args[0], e.getMessage());
            throw e;
        }
    }

    /**
     * Log application of a single modification
     */
    @Around("execution(* com.williamcallahan.actdb.amender.apply.ModificationApplier.apply(..))")
    public Object logApplication(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = RUN_ID.get();
        long startTime = System.currentTimeMillis();
        Object[] args = joinPoint.getArgs();
        AppliableModification modification = (AppliableModification) args[1];
        String kind = modification.modification().getClass().getSimpleName();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.debug("[{}] STEP 2: APPLICATION - {} applied to {} in {}ms",
                runId, kind, args[0], duration);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 2: APPLICATION - {} on {} failed (cause: {}): {}",
                runId, kind, args[0], modification.cause(), e.getMessage());
            throw e;
        }
    }

    /**
     * Log the summary of one recalculated date
     */
    @Around("execution(* com.williamcallahan.actdb.service.AmendmentApplicationDriver.applyDate(..))")
    public Object logDate(ProceedingJoinPoint joinPoint) throws Throwable {
        String runId = RUN_ID.get();
        long startTime = System.currentTimeMillis();

        Object result = joinPoint.proceed();
        long duration = System.currentTimeMillis() - startTime;
        if (result instanceof AmendmentOutcome outcome) {
            PIPELINE_LOG.info("[{}] DATE {} - {} acts amended, {} failures in {}ms ({})",
                runId, outcome.date(), outcome.amendedActs().size(), outcome.failures().size(),
                duration, outcome.status());
        }
        return result;
    }
}
