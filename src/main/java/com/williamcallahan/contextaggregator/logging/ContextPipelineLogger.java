package com.williamcallahan.contextaggregator.logging;

import com.williamcallahan.contextaggregator.service.ContextAggregatorService;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Times the in-process pipeline stages on the {@code PIPELINE} logger.
 */
@Aspect
@Component
public class ContextPipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final String NO_REQUEST = "-";

    @Around("execution(* com.williamcallahan.contextaggregator.application.context.ChunkDeduplicator.deduplicate(..))")
    public Object logDeduplication(ProceedingJoinPoint joinPoint) throws Throwable {
        return timeStage(joinPoint, "STEP 1: DEDUPLICATION");
    }

    @Around("execution(* com.williamcallahan.contextaggregator.application.context.ChunkRanker.rank(..))")
    public Object logRanking(ProceedingJoinPoint joinPoint) throws Throwable {
        return timeStage(joinPoint, "STEP 2: RANKING");
    }

    @Around("execution(* com.williamcallahan.contextaggregator.application.context.ContextAssembler.assemble(..))")
    public Object logAssembly(ProceedingJoinPoint joinPoint) throws Throwable {
        return timeStage(joinPoint, "STEP 3: ASSEMBLY");
    }

    private Object timeStage(ProceedingJoinPoint joinPoint, String stepName) throws Throwable {
        String requestId = currentRequestId();
        long startTime = System.currentTimeMillis();
        PIPELINE_LOG.debug("[{}] {} - Starting", requestId, stepName);
        try {
            Object result = joinPoint.proceed();
            PIPELINE_LOG.info("[{}] {} - Completed in {}ms",
                    requestId, stepName, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] {} - Failed: {}", requestId, stepName, e.getMessage());
            throw e;
        }
    }

    private static String currentRequestId() {
        String requestId = MDC.get(ContextAggregatorService.REQUEST_ID_KEY);
        return requestId == null ? NO_REQUEST : requestId;
    }
}
