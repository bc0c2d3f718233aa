package com.pharmaintel.service;

import com.pharmaintel.config.RequestIdFilter;
import com.pharmaintel.dto.AsyncJobResponse;
import com.pharmaintel.dto.AsyncJobStatus;
import com.pharmaintel.exception.InventoryIntelligenceException;
import com.pharmaintel.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private final Clock clock;
    private final Map<UUID, RunJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<UUID> finished = new ConcurrentLinkedQueue<>();
    private ExecutorService executor;

    public AsyncJobService(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Function<RunProgressListener, Object> task) {
        RunJob job = new RunJob(UUID.randomUUID(), jobType, requestId, clock.instant());
        jobs.put(job.jobId, job);
        executor.execute(() -> execute(job, task));
        log.info("Job submitted | jobId={} | type={}", job.jobId, jobType);
        return job.jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        RunJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.snapshot();
    }

    private void execute(RunJob job, Function<RunProgressListener, Object> task) {
        if (job.requestId != null) {
            MDC.put(RequestIdFilter.MDC_KEY, job.requestId);
        }
        try {
            job.start(clock.instant());
            Object result = task.apply(job::progress);
            retire(job.jobId);
            job.succeed(result, clock.instant());
            log.info("Job completed | jobId={} | items={}/{}", job.jobId, job.processed, job.total);
        } catch (InventoryIntelligenceException ex) {
            retire(job.jobId);
            job.fail(ex.getErrorCode(), ex.getMessage(), clock.instant());
            log.warn("Job failed | jobId={} | code={} | reason={}", job.jobId, ex.getErrorCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            retire(job.jobId);
            job.fail("INTERNAL_ERROR", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(),
                     clock.instant());
            log.error("Job failed unexpectedly | jobId={}", job.jobId, ex);
        } finally {
            MDC.remove(RequestIdFilter.MDC_KEY);
        }
    }

    // Queued before the final status is published, so eviction order follows completion order.

    private void retire(UUID jobId) {
        finished.add(jobId);
        while (finished.size() > maxRetained) {
            UUID evicted = finished.poll();
            if (evicted != null) {
                jobs.remove(evicted);
            }
        }
    }

    private static final class RunJob {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant submittedAt;
        private Instant startedAt;
        private Instant finishedAt;
        private AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private Integer processed;
        private Integer total;
        private String errorCode;
        private String errorMessage;
        private Object result;

        private RunJob(UUID jobId, String jobType, String requestId, Instant submittedAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.submittedAt = submittedAt;
        }

        private synchronized void start(Instant at) {
            status = AsyncJobStatus.RUNNING;
            startedAt = at;
        }

        private synchronized void progress(int itemsProcessed, int itemsTotal) {
            processed = itemsProcessed;
            total = itemsTotal;
        }

        private synchronized void succeed(Object value, Instant at) {
            status = AsyncJobStatus.COMPLETED;
            result = value;
            finishedAt = at;
        }

        private synchronized void fail(String code, String message, Instant at) {
            status = AsyncJobStatus.FAILED;
            errorCode = code;
            errorMessage = message;
            finishedAt = at;
        }

        private synchronized AsyncJobResponse snapshot() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .requestId(requestId)
                .submittedAt(submittedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .itemsProcessed(processed)
                .itemsTotal(total)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .result(result)
                .build();
        }
    }
}
