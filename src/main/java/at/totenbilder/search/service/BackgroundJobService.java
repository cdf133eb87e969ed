package at.totenbilder.search.service;

import at.totenbilder.search.common.convention.errorcode.SearchErrorCode;
import at.totenbilder.search.common.convention.exception.ClientException;
import at.totenbilder.search.common.convention.exception.ServiceException;
import at.totenbilder.search.config.ImageSearchProperties;
import at.totenbilder.search.dto.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs long jobs off the request thread and keeps their status queryable.
 *
 * <p>Jobs are not deduplicated. The registry keeps the most recent
 * {@code image-search.jobs.history-size} jobs, evicting the oldest finished ones first.</p>
 */
@Slf4j
@Service
public class BackgroundJobService {

    private final Executor executor;
    private final int historySize;

    // insertion ordered, guarded by this
    private final Map<String, JobStatus> jobs = new LinkedHashMap<>();

    public BackgroundJobService(@Qualifier("indexingJobExecutor") Executor executor,
                                ImageSearchProperties properties) {
        this.executor = executor;
        this.historySize = Math.max(1, properties.getJobs().getHistorySize());
    }

    /**
     * Queues a job.
     *
     * @param task produces the job summary; any exception fails the job
     * @return status snapshot at submission
     */
    public JobStatus submit(JobStatus.Type type, String description, Supplier<?> task) {
        JobStatus status = new JobStatus();
        status.setJobId(UUID.randomUUID().toString());
        status.setType(type);
        status.setDescription(description);
        status.setState(JobStatus.State.QUEUED);
        status.setSubmittedAt(Instant.now());
        register(status);

        try {
            executor.execute(() -> run(status.getJobId(), task));
        } catch (RejectedExecutionException e) {
            update(status.getJobId(), job -> {
                job.setState(JobStatus.State.FAILED);
                job.setFinishedAt(Instant.now());
                job.setError("job queue is full");
            });
            log.error("Job {} ({}) rejected: queue is full", status.getJobId(), type);
            throw new ServiceException("Job queue is full, try again later", e, SearchErrorCode.SERVICE_ERROR);
        }
        log.info("Job {} queued: {} {}", status.getJobId(), type, description);
        return find(status.getJobId());
    }

    /**
     * @throws ClientException JOB_NOT_FOUND for unknown or evicted ids
     */
    public synchronized JobStatus find(String jobId) {
        JobStatus status = jobs.get(jobId);
        if (status == null) {
            throw new ClientException("Job '" + jobId + "' not found", SearchErrorCode.JOB_NOT_FOUND);
        }
        return status.copy();
    }

    /**
     * Known jobs, newest first
     */
    public synchronized List<JobStatus> list() {
        List<JobStatus> snapshot = new ArrayList<>(jobs.size());
        for (JobStatus status : jobs.values()) {
            snapshot.add(status.copy());
        }
        Collections.reverse(snapshot);
        return snapshot;
    }

    private void run(String jobId, Supplier<?> task) {
        update(jobId, job -> {
            job.setState(JobStatus.State.RUNNING);
            job.setStartedAt(Instant.now());
        });
        log.info("Job {} started", jobId);
        try {
            Object summary = task.get();
            update(jobId, job -> {
                job.setState(JobStatus.State.SUCCEEDED);
                job.setFinishedAt(Instant.now());
                job.setSummary(summary);
            });
            log.info("Job {} succeeded: {}", jobId, summary);
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            update(jobId, job -> {
                job.setState(JobStatus.State.FAILED);
                job.setFinishedAt(Instant.now());
                job.setError(message);
            });
            log.error("Job {} failed: {}", jobId, message, e);
        }
    }

    private synchronized void register(JobStatus status) {
        jobs.put(status.getJobId(), status);
        evictOverflow();
    }

    private synchronized void update(String jobId, Consumer<JobStatus> change) {
        JobStatus status = jobs.get(jobId);
        if (status != null) {
            change.accept(status);
        }
    }

    private void evictOverflow() {
        Iterator<JobStatus> finished = jobs.values().iterator();
        while (jobs.size() > historySize && finished.hasNext()) {
            if (finished.next().isFinished()) {
                finished.remove();
            }
        }
        Iterator<JobStatus> oldest = jobs.values().iterator();
        while (jobs.size() > historySize && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
