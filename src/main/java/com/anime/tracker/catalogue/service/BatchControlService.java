package com.anime.tracker.catalogue.service;

import com.anime.tracker.catalogue.config.BatchConfig;
import com.anime.tracker.catalogue.model.BatchJobView;
import com.anime.tracker.catalogue.model.BatchStartResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobInstance;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.launch.JobExecutionNotRunningException;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.batch.core.launch.NoSuchJobExecutionException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lists, starts and stops the catalogue batch jobs.
 */
@Slf4j
@Service
public class BatchControlService {
    private static final Map<String, String> JOB_LABELS = Map.of(
            BatchConfig.CATALOGUE_CRAWL_JOB, "Catalogue Crawl"
    );

    private final JobLauncher jobLauncher;
    private final JobExplorer jobExplorer;
    private final JobOperator jobOperator;
    private final Map<String, Job> jobsByBatchName;

    public BatchControlService(JobLauncher jobLauncher,
                               JobExplorer jobExplorer,
                               JobOperator jobOperator,
                               Map<String, Job> jobsByName) {
        this.jobLauncher = jobLauncher;
        this.jobExplorer = jobExplorer;
        this.jobOperator = jobOperator;
        this.jobsByBatchName = new HashMap<>();
        for (Job job : jobsByName.values()) {
            jobsByBatchName.put(job.getName(), job);
        }
    }

    public List<BatchJobView> listJobs() {
        return JOB_LABELS.keySet().stream()
                .sorted()
                .map(this::toView)
                .toList();
    }

    public BatchJobView getJob(String jobName) {
        assertKnownJob(jobName);
        return toView(jobName);
    }

    public BatchStartResponse startJob(String jobName) throws Exception {
        assertKnownJob(jobName);
        Job job = jobsByBatchName.get(jobName);
        if (job == null) {
            throw new IllegalArgumentException("Job is not configured: " + jobName);
        }

        Set<JobExecution> running = jobExplorer.findRunningJobExecutions(jobName);
        if (!running.isEmpty()) {
            Long runningId = running.stream().map(JobExecution::getId).max(Comparator.naturalOrder()).orElse(null);
            throw new IllegalStateException("Job is already running (executionId=" + runningId + ")");
        }

        JobParameters params = new JobParametersBuilder()
                .addLong("startedAt", System.currentTimeMillis())
                .toJobParameters();
        JobExecution execution = jobLauncher.run(job, params);
        log.info("Started {} (executionId={})", jobName, execution.getId());
        return new BatchStartResponse(jobName, execution.getId(), "Started");
    }

    public BatchStartResponse stopJob(String jobName) throws Exception {
        assertKnownJob(jobName);
        JobExecution target = jobExplorer.findRunningJobExecutions(jobName).stream()
                .max(Comparator.comparingLong(JobExecution::getId))
                .orElseThrow(() -> new IllegalStateException("Job is not running: " + jobName));
        if (target.getStatus() == BatchStatus.STOPPING) {
            return new BatchStartResponse(jobName, target.getId(), "Stop already requested");
        }

        boolean accepted;
        try {
            accepted = jobOperator.stop(target.getId());
        } catch (JobExecutionNotRunningException ex) {
            throw new IllegalStateException("Job is not running (executionId=" + target.getId() + ")");
        } catch (NoSuchJobExecutionException ex) {
            throw new IllegalStateException("Unknown job execution (executionId=" + target.getId() + ")");
        }
        if (!accepted) {
            throw new IllegalStateException("Stop request was not accepted (executionId=" + target.getId() + ")");
        }
        log.info("Stop requested for {} (executionId={})", jobName, target.getId());
        return new BatchStartResponse(jobName, target.getId(), "Stop requested");
    }

    private BatchJobView toView(String jobName) {
        Optional<JobExecution> execution = jobExplorer.findRunningJobExecutions(jobName).stream()
                .max(Comparator.comparingLong(JobExecution::getId))
                .or(() -> latestExecution(jobName));

        String label = JOB_LABELS.get(jobName);
        if (execution.isEmpty()) {
            return new BatchJobView(jobName, label, false, null, "NEVER_RUN", null, null, null, 0, 0, 0, 0);
        }

        JobExecution latest = execution.get();
        long readCount = 0;
        long writeCount = 0;
        long filterCount = 0;
        long skipCount = 0;
        for (StepExecution stepExecution : latest.getStepExecutions()) {
            readCount += stepExecution.getReadCount();
            writeCount += stepExecution.getWriteCount();
            filterCount += stepExecution.getFilterCount();
            skipCount += stepExecution.getSkipCount();
        }
        return new BatchJobView(
                jobName,
                label,
                latest.isRunning(),
                latest.getId(),
                latest.getStatus().name(),
                latest.getExitStatus() == null ? null : latest.getExitStatus().getExitCode(),
                latest.getStartTime(),
                latest.getEndTime(),
                readCount,
                writeCount,
                filterCount,
                skipCount
        );
    }

    private Optional<JobExecution> latestExecution(String jobName) {
        List<JobInstance> instances = jobExplorer.getJobInstances(jobName, 0, 1);
        if (instances.isEmpty()) {
            return Optional.empty();
        }
        return jobExplorer.getJobExecutions(instances.get(0)).stream()
                .max(Comparator.comparingLong(JobExecution::getId));
    }

    private void assertKnownJob(String jobName) {
        if (!JOB_LABELS.containsKey(jobName)) {
            throw new IllegalArgumentException("Unknown job: " + jobName);
        }
    }
}
