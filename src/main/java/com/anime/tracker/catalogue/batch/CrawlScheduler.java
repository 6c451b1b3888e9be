package com.anime.tracker.catalogue.batch;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.crawl", name = "enabled", havingValue = "true")
public class CrawlScheduler {
    private final JobLauncher jobLauncher;
    private final Job catalogueCrawlJob;

    public CrawlScheduler(JobLauncher jobLauncher, Job catalogueCrawlJob) {
        this.jobLauncher = jobLauncher;
        this.catalogueCrawlJob = catalogueCrawlJob;
    }

    @Scheduled(cron = "${app.crawl.cron:0 0 4 * * *}", zone = "${app.crawl.zone:UTC}")
    public void runCatalogueCrawl() throws Exception {
        JobParameters params = new JobParametersBuilder()
                .addString("JobID", String.valueOf(System.currentTimeMillis()))
                .toJobParameters();
        jobLauncher.run(catalogueCrawlJob, params);
    }
}
