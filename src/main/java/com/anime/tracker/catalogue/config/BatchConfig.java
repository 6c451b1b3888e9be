package com.anime.tracker.catalogue.config;

import com.anime.tracker.catalogue.batch.CatalogueListingProcessor;
import com.anime.tracker.catalogue.batch.CatalogueListingReader;
import com.anime.tracker.catalogue.crawler.ListingItemPayload;
import com.anime.tracker.catalogue.model.CrawledAnime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

@Slf4j
@Configuration
public class BatchConfig {
    public static final String CATALOGUE_CRAWL_JOB = "catalogueCrawlJob";

    @Bean
    public Job catalogueCrawlJob(JobRepository jobRepository, Step catalogueCrawlStep) {
        return new JobBuilder(CATALOGUE_CRAWL_JOB, jobRepository)
                .start(catalogueCrawlStep)
                .build();
    }

    // Rows are upserted by the processor; the writer only reports chunk progress.
    @Bean
    public Step catalogueCrawlStep(JobRepository jobRepository,
                                   PlatformTransactionManager transactionManager,
                                   CatalogueListingReader reader,
                                   CatalogueListingProcessor processor,
                                   @Value("${app.crawl.chunk-size:10}") int chunkSize) {
        return new StepBuilder("catalogueCrawlStep", jobRepository)
                .<ListingItemPayload, CrawledAnime>chunk(chunkSize, transactionManager)
                .reader(reader)
                .processor(processor)
                .writer(chunk -> log.debug("Stored {} crawled anime", chunk.size()))
                .build();
    }
}
