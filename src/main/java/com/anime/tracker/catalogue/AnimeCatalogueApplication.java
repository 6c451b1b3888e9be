package com.anime.tracker.catalogue;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AnimeCatalogueApplication {

	public static void main(String[] args) {
		SpringApplication.run(AnimeCatalogueApplication.class, args);
	}

	@Bean
	@Profile("crawl")
	CommandLineRunner runCatalogueCrawl(JobLauncher jobLauncher, Job catalogueCrawlJob) {
		return args -> {
			JobParameters params = new JobParametersBuilder()
					.addString("JobID", String.valueOf(System.currentTimeMillis()))
					.toJobParameters();
			jobLauncher.run(catalogueCrawlJob, params);
		};
	}
}
