package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for the beans shared by every report run.
 *
 * <p>
 * The report configuration itself depends on the files named on the command line, so the
 * run specific services are assembled per run with a {@link StatusReportBuilder} seeded
 * from these beans.
 */
@Configuration
public class StatusReportConfig {

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public ReportConfigurationLoader reportConfigurationLoader() {
		return new ReportConfigurationLoader();
	}

	@Bean
	public ArgumentParser argumentParser() {
		return new ArgumentParser();
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

}
