package com.di.mllogs;

import com.di.mllogs.config.EtlProperties;
import com.di.mllogs.exception.EtlException;
import com.di.mllogs.runner.EtlRunnerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(EtlProperties.class)
public class MlLogsEtlApplication {

	static final int EXIT_FAILURE = 1;

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(MlLogsEtlApplication.class, args);
		EtlProperties etlProps = ctx.getBean(EtlProperties.class);
		// With run-on-startup disabled the context only wires the beans (tests, embedding).
		if (!etlProps.isRunOnStartup()) {
			return;
		}
		try {
			ctx.getBean(EtlRunnerService.class).runPipeline();
		} catch (EtlException e) {
			log.error("Pipeline failed, exiting with status {}: {}", EXIT_FAILURE, e.getMessage());
			System.exit(SpringApplication.exit(ctx, () -> EXIT_FAILURE));
		}
		SpringApplication.exit(ctx);
	}
}
