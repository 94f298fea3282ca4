package com.transitgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

/**
 * Transit Quality Gate - validation and severity gating for tabular transport datasets.
 * <p>
 * With a dataset argument the application runs once and exits with the gate's status;
 * without one it serves the HTTP API.
 * </p>
 */
@SpringBootApplication
public class TransitGateApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(TransitGateApplication.class);
		if (hasDatasetArgument(args)) {
			application.setWebApplicationType(WebApplicationType.NONE);
			System.exit(SpringApplication.exit(application.run(args)));
		}
		application.run(args);
	}

	static boolean hasDatasetArgument(String[] args) {
		return Arrays.stream(args).anyMatch(arg -> !arg.startsWith("--"));
	}

}
