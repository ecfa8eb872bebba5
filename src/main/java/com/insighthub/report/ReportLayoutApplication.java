package com.insighthub.report;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the report layout service.
 * This class lives in the bootstrap layer and should only be used to wire the
 * application context and hand over control to Spring.
 */
@SpringBootApplication
public class ReportLayoutApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(ReportLayoutApplication.class, args);
	}

}
