package com.example.pdfhandler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point.
 * Wires the merge/split engines and exposes them through the JSON API under the interfaces layer.
 * Scheduling is enabled for the eviction of finished batch jobs.
 */
@SpringBootApplication
@EnableScheduling
public class PdfHandlerApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(PdfHandlerApplication.class, args);
	}

}
