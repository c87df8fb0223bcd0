package com.example.echocheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Application entry point for the EchoCheck ingestion service.
 * This class lives in the bootstrap layer and should only be used to wire the
 * application context and hand over control to Spring.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class EchoCheckApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(EchoCheckApplication.class, args);
	}

}
