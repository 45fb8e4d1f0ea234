package com.trendscope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Trendscope - social-media post analysis service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TrendscopeApplication {

	public static void main(String[] args) {
		SpringApplication.run(TrendscopeApplication.class, args);
	}

}
