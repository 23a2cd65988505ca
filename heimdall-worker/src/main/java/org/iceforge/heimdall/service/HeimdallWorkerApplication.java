package org.iceforge.heimdall.service;

import org.iceforge.heimdall.service.config.HeimdallProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(HeimdallProperties.class)
public class HeimdallWorkerApplication {

	public static void main(String[] args) {
		SpringApplication.run(HeimdallWorkerApplication.class, args);
	}
}
