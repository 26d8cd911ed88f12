package com.example.mediacatalog_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class MediaCatalogBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(MediaCatalogBackendApplication.class, args);
	}

}
