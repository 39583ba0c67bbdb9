package com.example.placescout_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class PlaceScoutBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(PlaceScoutBackendApplication.class, args);
	}

}
