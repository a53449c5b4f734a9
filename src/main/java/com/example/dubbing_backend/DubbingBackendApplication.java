package com.example.dubbing_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class DubbingBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(DubbingBackendApplication.class, args);
	}

}
