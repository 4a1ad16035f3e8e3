package com.prospect.linkedin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

@SpringBootApplication
@EnableJpaAuditing
public class LinkedInScraperApplication {

	public static void main(String[] args) {
		SpringApplication.run(LinkedInScraperApplication.class, args);
	}

}
