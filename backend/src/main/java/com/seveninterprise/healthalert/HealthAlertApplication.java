package com.seveninterprise.healthalert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HealthAlertApplication {

	public static void main(String[] args) {
		SpringApplication.run(HealthAlertApplication.class, args);
	}

}
