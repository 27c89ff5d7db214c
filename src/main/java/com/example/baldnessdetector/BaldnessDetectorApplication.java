package com.example.baldnessdetector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BaldnessDetectorApplication {

	public static void main(String[] args) {
		SpringApplication.run(BaldnessDetectorApplication.class, args);
	}

}
