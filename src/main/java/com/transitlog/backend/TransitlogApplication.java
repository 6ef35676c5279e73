package com.transitlog.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransitlogApplication {

	public static void main(String[] args) {
		SpringApplication.run(TransitlogApplication.class, args);
	}

}
