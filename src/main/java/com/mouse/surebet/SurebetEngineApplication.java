package com.mouse.surebet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurebetEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(SurebetEngineApplication.class, args);
	}

}
