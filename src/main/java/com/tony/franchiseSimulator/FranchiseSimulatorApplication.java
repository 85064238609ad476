package com.tony.franchiseSimulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FranchiseSimulatorApplication {

	public static void main(String[] args) {
		SpringApplication.run(FranchiseSimulatorApplication.class, args);
	}

}
