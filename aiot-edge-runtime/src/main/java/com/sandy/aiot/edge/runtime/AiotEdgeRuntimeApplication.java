package com.sandy.aiot.edge.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotEdgeRuntimeApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiotEdgeRuntimeApplication.class, args);
	}

}
