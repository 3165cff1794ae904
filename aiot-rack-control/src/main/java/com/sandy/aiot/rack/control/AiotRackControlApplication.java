package com.sandy.aiot.rack.control;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotRackControlApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiotRackControlApplication.class, args);
	}

}
