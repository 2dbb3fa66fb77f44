package com.sandy.aiot.pump.incidents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotPumpIncidentsApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiotPumpIncidentsApplication.class, args);
	}

}
