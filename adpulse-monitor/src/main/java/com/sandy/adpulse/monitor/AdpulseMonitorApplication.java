package com.sandy.adpulse.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AdpulseMonitorApplication {

	public static void main(String[] args) {
		SpringApplication.run(AdpulseMonitorApplication.class, args);
	}

}
