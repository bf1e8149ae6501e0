package com.portfolio.mirror;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class PortfolioMirrorApplication {

	public static void main(String[] args) {
		SpringApplication.run(PortfolioMirrorApplication.class, args);
	}

}
