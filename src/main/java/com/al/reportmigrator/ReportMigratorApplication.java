package com.al.reportmigrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ReportMigratorApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReportMigratorApplication.class, args);
	}

}
