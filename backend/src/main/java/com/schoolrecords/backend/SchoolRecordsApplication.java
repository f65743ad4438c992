package com.schoolrecords.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchoolRecordsApplication {

	public static void main(String[] args) {
		// Academic dates and audit timestamps are all recorded in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(SchoolRecordsApplication.class, args);
	}

}
