package com.prakash.taskmate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskmateApplication {

	public static void main(String[] args) {
		SpringApplication.run(TaskmateApplication.class, args);
	}

}
