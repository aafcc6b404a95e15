package com.Unthinkable.TaskAssigner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TaskAssignerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskAssignerApplication.class, args);
    }
}
