package com.example.workflowcompiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowCompilerApplication.class, args);
    }
}
