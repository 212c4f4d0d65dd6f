package com.nexflow.nexflow_compiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NexflowCompilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NexflowCompilerApplication.class, args);
    }
}
