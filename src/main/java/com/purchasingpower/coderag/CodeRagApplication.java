package com.purchasingpower.coderag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CodeRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeRagApplication.class, args);
    }
}
