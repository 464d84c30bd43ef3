package com.medscript;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedScriptApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedScriptApplication.class, args);
    }
}
