package com.eainde.specmap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RfqSpecMapperApplication {

    public static void main(String[] args) {
        SpringApplication.run(RfqSpecMapperApplication.class, args);
    }
}
