package com.eainde.relviz;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Web front end: a form page at {@code /} and the {@code /render} endpoints.
 */
@SpringBootApplication
public class RelvizApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelvizApplication.class, args);
    }
}
