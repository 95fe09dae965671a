package io.chronolayout.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.chronolayout")
public class ClApplication {
    public static void main(String[] args) {
        SpringApplication.run(ClApplication.class, args);
    }
}
