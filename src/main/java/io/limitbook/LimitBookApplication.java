package io.limitbook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LimitBookApplication {

    public static void main(String[] args) {
        SpringApplication.run(LimitBookApplication.class, args);
    }

}
