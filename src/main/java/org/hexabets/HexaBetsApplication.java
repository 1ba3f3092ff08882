package org.hexabets;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HexaBetsApplication {
    public static void main(String[] args) {
        SpringApplication.run(HexaBetsApplication.class, args);
    }
}
