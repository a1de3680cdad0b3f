package de.leipzig.htwk.gitrdf.shex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(
    scanBasePackages = {
        "de.leipzig.htwk.gitrdf.shex" // This package and all sub-packages
    }
)
public class ShexApplication {
    public static void main(String[] args) {
        SpringApplication.run(ShexApplication.class, args);
    }
}
