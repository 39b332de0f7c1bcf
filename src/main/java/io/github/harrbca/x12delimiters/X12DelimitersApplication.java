package io.github.harrbca.x12delimiters;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class X12DelimitersApplication {

    public static void main(String[] args) {
        SpringApplication.run(X12DelimitersApplication.class, args);
    }
}
