package org.example.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookAnalysisApplication.class, args);
    }
}
