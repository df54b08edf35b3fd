package com.myorg.docinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocInsightApplication.class, args);
    }
}
