package com.example.pdfrewriter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfRewriterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfRewriterApplication.class, args);
    }

}
