package com.williamcallahan.notewiki;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NoteWikiApplication {

    public static void main(String[] args) {
        SpringApplication.run(NoteWikiApplication.class, args);
    }
}
