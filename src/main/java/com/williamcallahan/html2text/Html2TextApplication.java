package com.williamcallahan.html2text;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class Html2TextApplication {

    public static void main(String[] args) {
        SpringApplication.run(Html2TextApplication.class, args);
    }

}
