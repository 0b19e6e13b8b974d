package dev.aparikh.eprintviews;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EprintViewsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EprintViewsApplication.class, args);
    }
}
