package com.boxsort;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class BoxSortApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoxSortApplication.class, args);
    }
}
