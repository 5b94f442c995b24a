package com.songbook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SongbookApplication {
    public static void main(String[] args) {
        SpringApplication.run(SongbookApplication.class, args);
    }
}
