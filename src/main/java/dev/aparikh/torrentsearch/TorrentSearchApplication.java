package dev.aparikh.torrentsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TorrentSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TorrentSearchApplication.class, args);
    }
}
