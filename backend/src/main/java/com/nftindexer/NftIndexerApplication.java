package com.nftindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NftIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NftIndexerApplication.class, args);
    }
}
