package com.nodewatch.rpcextractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RpcExtractorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RpcExtractorApplication.class, args);
    }
}
