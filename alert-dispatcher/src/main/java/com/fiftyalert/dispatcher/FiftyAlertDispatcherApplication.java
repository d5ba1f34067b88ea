package com.fiftyalert.dispatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FiftyAlertDispatcherApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FiftyAlertDispatcherApplication.class, args)));
    }
}
