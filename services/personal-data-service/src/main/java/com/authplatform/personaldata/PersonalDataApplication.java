package com.authplatform.personaldata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PersonalDataApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PersonalDataApplication.class, args)));
    }
}
