package com.jacobsonmt.contributions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContributionsApplication {

    public static void main( String[] args ) {
        SpringApplication.run( ContributionsApplication.class, args );
    }

}
