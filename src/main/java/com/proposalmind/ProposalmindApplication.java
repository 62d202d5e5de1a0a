package com.proposalmind;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class ProposalmindApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(ProposalmindApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off")
                .run(args);
    }
}
