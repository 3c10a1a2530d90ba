package com.sandcastle;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class SandcastleApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(SandcastleApplication.class)
                .properties("spring.main.banner-mode=off")
                .run(args);
    }
}
