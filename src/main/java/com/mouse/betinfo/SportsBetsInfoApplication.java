package com.mouse.betinfo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class SportsBetsInfoApplication {

    public static void main(String[] args) {
        if (args.length == 0 || args[0].startsWith("--")) {
            SpringApplication.run(SportsBetsInfoApplication.class, args);
            return;
        }
        // A command runs once without the web server, then exits with its own code.
        ConfigurableApplicationContext context = new SpringApplicationBuilder(SportsBetsInfoApplication.class)
                .web(WebApplicationType.NONE)
                .run(args);
        System.exit(SpringApplication.exit(context));
    }
}
