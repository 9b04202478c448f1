package com.crewmind;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class CrewmindApplication {

    public static void main(String[] args) {
        // CLI-only: no web server. Spring's shutdown hook stays off so Ctrl-C cannot close
        // the context under a running pipeline; RunCommand cancels and the context closes below.
        ApplicationContext ctx = new SpringApplicationBuilder(CrewmindApplication.class)
                .registerShutdownHook(false)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
