package com.conveyor.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class EngineApplication {

    /**
     * Server mode (default): REST API plus the run scheduler.
     *
     * CLI mode runs the pipeline once and exits with its status code:
     *   java -jar conveyor-engine.jar --spring.profiles.active=cli \
     *     --param.PROJECT_VERSION=1.4.0 --param.TRIVY_SEVERITY=LOW,MEDIUM
     */
    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(EngineApplication.class, args);
        if (ctx.getEnvironment().getProperty("conveyor.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(ctx));
        }
    }
}
