package de.htwsaar.offlinecache.worker;

import de.htwsaar.offlinecache.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;

@SpringBootApplication
@Import(LoggingConfig.class)
@Profile("worker")
public class WorkerApp {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(WorkerApp.class);
        app.setAdditionalProfiles("worker");
        app.run(args);
    }
}
