package net.kairos.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KairosSchedulerApplication {
    public static void main(String[] args) {
        SpringApplication.run(KairosSchedulerApplication.class, args);
    }
}
