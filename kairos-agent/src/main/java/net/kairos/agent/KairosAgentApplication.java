package net.kairos.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KairosAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(KairosAgentApplication.class, args);
    }
}
