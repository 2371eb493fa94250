package com.phillippitts.resumeguard;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RecoveryProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class ResumeGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeGuardApplication.class, args);
    }

}
