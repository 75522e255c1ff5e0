package com.assistrelay.gateway;

import com.assistrelay.observability.DoctorCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.assistrelay")
public class AssistRelayApp {

    private static final Logger log = LoggerFactory.getLogger(AssistRelayApp.class);

    public static void main(String[] args) {
        var ctx = SpringApplication.run(AssistRelayApp.class, args);
        var doctor = ctx.getBean(DoctorCommand.class);
        log.info("Startup checks:\n{}", doctor.run());
    }
}
