package com.assistrelay.gateway.http;

import com.assistrelay.intake.EventIntakeCoordinator;
import com.assistrelay.observability.DoctorCommand;
import com.assistrelay.shared.model.WebhookReply;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SlackEventController {

    private static final Logger log = LoggerFactory.getLogger(SlackEventController.class);
    static final String RETRY_HEADER = "X-Slack-Retry-Num";

    private final EventIntakeCoordinator coordinator;
    private final DoctorCommand doctor;

    public SlackEventController(EventIntakeCoordinator coordinator, DoctorCommand doctor) {
        this.coordinator = coordinator;
        this.doctor = doctor;
    }

    @PostMapping(value = "/slack", produces = MediaType.APPLICATION_JSON_VALUE)
    public WebhookReply slack(@RequestBody JsonNode body,
                              @RequestHeader(value = RETRY_HEADER, required = false) String retryNum) {
        log.debug("Received request: {}", body);
        return coordinator.handle(body, retryNum);
    }

    @GetMapping(value = "/doctor", produces = MediaType.TEXT_PLAIN_VALUE)
    public String doctor() {
        return doctor.run();
    }
}
