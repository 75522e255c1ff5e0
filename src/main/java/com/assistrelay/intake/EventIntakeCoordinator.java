package com.assistrelay.intake;

import com.assistrelay.channels.OutboundNotifier;
import com.assistrelay.dedup.DedupStore;
import com.assistrelay.observability.MetricsConfig;
import com.assistrelay.providers.AssistantRunClient;
import com.assistrelay.shared.error.PersistenceException;
import com.assistrelay.shared.error.RelayException;
import com.assistrelay.shared.error.StructuralException;
import com.assistrelay.shared.error.TransportException;
import com.assistrelay.shared.model.InboundEvent;
import com.assistrelay.shared.model.WebhookReply;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one Slack Events API delivery: answers the URL handshake, drops platform retries and
 * already-seen events, claims the event, then runs it through the assistant and posts whatever
 * comes out (answer or failure description) back into the thread.
 *
 * <p>An event is claimed before any work starts and is never released, so a delivery that fails
 * midway is not picked up again.
 */
public class EventIntakeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(EventIntakeCoordinator.class);

    static final String URL_VERIFICATION = "url_verification";
    static final String ALREADY_PROCESSED = "Event already processed";

    private final DedupStore dedupStore;
    private final AssistantRunClient runClient;
    private final OutboundNotifier notifier;
    private final MetricsConfig metrics;

    public EventIntakeCoordinator(DedupStore dedupStore, AssistantRunClient runClient,
                                  OutboundNotifier notifier, MetricsConfig metrics) {
        this.dedupStore = dedupStore;
        this.runClient = runClient;
        this.notifier = notifier;
        this.metrics = metrics;
    }

    public WebhookReply handle(JsonNode body, String retryHeader) {
        if (URL_VERIFICATION.equals(body.path("type").asText(null))) {
            return WebhookReply.challenge(body.path("challenge").asText(null));
        }

        var event = InboundEvent.fromEnvelope(body, retryHeader);
        log.info("Processing event {} from channel {}, thread {}", event.eventId(), event.channelId(), event.threadTs());
        metrics.eventsReceived().increment();

        if (event.retry()) {
            log.info("Retry request received: {}", retryHeader);
            return WebhookReply.ok();
        }
        if (event.eventId() == null || event.eventId().isBlank()) {
            log.warn("Rejecting event without event_id");
            return WebhookReply.error("Missing event_id");
        }
        if (dedupStore.contains(event.eventId()) || !dedupStore.tryClaim(event.eventId())) {
            log.info("Event {} already processed", event.eventId());
            metrics.eventsDuplicate().increment();
            return WebhookReply.ok(ALREADY_PROCESSED);
        }

        return execute(event);
    }

    private WebhookReply execute(InboundEvent event) {
        try {
            var run = runClient.createRun(event.text());
            var sample = Timer.start(metrics.registry());
            var status = runClient.pollUntilTerminal(run.threadId());
            sample.stop(metrics.runLatency());

            if (status.isCompleted()) {
                var answer = runClient.fetchLatestMessage(run.threadId());
                notifier.sendIfNew(event.channelId(), event.threadTs(), answer);
                metrics.runsCompleted().increment();
                return WebhookReply.ok();
            }

            metrics.runsFailed().increment();
            var failure = "Run failed with status: " + status;
            log.warn("Event {}: {}", event.eventId(), failure);
            notifyQuietly(event, failure);
            return WebhookReply.error(failure);
        } catch (RelayException e) {
            metrics.runsFailed().increment();
            log.error("Event {} failed ({})", event.eventId(), kind(e), e);
            return fail(event, e);
        } catch (RuntimeException e) {
            metrics.runsFailed().increment();
            log.error("Event {} failed unexpectedly", event.eventId(), e);
            return fail(event, e);
        }
    }

    private WebhookReply fail(InboundEvent event, RuntimeException e) {
        var message = "Error: " + e.getMessage();
        notifyQuietly(event, message);
        return WebhookReply.error(message);
    }

    // a cancelled poll leaves the interrupt flag set; the notice must still go out over HTTP
    private void notifyQuietly(InboundEvent event, String text) {
        boolean interrupted = Thread.interrupted();
        try {
            notifier.sendIfNew(event.channelId(), event.threadTs(), text);
        } catch (RuntimeException e) {
            log.error("Could not report failure of event {} to thread {}", event.eventId(), event.threadTs(), e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static String kind(RelayException e) {
        if (e instanceof StructuralException) return "structural";
        if (e instanceof TransportException) return "transport";
        if (e instanceof PersistenceException) return "persistence";
        return "relay";
    }
}
