package com.assistrelay.channels;

import com.assistrelay.format.LinkFormatter;
import com.assistrelay.observability.MetricsConfig;
import com.assistrelay.shared.error.PlatformException;
import com.assistrelay.shared.error.RelayException;
import com.assistrelay.shared.model.NotifyOutcome;
import com.assistrelay.shared.model.OutboundReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Posts a reply into a thread unless the thread's newest message already says the same thing.
 * A failed post is reported to the administrator in the same thread and then rethrown.
 */
public class OutboundNotifier {

    private static final Logger log = LoggerFactory.getLogger(OutboundNotifier.class);

    private final ChatPlatform platform;
    private final String adminMemberId;
    private final MetricsConfig metrics;

    public OutboundNotifier(ChatPlatform platform, String adminMemberId, MetricsConfig metrics) {
        this.platform = platform;
        this.adminMemberId = adminMemberId;
        this.metrics = metrics;
    }

    public NotifyOutcome sendIfNew(String channelId, String threadTs, String text) {
        var reply = new OutboundReply(channelId, threadTs, LinkFormatter.formatLinks(text));
        log.info("Preparing to send response to channel {}, thread {}: {}", channelId, threadTs, reply.text());

        var last = lastMessage(reply);
        if (last.isPresent() && last.get().equals(reply.text())) {
            log.info("Duplicate message detected, not sending: {}", reply.text());
            metrics.repliesSuppressed().increment();
            return NotifyOutcome.SUPPRESSED;
        }

        try {
            platform.postMessage(reply.channelId(), reply.threadTs(), reply.text());
            return NotifyOutcome.SENT;
        } catch (RuntimeException e) {
            var description = "Error sending message to Slack: " + describe(e);
            log.error(description, e);
            alertAdmin(reply, description, e);
            throw e;
        }
    }

    private Optional<String> lastMessage(OutboundReply reply) {
        try {
            return platform.lastMessage(reply.channelId(), reply.threadTs());
        } catch (RelayException e) {
            log.error("Error fetching last message: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void alertAdmin(OutboundReply reply, String description, RuntimeException original) {
        var mention = adminMemberId == null || adminMemberId.isBlank() ? "" : "<@" + adminMemberId + "> ";
        try {
            platform.postMessage(reply.channelId(), reply.threadTs(), mention + description);
        } catch (RuntimeException alertFailure) {
            log.error("Failed to alert administrator about send failure", alertFailure);
            original.addSuppressed(alertFailure);
        }
    }

    private static String describe(RuntimeException e) {
        return e instanceof PlatformException pe ? pe.errorCode() : e.getMessage();
    }
}
