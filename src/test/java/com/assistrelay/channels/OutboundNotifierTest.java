package com.assistrelay.channels;

import com.assistrelay.observability.MetricsConfig;
import com.assistrelay.shared.error.PlatformException;
import com.assistrelay.shared.model.NotifyOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OutboundNotifierTest {

    private ChatPlatform platform;
    private MetricsConfig metrics;
    private OutboundNotifier notifier;

    @BeforeEach
    void setUp() {
        platform = mock(ChatPlatform.class);
        metrics = new MetricsConfig();
        notifier = new OutboundNotifier(platform, "UADMIN", metrics);
    }

    @Test
    void suppressesWhenLastMessageMatchesFormattedText() {
        when(platform.lastMessage("C1", "111.222")).thenReturn(Optional.of("see <http://x/y|docs>"));

        var outcome = notifier.sendIfNew("C1", "111.222", "see [docs](http://x/y)");

        assertEquals(NotifyOutcome.SUPPRESSED, outcome);
        verify(platform, never()).postMessage(anyString(), anyString(), anyString());
        assertEquals(1.0, metrics.repliesSuppressed().count());
    }

    @Test
    void sendsWhenLastMessageDiffersByOneCharacter() {
        when(platform.lastMessage("C1", "111.222")).thenReturn(Optional.of("hello!"));

        var outcome = notifier.sendIfNew("C1", "111.222", "hello");

        assertEquals(NotifyOutcome.SENT, outcome);
        verify(platform).postMessage("C1", "111.222", "hello");
    }

    @Test
    void sendsFormattedTextWhenThreadIsEmpty() {
        when(platform.lastMessage("C1", "111.222")).thenReturn(Optional.empty());

        notifier.sendIfNew("C1", "111.222", "[a](u)");

        verify(platform).postMessage("C1", "111.222", "<u|a>");
    }

    @Test
    void lookupFailureDoesNotBlockSending() {
        when(platform.lastMessage("C1", "111.222"))
                .thenThrow(new PlatformException("conversations.replies", "channel_not_found", 200));

        var outcome = notifier.sendIfNew("C1", "111.222", "hi");

        assertEquals(NotifyOutcome.SENT, outcome);
        verify(platform).postMessage("C1", "111.222", "hi");
    }

    @Test
    void sendFailureAlertsAdminAndRethrows() {
        when(platform.lastMessage("C1", "111.222")).thenReturn(Optional.empty());
        var failure = new PlatformException("chat.postMessage", "msg_too_long", 200);
        when(platform.postMessage("C1", "111.222", "hi")).thenThrow(failure);

        var thrown = assertThrows(PlatformException.class, () -> notifier.sendIfNew("C1", "111.222", "hi"));

        assertSame(failure, thrown);
        verify(platform).postMessage("C1", "111.222", "<@UADMIN> Error sending message to Slack: msg_too_long");
    }

    @Test
    void failedAdminAlertIsAttachedToOriginalError() {
        when(platform.lastMessage(anyString(), anyString())).thenReturn(Optional.empty());
        var failure = new PlatformException("chat.postMessage", "not_in_channel", 200);
        var alertFailure = new PlatformException("chat.postMessage", "ratelimited", 200);
        when(platform.postMessage(eq("C1"), eq("111.222"), anyString())).thenThrow(failure, alertFailure);

        var thrown = assertThrows(PlatformException.class, () -> notifier.sendIfNew("C1", "111.222", "hi"));

        assertSame(failure, thrown);
        assertSame(alertFailure, thrown.getSuppressed()[0]);
    }

    @Test
    void alertWithoutAdminHasNoMention() {
        var quiet = new OutboundNotifier(platform, "", metrics);
        when(platform.lastMessage(anyString(), anyString())).thenReturn(Optional.empty());
        when(platform.postMessage("C1", "111.222", "hi"))
                .thenThrow(new PlatformException("chat.postMessage", "is_archived", 200));

        assertThrows(PlatformException.class, () -> quiet.sendIfNew("C1", "111.222", "hi"));

        verify(platform).postMessage("C1", "111.222", "Error sending message to Slack: is_archived");
    }
}
