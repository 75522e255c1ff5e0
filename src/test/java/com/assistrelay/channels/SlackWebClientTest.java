package com.assistrelay.channels;

import com.assistrelay.shared.error.PlatformException;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.conversations.ConversationsRepliesRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import com.slack.api.methods.response.conversations.ConversationsRepliesResponse;
import com.slack.api.model.Message;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SlackWebClientTest {

    private MethodsClient methods;
    private SlackWebClient client;

    @BeforeEach
    void setUp() {
        methods = mock(MethodsClient.class);
        client = new SlackWebClient(methods);
    }

    @Test
    void lastMessageIsTheNewestReply() throws Exception {
        when(methods.conversationsReplies(any(ConversationsRepliesRequest.class)))
                .thenReturn(replies(message("question"), message("answer")));

        assertEquals("answer", client.lastMessage("C1", "111.222").orElseThrow());

        var captor = ArgumentCaptor.forClass(ConversationsRepliesRequest.class);
        verify(methods).conversationsReplies(captor.capture());
        assertEquals("C1", captor.getValue().getChannel());
        assertEquals("111.222", captor.getValue().getTs());
    }

    @Test
    void emptyThreadHasNoLastMessage() throws Exception {
        when(methods.conversationsReplies(any(ConversationsRepliesRequest.class))).thenReturn(replies());

        assertTrue(client.lastMessage("C1", "111.222").isEmpty());
    }

    @Test
    void slackErrorBecomesPlatformException() throws Exception {
        var response = new ConversationsRepliesResponse();
        response.setOk(false);
        response.setError("channel_not_found");
        when(methods.conversationsReplies(any(ConversationsRepliesRequest.class))).thenReturn(response);

        var ex = assertThrows(PlatformException.class, () -> client.lastMessage("C1", "111.222"));
        assertEquals("channel_not_found", ex.errorCode());
    }

    @Test
    void httpFailureBecomesPlatformException() throws Exception {
        var httpResponse = new Response.Builder()
                .request(new Request.Builder().url("https://slack.com/api/conversations.replies").build())
                .protocol(Protocol.HTTP_1_1)
                .code(503)
                .message("Service Unavailable")
                .build();
        when(methods.conversationsReplies(any(ConversationsRepliesRequest.class)))
                .thenThrow(new SlackApiException(httpResponse, ""));

        var ex = assertThrows(PlatformException.class, () -> client.lastMessage("C1", "111.222"));
        assertEquals(503, ex.statusCode());
    }

    @Test
    void ioFailureBecomesPlatformException() throws Exception {
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenThrow(new IOException("reset"));

        var ex = assertThrows(PlatformException.class, () -> client.postMessage("C1", "111.222", "x"));
        assertEquals("IOException", ex.errorCode());
    }

    @Test
    void postMessageTargetsThread() throws Exception {
        var response = new ChatPostMessageResponse();
        response.setOk(true);
        response.setMessage(message("posted"));
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenReturn(response);

        assertEquals("posted", client.postMessage("C1", "111.222", "hello <u|a>"));

        var captor = ArgumentCaptor.forClass(ChatPostMessageRequest.class);
        verify(methods).chatPostMessage(captor.capture());
        assertEquals("C1", captor.getValue().getChannel());
        assertEquals("111.222", captor.getValue().getThreadTs());
        assertEquals("hello <u|a>", captor.getValue().getText());
    }

    @Test
    void postFailureCarriesErrorCode() throws Exception {
        var response = new ChatPostMessageResponse();
        response.setOk(false);
        response.setError("not_in_channel");
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenReturn(response);

        var ex = assertThrows(PlatformException.class, () -> client.postMessage("C1", "111.222", "x"));
        assertEquals("not_in_channel", ex.errorCode());
    }

    private static ConversationsRepliesResponse replies(Message... messages) {
        var response = new ConversationsRepliesResponse();
        response.setOk(true);
        response.setMessages(List.of(messages));
        return response;
    }

    private static Message message(String text) {
        var message = new Message();
        message.setText(text);
        return message;
    }
}
