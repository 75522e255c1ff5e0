package com.assistrelay.channels;

import com.assistrelay.shared.config.SlackConfig;
import com.assistrelay.shared.error.PlatformException;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.SlackApiTextResponse;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.conversations.ConversationsRepliesRequest;
import com.slack.api.util.http.SlackHttpClient;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

public class SlackWebClient implements ChatPlatform {

    private static final Logger log = LoggerFactory.getLogger(SlackWebClient.class);

    private final MethodsClient methods;

    public SlackWebClient(SlackConfig config) {
        this(createMethodsClient(config));
    }

    public SlackWebClient(MethodsClient methods) {
        this.methods = methods;
    }

    private static MethodsClient createMethodsClient(SlackConfig config) {
        var sdkConfig = new com.slack.api.SlackConfig();
        sdkConfig.setMethodsEndpointUrlPrefix(config.baseUrl().replaceAll("/+$", "") + "/");
        var httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(config.timeoutSeconds()))
                .build();
        return Slack.getInstance(sdkConfig, new SlackHttpClient(httpClient)).methods(config.botToken());
    }

    @Override
    public Optional<String> lastMessage(String channelId, String threadTs) {
        log.info("Fetching last message from channel {}, thread {}", channelId, threadTs);
        var request = ConversationsRepliesRequest.builder()
                .channel(channelId)
                .ts(threadTs)
                .build();
        var response = call("conversations.replies", () -> methods.conversationsReplies(request));
        var messages = response.getMessages();
        if (messages == null || messages.isEmpty()) {
            return Optional.empty();
        }
        var text = messages.get(messages.size() - 1).getText();
        var last = text != null ? text : "";
        log.info("Last message: {}", last);
        return Optional.of(last);
    }

    @Override
    public String postMessage(String channelId, String threadTs, String text) {
        var request = ChatPostMessageRequest.builder()
                .channel(channelId)
                .threadTs(threadTs)
                .text(text)
                .build();
        var response = call("chat.postMessage", () -> methods.chatPostMessage(request));
        var posted = response.getMessage() != null && response.getMessage().getText() != null
                ? response.getMessage().getText()
                : text;
        log.info("Message sent to Slack: {}", posted);
        return posted;
    }

    private <T extends SlackApiTextResponse> T call(String method, SlackCall<T> call) {
        T response;
        try {
            response = call.execute();
        } catch (SlackApiException e) {
            var error = e.getError() != null && e.getError().getError() != null
                    ? e.getError().getError()
                    : "http_" + e.getResponse().code();
            throw new PlatformException(method, error, e.getResponse().code());
        } catch (IOException e) {
            throw new PlatformException(method, e);
        }
        if (!response.isOk()) {
            var error = response.getError() != null ? response.getError() : "unknown_error";
            throw new PlatformException(method, error, 200);
        }
        return response;
    }

    @FunctionalInterface
    private interface SlackCall<T> {
        T execute() throws IOException, SlackApiException;
    }
}
