package com.assistrelay.gateway;

import com.assistrelay.channels.ChatPlatform;
import com.assistrelay.channels.OutboundNotifier;
import com.assistrelay.channels.SlackWebClient;
import com.assistrelay.dedup.AppendLogDedupStore;
import com.assistrelay.dedup.DedupStore;
import com.assistrelay.dedup.JsonFileDedupStore;
import com.assistrelay.intake.EventIntakeCoordinator;
import com.assistrelay.observability.DoctorCommand;
import com.assistrelay.observability.MetricsConfig;
import com.assistrelay.providers.AssistantRunClient;
import com.assistrelay.providers.OpenAiAssistantClient;
import com.assistrelay.shared.config.ConfigLoader;
import com.assistrelay.shared.config.DedupConfig;
import com.assistrelay.shared.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RelayWiring {

    private static final Logger log = LoggerFactory.getLogger(RelayWiring.class);

    @Bean
    public RelayConfig relayConfig() {
        var config = ConfigLoader.load();
        if (config.assistant().apiKey().isBlank()) {
            log.warn("Assistant API key not configured. Set API_KEY or assistant.api-key in ~/.assistrelay/config.yaml");
        }
        if (config.slack().botToken().isBlank()) {
            log.warn("Slack bot token not configured. Set SLACK_BOT_TOKEN or slack.bot-token");
        }
        return config;
    }

    @Bean
    public MetricsConfig metricsConfig() {
        return new MetricsConfig();
    }

    @Bean
    public DedupStore dedupStore(RelayConfig config) {
        return createDedupStore(config.dedup());
    }

    static DedupStore createDedupStore(DedupConfig dedup) {
        if (DedupConfig.JSON.equals(dedup.store())) {
            return new JsonFileDedupStore(dedup.path());
        }
        return new AppendLogDedupStore(dedup.path(), dedup.legacyPath());
    }

    @Bean
    public AssistantRunClient assistantRunClient(RelayConfig config) {
        return new OpenAiAssistantClient(config.assistant());
    }

    @Bean
    public ChatPlatform chatPlatform(RelayConfig config) {
        return new SlackWebClient(config.slack());
    }

    @Bean
    public OutboundNotifier outboundNotifier(ChatPlatform platform, RelayConfig config, MetricsConfig metrics) {
        return new OutboundNotifier(platform, config.slack().adminMemberId(), metrics);
    }

    @Bean
    public EventIntakeCoordinator eventIntakeCoordinator(DedupStore dedupStore, AssistantRunClient runClient,
                                                         OutboundNotifier notifier, MetricsConfig metrics) {
        return new EventIntakeCoordinator(dedupStore, runClient, notifier, metrics);
    }

    @Bean
    public DoctorCommand doctorCommand(RelayConfig config) {
        return new DoctorCommand(config);
    }
}
