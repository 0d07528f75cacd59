package com.copytraderadar.notification.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outbound chat notifications. Documented in application.yml under copytrade.notification.
 */
@ConfigurationProperties(prefix = "copytrade.notification")
@Getter
@Setter
public class NotificationProperties {

    private Telegram telegram = new Telegram();

    /**
     * Network id as sent by the webhook (e.g. "base-mainnet") -> display name and explorer link.
     * Networks not listed are shown by their raw id, without a link.
     */
    private Map<String, Network> networks = defaultNetworks();

    private static Map<String, Network> defaultNetworks() {
        Map<String, Network> m = new LinkedHashMap<>();
        m.put("base-mainnet", new Network("Base", "https://basescan.org/tx/", "BaseScan"));
        return m;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Telegram {

        /** Bot API token. Blank disables the channel; notifications are then skipped and logged. */
        private String botToken = "";

        /** Chats that receive alerts. */
        private List<String> chatIds = new ArrayList<>();

        private String baseUrl = "https://api.telegram.org";

        /** Local cap on sendMessage calls. Telegram allows roughly 30 per second per bot. */
        private int maxMessagesPerSecond = 20;

        /** Wait for a rate-limit permit and for the HTTP response. */
        private long timeoutMs = 5_000;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class Network {
        private String displayName;
        /** Prefix the tx hash is appended to. */
        private String explorerTxUrl;
        private String explorerName;
    }
}
