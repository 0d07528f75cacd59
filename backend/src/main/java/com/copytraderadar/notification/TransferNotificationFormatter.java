package com.copytraderadar.notification;

import com.copytraderadar.common.Addresses;
import com.copytraderadar.notification.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders transfer alerts as Telegram HTML. Native and token transfers use different headlines.
 */
@Component
@RequiredArgsConstructor
public class TransferNotificationFormatter {

    private final NotificationProperties properties;

    public String format(TransferNotification n) {
        String symbol = escape(n.tokenSymbol());
        String headline = n.nativeAsset()
                ? "🪙 <b>" + symbol + " Transfer Detected!</b>"
                : "💵 <b>" + symbol + " Token Transfer Detected!</b>";
        NotificationProperties.Network network = properties.getNetworks().get(n.network());
        String networkName = network != null && network.getDisplayName() != null ? network.getDisplayName() : n.network();

        StringBuilder sb = new StringBuilder(headline).append("\n\n");
        if (n.accountName() != null) {
            sb.append("📋 <b>Copy-trade:</b> ").append(escape(n.accountName())).append('\n');
        }
        sb.append("💰 <b>Amount:</b> ").append(escape(n.amount())).append(' ').append(symbol).append('\n');
        sb.append("👤 <b>From:</b> <code>").append(escape(Addresses.shorten(n.from()))).append("</code>\n");
        sb.append("📥 <b>To:</b> <code>").append(escape(Addresses.shorten(n.to()))).append("</code>\n");
        sb.append("🔗 <b>Transaction:</b> <code>").append(escape(Addresses.shorten(n.transactionHash()))).append("</code>\n");
        sb.append("🌐 <b>Network:</b> ").append(escape(networkName));
        if (network != null && network.getExplorerTxUrl() != null && !network.getExplorerTxUrl().isBlank()) {
            String explorer = network.getExplorerName() != null ? network.getExplorerName() : "explorer";
            sb.append("\n\n<a href=\"").append(escape(network.getExplorerTxUrl() + n.transactionHash()))
                    .append("\">View on ").append(escape(explorer)).append("</a>");
        }
        return sb.toString();
    }

    private static String escape(String s) {
        return s == null ? "" : HtmlUtils.htmlEscape(s);
    }
}
