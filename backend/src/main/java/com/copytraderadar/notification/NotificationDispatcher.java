package com.copytraderadar.notification;

import com.copytraderadar.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Best-effort transfer alerts. Runs on the notification executor so callers never wait on the transport.
 * Nothing here throws: an unavailable channel is skipped, transport failures are logged, nothing is retried.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final NotificationChannel channel;
    private final TransferNotificationFormatter formatter;
    private final Executor executor;

    public NotificationDispatcher(NotificationChannel channel,
                                  TransferNotificationFormatter formatter,
                                  @Qualifier(AsyncConfig.NOTIFICATION_EXECUTOR) Executor executor) {
        this.channel = channel;
        this.formatter = formatter;
        this.executor = executor;
    }

    /**
     * @return true when a send was attempted (handed to the executor), false when skipped
     */
    public boolean dispatch(TransferNotification notification) {
        if (!channel.isAvailable()) {
            log.warn("{} notification for tx {} skipped: channel unavailable",
                    notification.tokenSymbol(), notification.transactionHash());
            return false;
        }
        try {
            executor.execute(() -> send(notification));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("{} notification for tx {} dropped: executor saturated",
                    notification.tokenSymbol(), notification.transactionHash());
            return false;
        }
    }

    private void send(TransferNotification notification) {
        try {
            channel.send(formatter.format(notification));
            log.info("{} notification sent for tx {} ({})",
                    notification.tokenSymbol(), notification.transactionHash(), notification.accountName());
        } catch (RuntimeException e) {
            log.error("Error sending {} notification for tx {}: {}",
                    notification.tokenSymbol(), notification.transactionHash(), e.getMessage(), e);
        }
    }
}
