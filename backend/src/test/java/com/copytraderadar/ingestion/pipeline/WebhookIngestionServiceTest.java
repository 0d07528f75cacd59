package com.copytraderadar.ingestion.pipeline;

import com.copytraderadar.copytrade.CopyTradeConfigRegistry;
import com.copytraderadar.domain.CopyTradeConfig;
import com.copytraderadar.domain.CopyTradeEvent;
import com.copytraderadar.domain.CopyTradeEventStatus;
import com.copytraderadar.ingestion.classifier.TrackedTokenRegistry;
import com.copytraderadar.ingestion.classifier.WebhookEventClassifier;
import com.copytraderadar.ingestion.config.TrackedTokenFixtures;
import com.copytraderadar.ingestion.config.WebhookProperties;
import com.copytraderadar.ingestion.payload.WebhookPayloadParser;
import com.copytraderadar.ingestion.store.CopyTradeEventStore;
import com.copytraderadar.ingestion.store.UpsertResult;
import com.copytraderadar.ingestion.webhook.InvalidSignatureException;
import com.copytraderadar.ingestion.webhook.MissingSignatureException;
import com.copytraderadar.ingestion.webhook.WebhookSignatureVerifier;
import com.copytraderadar.notification.NotificationDispatcher;
import com.copytraderadar.notification.TransferNotification;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookIngestionServiceTest {

    private static final String SECRET = "test-secret";
    private static final String TARGET = "0xAbCdEf0000000000000000000000000000000001";
    private static final String OTHER = "0x2222222222222222222222222222222222222222";
    private static final String USDC_BODY = """
            {"eventType":"erc20_transfer","transactionHash":"0xTXHASH1","network":"base-mainnet",\
            "from":"%s","to":"%s","value":"2500000","contractAddress":"0x833589fcd6edb6e08f4c7c32d4f71b54bda02913"}"""
            .formatted(TARGET, OTHER);

    @Mock
    CopyTradeConfigRegistry configRegistry;
    @Mock
    CopyTradeEventStore eventStore;
    @Mock
    NotificationDispatcher notificationDispatcher;

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier();
    private WebhookProperties webhookProperties;
    private WebhookIngestionService service;

    @BeforeEach
    void setUp() {
        webhookProperties = new WebhookProperties();
        webhookProperties.setSecret(SECRET);
        service = new WebhookIngestionService(
                verifier,
                webhookProperties,
                new WebhookPayloadParser(new ObjectMapper()),
                new WebhookEventClassifier(new TrackedTokenRegistry(TrackedTokenFixtures.withBaseUsdc())),
                configRegistry,
                eventStore,
                notificationDispatcher);
    }

    @Test
    @DisplayName("tracked transfer matching two configs persists and notifies once per config")
    void trackedTransfer_fansOutPerConfig() {
        when(configRegistry.findActiveByWallets(anyCollection()))
                .thenReturn(List.of(config("cfg-a", "alice"), config("cfg-b", "bob")));
        when(eventStore.upsert(any(CopyTradeEvent.class))).thenAnswer(inv -> inserted(inv.getArgument(0)));
        when(notificationDispatcher.dispatch(any(TransferNotification.class))).thenReturn(true);

        IngestionOutcome outcome = service.ingest(USDC_BODY, verifier.sign(USDC_BODY, SECRET));

        assertThat(outcome.signatureVerified()).isTrue();
        assertThat(outcome.count(BranchOutcome.Status.PERSISTED)).isEqualTo(2);
        assertThat(outcome.notificationsAttempted()).isEqualTo(2);

        ArgumentCaptor<CopyTradeEvent> events = ArgumentCaptor.forClass(CopyTradeEvent.class);
        verify(eventStore, times(2)).upsert(events.capture());
        CopyTradeEvent first = events.getAllValues().get(0);
        assertThat(first.getConfigId()).isEqualTo("cfg-a");
        assertThat(first.getOriginalTxHash()).isEqualTo("0xtxhash1");
        assertThat(first.getOriginalAmount()).isEqualTo("2500000");
        assertThat(first.getCopiedAmount()).isEqualTo("2500000");
        assertThat(first.getTokenSymbol()).isEqualTo("USDC");
        assertThat(first.getStatus()).isEqualTo(CopyTradeEventStatus.PENDING);

        ArgumentCaptor<TransferNotification> notifications = ArgumentCaptor.forClass(TransferNotification.class);
        verify(notificationDispatcher, times(2)).dispatch(notifications.capture());
        assertThat(notifications.getAllValues())
                .extracting(TransferNotification::accountName)
                .containsExactly("alice", "bob");
        assertThat(notifications.getValue().amount()).isEqualTo("2.500000");
        assertThat(notifications.getValue().nativeAsset()).isFalse();
    }

    @Test
    @DisplayName("matching uses both from and to, whatever their case")
    void lookup_usesFromAndTo() {
        when(configRegistry.findActiveByWallets(anyCollection())).thenReturn(List.of());

        service.ingest(USDC_BODY, null);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> wallets = ArgumentCaptor.forClass(Collection.class);
        verify(configRegistry).findActiveByWallets(wallets.capture());
        assertThat(wallets.getValue()).containsExactly(TARGET, OTHER);
    }

    @Test
    @DisplayName("a failing branch does not stop the sibling branch")
    void failingBranch_isolated() {
        when(configRegistry.findActiveByWallets(anyCollection()))
                .thenReturn(List.of(config("cfg-a", "alice"), config("cfg-b", "bob")));
        when(eventStore.upsert(any(CopyTradeEvent.class))).thenAnswer(inv -> {
            CopyTradeEvent e = inv.getArgument(0);
            if ("cfg-a".equals(e.getConfigId())) {
                throw new DataAccessResourceFailureException("write failed");
            }
            return inserted(e);
        });
        when(notificationDispatcher.dispatch(any(TransferNotification.class))).thenReturn(true);

        IngestionOutcome outcome = service.ingest(USDC_BODY, null);

        assertThat(outcome.branches()).hasSize(2);
        assertThat(outcome.branches().get(0).status()).isEqualTo(BranchOutcome.Status.FAILED);
        assertThat(outcome.branches().get(0).error()).isEqualTo("write failed");
        assertThat(outcome.branches().get(1).status()).isEqualTo(BranchOutcome.Status.PERSISTED);
        verify(notificationDispatcher, times(1)).dispatch(any(TransferNotification.class));
    }

    @Test
    @DisplayName("re-delivered webhook is a duplicate and sends no second notification")
    void duplicate_noNotification() {
        when(configRegistry.findActiveByWallets(anyCollection())).thenReturn(List.of(config("cfg-a", "alice")));
        when(eventStore.upsert(any(CopyTradeEvent.class))).thenAnswer(inv -> {
            CopyTradeEvent existing = inv.getArgument(0);
            existing.setId("evt-existing");
            return new UpsertResult(false, existing);
        });

        IngestionOutcome outcome = service.ingest(USDC_BODY, null);

        assertThat(outcome.count(BranchOutcome.Status.DUPLICATE)).isEqualTo(1);
        assertThat(outcome.branches().get(0).eventId()).isEqualTo("evt-existing");
        verifyNoInteractions(notificationDispatcher);
    }

    @Test
    void noMatchingConfig_noPersistenceNoNotification() {
        when(configRegistry.findActiveByWallets(anyCollection())).thenReturn(List.of());

        IngestionOutcome outcome = service.ingest(USDC_BODY, null);

        assertThat(outcome.classification().isIgnored()).isFalse();
        assertThat(outcome.branches()).isEmpty();
        verifyNoInteractions(eventStore, notificationDispatcher);
    }

    @Test
    void configLookupFailure_reportedInOutcome() {
        when(configRegistry.findActiveByWallets(anyCollection())).thenThrow(new DataAccessResourceFailureException("down"));

        IngestionOutcome outcome = service.ingest(USDC_BODY, null);

        assertThat(outcome.matchError()).isEqualTo("config lookup failed");
        assertThat(outcome.branches()).isEmpty();
        verifyNoInteractions(eventStore, notificationDispatcher);
    }

    @Test
    @DisplayName("invalid signature aborts before any lookup, write or notification")
    void invalidSignature_noSideEffects() {
        assertThatThrownBy(() -> service.ingest(USDC_BODY, "00ff"))
                .isInstanceOf(InvalidSignatureException.class);

        verifyNoInteractions(configRegistry, eventStore, notificationDispatcher);
    }

    @Test
    void requiredSignatureMissing_noSideEffects() {
        webhookProperties.setRequireSignature(true);

        assertThatThrownBy(() -> service.ingest(USDC_BODY, null))
                .isInstanceOf(MissingSignatureException.class);

        verifyNoInteractions(configRegistry, eventStore, notificationDispatcher);
    }

    @Test
    void ignoredEvent_noLookup() {
        String body = "{\"eventType\":\"erc20_transfer\",\"transactionHash\":\"0x1\",\"from\":\"%s\",\"value\":\"5\","
                .formatted(TARGET) + "\"contractAddress\":\"0x9999999999999999999999999999999999999999\"}";

        IngestionOutcome outcome = service.ingest(body, null);

        assertThat(outcome.classification().isIgnored()).isTrue();
        assertThat(outcome.signatureVerified()).isFalse();
        verifyNoInteractions(configRegistry, eventStore, notificationDispatcher);
    }

    @Test
    @DisplayName("tracked transfer without a hash is acknowledged as tracked but never looked up or persisted")
    void missingHash_trackedButNotPersisted() {
        String body = """
                {"eventType":"transaction","network":"base-mainnet",\
                "from":"%s","to":"%s","value":"1000000000000000000"}""".formatted(OTHER, TARGET);

        IngestionOutcome outcome = service.ingest(body, null);

        assertThat(outcome.classification().isIgnored()).isFalse();
        assertThat(outcome.classification().transfer().displayValue()).isEqualTo("1.000000");
        assertThat(outcome.matchError()).isEqualTo("missing transaction hash");
        assertThat(outcome.branches()).isEmpty();
        verifyNoInteractions(configRegistry, eventStore, notificationDispatcher);
    }

    @Test
    @DisplayName("signed webhook is accepted unverified when no secret is configured")
    void blankSecret_signedWebhookAcceptedUnverified() {
        webhookProperties.setSecret("");
        when(configRegistry.findActiveByWallets(anyCollection())).thenReturn(List.of());

        IngestionOutcome outcome = service.ingest(USDC_BODY, verifier.sign(USDC_BODY, "sender-secret"));

        assertThat(outcome.signatureVerified()).isFalse();
        assertThat(outcome.classification().isIgnored()).isFalse();
    }

    @Test
    void malformedValue_persistedAsZero() {
        String body = """
                {"eventType":"transaction","transactionHash":"0xeth2","network":"base-mainnet",\
                "from":"%s","to":"%s","value":"12abc"}""".formatted(OTHER, TARGET);
        when(configRegistry.findActiveByWallets(anyCollection())).thenReturn(List.of(config("cfg-a", "alice")));
        when(eventStore.upsert(any(CopyTradeEvent.class))).thenAnswer(inv -> inserted(inv.getArgument(0)));
        when(notificationDispatcher.dispatch(any(TransferNotification.class))).thenReturn(true);

        IngestionOutcome outcome = service.ingest(body, null);

        assertThat(outcome.count(BranchOutcome.Status.PERSISTED)).isEqualTo(1);
        ArgumentCaptor<CopyTradeEvent> event = ArgumentCaptor.forClass(CopyTradeEvent.class);
        verify(eventStore).upsert(event.capture());
        assertThat(event.getValue().getOriginalAmount()).isEqualTo("0");
    }

    @Test
    void nativeTransfer_notifiesAsNativeAsset() {
        String body = """
                {"eventType":"transaction","transactionHash":"0xeth1","network":"base-mainnet",\
                "from":"%s","to":"%s","value":"1000000000000000000"}""".formatted(OTHER, TARGET);
        when(configRegistry.findActiveByWallets(anyCollection())).thenReturn(List.of(config("cfg-a", "alice")));
        when(eventStore.upsert(any(CopyTradeEvent.class))).thenAnswer(inv -> inserted(inv.getArgument(0)));
        when(notificationDispatcher.dispatch(any(TransferNotification.class))).thenReturn(false);

        IngestionOutcome outcome = service.ingest(body, null);

        ArgumentCaptor<TransferNotification> notification = ArgumentCaptor.forClass(TransferNotification.class);
        verify(notificationDispatcher).dispatch(notification.capture());
        assertThat(notification.getValue().nativeAsset()).isTrue();
        assertThat(notification.getValue().tokenSymbol()).isEqualTo("ETH");
        assertThat(notification.getValue().amount()).isEqualTo("1.000000");
        assertThat(outcome.branches().get(0).status()).isEqualTo(BranchOutcome.Status.PERSISTED);
        assertThat(outcome.notificationsAttempted()).isZero();
        ArgumentCaptor<CopyTradeEvent> event = ArgumentCaptor.forClass(CopyTradeEvent.class);
        verify(eventStore).upsert(event.capture());
        assertThat(event.getValue().getOriginalAmount()).isEqualTo("1000000000000000000");
        assertThat(event.getValue().getTokenAddress()).isEqualTo("0x0000000000000000000000000000000000000000");
    }

    private static CopyTradeConfig config(String id, String account) {
        CopyTradeConfig c = new CopyTradeConfig();
        c.setId(id);
        c.setAccountName(account);
        c.setTargetWalletAddress(TARGET);
        c.setActive(true);
        return c;
    }

    private static UpsertResult inserted(CopyTradeEvent e) {
        e.setId("evt-" + e.getConfigId());
        return new UpsertResult(true, e);
    }
}
