package com.copytraderadar.api.controller;

import com.copytraderadar.domain.CopyTradeConfigRepository;
import com.copytraderadar.domain.CopyTradeEventRepository;
import com.copytraderadar.ingestion.webhook.WebhookSignatureVerifier;
import com.copytraderadar.notification.NotificationDispatcher;
import com.copytraderadar.notification.TransferNotification;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Config API plus signed webhook through to stored events, against a real MongoDB.
 */
@SpringBootTest(properties = "copytrade.webhook.secret=" + WebhookFlowIntegrationTest.SECRET)
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class WebhookFlowIntegrationTest {

    static final String SECRET = "it-secret";
    private static final String TARGET = "0xAbCdEf0000000000000000000000000000000001";
    private static final String USDC_BODY = """
            {"eventType":"erc20_transfer","transactionHash":"0xFLOW1","network":"base-mainnet",\
            "from":"%s","to":"0x2222222222222222222222222222222222222222","value":"2500000",\
            "contractAddress":"0x833589fcd6edb6e08f4c7c32d4f71b54bda02913"}""".formatted(TARGET);

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    WebhookSignatureVerifier verifier;
    @Autowired
    CopyTradeConfigRepository configRepository;
    @Autowired
    CopyTradeEventRepository eventRepository;

    @MockBean
    NotificationDispatcher notificationDispatcher;

    @BeforeEach
    void clean() {
        configRepository.deleteAll();
        eventRepository.deleteAll();
        when(notificationDispatcher.dispatch(any(TransferNotification.class))).thenReturn(true);
    }

    @Test
    @DisplayName("re-delivered webhook creates one event and one notification per config")
    void webhookRedelivery_idempotent() {
        createConfig("alice");
        createConfig("bob");
        String signature = verifier.sign(USDC_BODY, SECRET);

        postWebhook(signature)
                .jsonPath("$.matches.matched_configs").isEqualTo(2)
                .jsonPath("$.matches.persisted").isEqualTo(2)
                .jsonPath("$.matches.duplicates").isEqualTo(0);
        postWebhook(signature)
                .jsonPath("$.matches.persisted").isEqualTo(0)
                .jsonPath("$.matches.duplicates").isEqualTo(2)
                .jsonPath("$.matches.notifications_attempted").isEqualTo(0);

        assertThat(eventRepository.count()).isEqualTo(2);
        verify(notificationDispatcher, times(2)).dispatch(any(TransferNotification.class));

        webTestClient.get().uri("/api/v1/copy-trade/events?account=alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].originalTxHash").isEqualTo("0xflow1")
                .jsonPath("$[0].originalAmount").isEqualTo("2500000")
                .jsonPath("$[0].targetWalletAddress").isEqualTo(TARGET.toLowerCase())
                .jsonPath("$[0].status").isEqualTo("pending");
    }

    @Test
    void deactivatedConfig_notMatched() {
        String id = createConfig("alice");
        webTestClient.post().uri("/api/v1/copy-trade/configs/" + id + "/deactivate")
                .exchange()
                .expectStatus().isOk();

        postWebhook(verifier.sign(USDC_BODY, SECRET))
                .jsonPath("$.matches.matched_configs").isEqualTo(0);
        assertThat(eventRepository.count()).isZero();
    }

    @Test
    void createConfig_duplicateAndInvalid() {
        createConfig("alice");

        webTestClient.post().uri("/api/v1/copy-trade/configs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(configBody("alice", TARGET.toLowerCase()))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("DUPLICATE_CONFIG");

        webTestClient.post().uri("/api/v1/copy-trade/configs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(configBody("alice", "0x123"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }

    @Test
    void badSignature_401_noEvents() {
        createConfig("alice");

        webTestClient.post().uri("/")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-coinbase-signature", verifier.sign(USDC_BODY + " ", SECRET))
                .bodyValue(USDC_BODY)
                .exchange()
                .expectStatus().isUnauthorized();

        assertThat(eventRepository.count()).isZero();
    }

    private WebTestClient.BodyContentSpec postWebhook(String signature) {
        return webTestClient.post().uri("/")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-coinbase-signature", signature)
                .bodyValue(USDC_BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.signature_verified").isEqualTo(true);
    }

    private String createConfig(String account) {
        return webTestClient.post().uri("/api/v1/copy-trade/configs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(configBody(account, TARGET))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody()
                .path("id")
                .asText();
    }

    private static String configBody(String account, String target) {
        return """
                {"accountName":"%s","targetWalletAddress":"%s",
                 "beneficiaryAddresses":["0x3333333333333333333333333333333333333333"],"delegationAmount":"0.5"}
                """.formatted(account, target);
    }
}
