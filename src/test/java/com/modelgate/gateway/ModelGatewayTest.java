package com.modelgate.gateway;

import com.modelgate.bridge.LocalMessageBridge;
import com.modelgate.errors.ModelUnavailableException;
import com.modelgate.models.ModelDescriptor;
import com.modelgate.observability.StreamMetrics;
import com.modelgate.providers.CustomProviderConfig;
import com.modelgate.providers.ProtocolType;
import com.modelgate.settings.SettingsKeys;
import com.modelgate.settings.YamlSettingsStore;
import com.modelgate.shared.config.GatewayConfig;
import com.modelgate.shared.config.StreamConfig;
import com.modelgate.shared.model.Mappers;
import com.modelgate.shared.model.StreamRequest;
import com.modelgate.stream.CancellationSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ModelGatewayTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private LocalMessageBridge bridge;
    private MutableClock clock;
    private GatewayConfig config;
    private ModelGateway gateway;

    @BeforeEach
    void setUp() {
        bridge = new LocalMessageBridge();
        clock = new MutableClock(T0);
        config = new GatewayConfig(tempDir, StreamConfig.defaults(), GatewayConfig.DEFAULT_OAUTH_REFRESH_COMMANDS);
        gateway = ModelGateway.create(config, bridge, clock, new StreamMetrics());
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void freshDataDirHasNoModels() throws Exception {
        var snapshot = await(gateway.initialize());

        assertTrue(snapshot.initialized());
        assertTrue(gateway.availableModels().isEmpty());
        assertNull(gateway.getAvailableModel());
        assertThrows(ModelUnavailableException.class, () -> gateway.getProviderModel("gpt-5"));
        assertTrue(gateway.doctor().contains("[FAIL] No usable providers"));
    }

    @Test
    void apiKeyEnablesModelsAndPersists() throws Exception {
        await(gateway.initialize());
        await(gateway.setApiKey("openRouter", "sk-or"));

        var model = gateway.getProviderModel("claude-sonnet-4.5");
        assertEquals("openRouter", model.providerId());
        assertEquals("anthropic/claude-sonnet-4.5", model.modelName());
        assertEquals("Bearer sk-or", model.requestHeaders(clock.instant()).get("Authorization"));
        assertEquals("sk-or", new YamlSettingsStore(config.settingsFile()).get(SettingsKeys.apiKey("openRouter")));

        await(gateway.setBaseUrl("openRouter", "https://or-proxy.example/api/v1"));
        assertEquals("https://or-proxy.example/api/v1", gateway.getProviderModel("gpt-5").baseUrl());
    }

    @Test
    void customProviderSurvivesRestart() throws Exception {
        await(gateway.initialize());
        await(gateway.addCustomProvider(new CustomProviderConfig("acme", "Acme", ProtocolType.ANTHROPIC,
                "https://acme.example", "sk-acme", true, null, null, null)));
        await(gateway.addCustomModel("acme-opus", ModelDescriptor.of("Acme Opus", List.of("acme"))));
        gateway.close();

        gateway = ModelGateway.create(config, bridge, clock, new StreamMetrics());
        await(gateway.initialize());
        var model = gateway.getProviderModel("acme-opus@acme");
        assertEquals("https://acme.example", model.baseUrl());
        assertEquals("sk-acme", model.requestHeaders(clock.instant()).get("x-api-key"));
    }

    @Test
    void expiredOAuthTokenRefreshesThroughEngine() throws Exception {
        var settings = new YamlSettingsStore(config.settingsFile());
        settings.set(SettingsKeys.oauthAccessToken("anthropic"), "at-1");
        settings.set(SettingsKeys.oauthRefreshToken("anthropic"), "rt-1");
        settings.set(SettingsKeys.oauthExpiresAt("anthropic"), String.valueOf(T0.plusSeconds(60).toEpochMilli()));
        bridge.registerCommand("llm_claude_oauth_refresh", payload -> CompletableFuture.completedFuture(
                Mappers.json().createObjectNode().put("accessToken", "at-2").put("expiresIn", 3600)));

        await(gateway.initialize());
        var model = gateway.getProviderModel("claude-haiku-4.5");
        assertEquals("anthropic", model.providerId());
        assertEquals("Bearer at-1", model.requestHeaders(clock.instant()).get("Authorization"));

        clock.set(T0.plusSeconds(120));
        assertEquals("Bearer at-2", model.requestHeaders(clock.instant()).get("Authorization"));
        assertEquals("at-2", new YamlSettingsStore(config.settingsFile()).get(SettingsKeys.oauthAccessToken("anthropic")));
    }

    @Test
    void tokenExpiredBeforeStartupIsRefreshedOnLoad() throws Exception {
        var settings = new YamlSettingsStore(config.settingsFile());
        settings.set(SettingsKeys.oauthAccessToken("anthropic"), "at-1");
        settings.set(SettingsKeys.oauthRefreshToken("anthropic"), "rt-1");
        settings.set(SettingsKeys.oauthExpiresAt("anthropic"), String.valueOf(T0.minusSeconds(1).toEpochMilli()));
        var calls = new AtomicInteger();
        bridge.registerCommand("llm_claude_oauth_refresh", payload -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(
                    Mappers.json().createObjectNode().put("accessToken", "at-2").put("expiresIn", 3600));
        });

        await(gateway.initialize());

        assertTrue(gateway.isModelAvailable("claude-haiku-4.5"));
        var model = gateway.getProviderModel("claude-haiku-4.5");
        assertEquals("anthropic", model.providerId());
        assertEquals("Bearer at-2", model.requestHeaders(clock.instant()).get("Authorization"));
        assertEquals(1, calls.get());
    }

    @Test
    void unreadableExpiryForcesRefreshOnLoad() throws Exception {
        var settings = new YamlSettingsStore(config.settingsFile());
        settings.set(SettingsKeys.oauthAccessToken("anthropic"), "at-1");
        settings.set(SettingsKeys.oauthRefreshToken("anthropic"), "rt-1");
        settings.set(SettingsKeys.oauthExpiresAt("anthropic"), "tomorrow");
        bridge.registerCommand("llm_claude_oauth_refresh", payload -> CompletableFuture.completedFuture(
                Mappers.json().createObjectNode().put("accessToken", "at-2").put("expiresIn", 3600)));

        await(gateway.initialize());

        assertEquals("Bearer at-2",
                gateway.getProviderModel("claude-haiku-4.5").requestHeaders(clock.instant()).get("Authorization"));
    }

    @Test
    void regionalEndpointsSwitchBaseUrl() throws Exception {
        await(gateway.initialize());
        await(gateway.setApiKey("MiniMax", "sk-mm"));
        assertEquals("https://api.minimaxi.com/v1", gateway.getProviderModel("minimax-m2").baseUrl());

        await(gateway.setAltBilling("MiniMax", true));
        assertEquals("https://api.minimaxi.com/anthropic/v1", gateway.getProviderModel("minimax-m2").baseUrl());

        await(gateway.setInternational("MiniMax", true));
        assertEquals("https://api.minimaxi.chat/anthropic/v1", gateway.getProviderModel("minimax-m2").baseUrl());
        assertEquals("true", new YamlSettingsStore(config.settingsFile()).get(SettingsKeys.international("MiniMax")));
    }

    @Test
    void streamsThroughTheBridge() {
        bridge.registerCommand(config.stream().command(), payload -> {
            var requestId = payload.at("/request/requestId").asText();
            var channel = config.stream().channelFor(requestId);
            bridge.emit(channel, Mappers.json().createObjectNode().put("type", "text-delta").put("text", "Hello"));
            bridge.emit(channel, Mappers.json().createObjectNode().put("type", "done").put("finish_reason", "stop"));
            return CompletableFuture.completedFuture(Mappers.json().createObjectNode().put("request_id", requestId));
        });

        var text = gateway.collectText(StreamRequest.prompt("deepseek-chat", "hi"), new CancellationSignal());

        assertEquals("Hello", text.text());
        assertEquals("stop", text.finishReason());
        assertEquals(1, gateway.metrics().registry().get("modelgate.stream.completed").counter().count());
        assertEquals(0, gateway.streamClient().liveRequests());
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
