package com.modelgate.gateway;

import com.modelgate.auth.BridgeOAuthTokenStore;
import com.modelgate.auth.OAuthTokenStore;
import com.modelgate.bridge.MessageBridge;
import com.modelgate.models.AvailableModel;
import com.modelgate.models.ModelCatalog;
import com.modelgate.models.ModelDescriptor;
import com.modelgate.observability.DoctorCommand;
import com.modelgate.observability.StreamMetrics;
import com.modelgate.providers.CallableModel;
import com.modelgate.providers.CustomProviderConfig;
import com.modelgate.settings.CredentialLoader;
import com.modelgate.settings.CustomModelService;
import com.modelgate.settings.CustomProviderService;
import com.modelgate.settings.YamlSettingsStore;
import com.modelgate.shared.config.ConfigLoader;
import com.modelgate.shared.config.GatewayConfig;
import com.modelgate.shared.model.StreamRequest;
import com.modelgate.shared.model.TextResult;
import com.modelgate.store.ProviderSnapshot;
import com.modelgate.store.ProviderStore;
import com.modelgate.stream.CancellationSignal;
import com.modelgate.stream.LlmStreamClient;
import com.modelgate.stream.StreamTextResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application-root assembly. Build one per process and pass it to whatever
 * needs models or streams.
 */
public class ModelGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelGateway.class);

    private final GatewayConfig config;
    private final ProviderStore store;
    private final LlmStreamClient streamClient;
    private final StreamMetrics metrics;
    private final DoctorCommand doctor;
    private final ExecutorService executor;

    ModelGateway(GatewayConfig config, ProviderStore store, LlmStreamClient streamClient,
                 StreamMetrics metrics, ExecutorService executor) {
        this.config = config;
        this.store = store;
        this.streamClient = streamClient;
        this.metrics = metrics;
        this.doctor = new DoctorCommand(store, config);
        this.executor = executor;
    }

    /** Uses {@code ~/.modelgate/config.yaml}. */
    public static ModelGateway create(MessageBridge bridge) {
        return create(ConfigLoader.load(), bridge);
    }

    public static ModelGateway create(GatewayConfig config, MessageBridge bridge) {
        return create(config, bridge, Clock.systemUTC(), new StreamMetrics());
    }

    public static ModelGateway create(GatewayConfig config, MessageBridge bridge, Clock clock, StreamMetrics metrics) {
        var settings = new YamlSettingsStore(config.settingsFile());
        var customProviders = new CustomProviderService(config.customProvidersFile());
        var customModels = new CustomModelService(config.customModelsFile());

        var oauthStores = new LinkedHashMap<String, OAuthTokenStore>();
        config.oauthRefreshCommands().forEach((providerId, command) ->
                oauthStores.put(providerId, new BridgeOAuthTokenStore(providerId, settings, bridge, command, clock)));

        var loader = new CredentialLoader(settings, customProviders, customModels, oauthStores, clock);
        var executor = Executors.newSingleThreadExecutor(daemonThreads());
        var store = new ProviderStore(loader, settings, customProviders, customModels,
                ModelCatalog.loadDefault(), oauthStores, clock, executor);
        var streamClient = new LlmStreamClient(bridge, config.stream(), metrics, clock);
        log.info("Model gateway assembled (data dir {})", config.dataDir());
        return new ModelGateway(config, store, streamClient, metrics, executor);
    }

    public CompletableFuture<ProviderSnapshot> initialize() {
        return store.initialize();
    }

    public CompletableFuture<ProviderSnapshot> refresh() {
        return store.refresh();
    }

    public CallableModel getProviderModel(String modelIdentifier) {
        return store.getProviderModel(modelIdentifier);
    }

    public boolean isModelAvailable(String modelIdentifier) {
        return store.isModelAvailable(modelIdentifier);
    }

    public String getBestProviderForModel(String modelKey) {
        return store.getBestProviderForModel(modelKey);
    }

    public AvailableModel getAvailableModel() {
        return store.getAvailableModel();
    }

    public List<AvailableModel> availableModels() {
        return store.availableModels();
    }

    public CompletableFuture<ProviderSnapshot> setApiKey(String providerId, String apiKey) {
        return store.setApiKey(providerId, apiKey);
    }

    public CompletableFuture<ProviderSnapshot> setBaseUrl(String providerId, String baseUrl) {
        return store.setBaseUrl(providerId, baseUrl);
    }

    public CompletableFuture<ProviderSnapshot> setAltBilling(String providerId, boolean enabled) {
        return store.setAltBilling(providerId, enabled);
    }

    public CompletableFuture<ProviderSnapshot> setInternational(String providerId, boolean enabled) {
        return store.setInternational(providerId, enabled);
    }

    public CompletableFuture<ProviderSnapshot> addCustomProvider(CustomProviderConfig config) {
        return store.addCustomProvider(config);
    }

    public CompletableFuture<ProviderSnapshot> updateCustomProvider(String providerId, CustomProviderConfig patch) {
        return store.updateCustomProvider(providerId, patch);
    }

    public CompletableFuture<ProviderSnapshot> removeCustomProvider(String providerId) {
        return store.removeCustomProvider(providerId);
    }

    public CompletableFuture<ProviderSnapshot> addCustomModel(String modelKey, ModelDescriptor model) {
        return store.addCustomModel(modelKey, model);
    }

    public CompletableFuture<ProviderSnapshot> removeCustomModel(String modelKey) {
        return store.removeCustomModel(modelKey);
    }

    public CompletableFuture<StreamTextResult> streamText(StreamRequest request, CancellationSignal signal) {
        return streamClient.streamText(request, signal);
    }

    public TextResult collectText(StreamRequest request, CancellationSignal signal) {
        return streamClient.collectText(request, signal);
    }

    public String doctor() {
        return doctor.run();
    }

    public ProviderStore store() { return store; }

    public LlmStreamClient streamClient() { return streamClient; }

    public StreamMetrics metrics() { return metrics; }

    public GatewayConfig config() { return config; }

    @Override
    public void close() {
        executor.shutdown();
    }

    private static ThreadFactory daemonThreads() {
        var seq = new AtomicInteger();
        return r -> {
            var t = new Thread(r, "modelgate-store-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
