package com.modelgate.store;

import com.modelgate.auth.OAuthTokenStore;
import com.modelgate.errors.ModelUnavailableException;
import com.modelgate.errors.ProviderNotInitializedException;
import com.modelgate.models.AvailableModel;
import com.modelgate.models.ModelAvailability;
import com.modelgate.models.ModelCatalog;
import com.modelgate.models.ModelDescriptor;
import com.modelgate.models.ModelIdentifier;
import com.modelgate.providers.CallableModel;
import com.modelgate.providers.CustomProviderConfig;
import com.modelgate.providers.ProviderFactory;
import com.modelgate.providers.ProviderRegistryBuilder;
import com.modelgate.settings.CredentialLoader;
import com.modelgate.settings.CustomModelService;
import com.modelgate.settings.CustomProviderService;
import com.modelgate.settings.SettingsKeys;
import com.modelgate.settings.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single source of truth for provider and model availability.
 *
 * <p>Readers are synchronous and see one consistent {@link ProviderSnapshot}.
 * Loads and mutations run on the supplied executor and publish a new snapshot
 * in a single swap. Concurrent {@link #initialize()}/{@link #refresh()} calls
 * share one load.
 *
 * <p>Token expiry is re-checked against the clock on every read.
 */
public class ProviderStore {

    private static final Logger log = LoggerFactory.getLogger(ProviderStore.class);

    private final CredentialLoader loader;
    private final SettingsStore settings;
    private final CustomProviderService customProviderService;
    private final CustomModelService customModelService;
    private final ModelCatalog catalog;
    private final Map<String, OAuthTokenStore> oauthStores;
    private final Clock clock;
    private final Executor executor;

    private final AtomicReference<ProviderSnapshot> state;
    private CompletableFuture<ProviderSnapshot> inFlight;

    public ProviderStore(CredentialLoader loader,
                         SettingsStore settings,
                         CustomProviderService customProviderService,
                         CustomModelService customModelService,
                         ModelCatalog catalog,
                         Map<String, OAuthTokenStore> oauthStores,
                         Clock clock,
                         Executor executor) {
        this.loader = loader;
        this.settings = settings;
        this.customProviderService = customProviderService;
        this.customModelService = customModelService;
        this.catalog = catalog;
        this.oauthStores = Map.copyOf(oauthStores);
        this.clock = clock;
        this.executor = executor;
        this.state = new AtomicReference<>(ProviderSnapshot.empty(catalog.builtin()));
    }

    // ===== Lifecycle =====

    /** Loads once. Later calls return the current snapshot without I/O. */
    public CompletableFuture<ProviderSnapshot> initialize() {
        var current = state.get();
        if (current.initialized()) return CompletableFuture.completedFuture(current);
        return load("initialize");
    }

    /** Reloads every source and rebuilds everything derived from them. */
    public CompletableFuture<ProviderSnapshot> refresh() {
        return load("refresh");
    }

    /** Recomputes providers and availability from the current snapshot, without I/O. */
    public ProviderSnapshot rebuildProviders() {
        var rebuilt = state.updateAndGet(s -> {
            var next = build(new CredentialLoader.LoadedCredentials(
                    s.credentials(), s.customProviders(), s.customModels(), s.loadFailures()));
            // the last load error stays until a load succeeds
            return s.error() != null ? next.failed(s.error()) : next;
        });
        log.info("Rebuilt providers: {} providers, {} available models",
                rebuilt.providers().size(), rebuilt.availableModels().size());
        return rebuilt;
    }

    private CompletableFuture<ProviderSnapshot> load(String reason) {
        CompletableFuture<ProviderSnapshot> result;
        synchronized (this) {
            if (inFlight != null) {
                log.debug("Joining in-flight load for {}", reason);
                return inFlight;
            }
            result = new CompletableFuture<>();
            inFlight = result;
        }
        try {
            executor.execute(() -> runLoad(reason, result));
        } catch (RuntimeException e) {
            finish(result, null, e);
        }
        return result;
    }

    private void runLoad(String reason, CompletableFuture<ProviderSnapshot> result) {
        log.info("Provider store {} started", reason);
        try {
            var snapshot = build(loader.load());
            state.set(snapshot);
            log.info("Provider store {} complete: {} providers, {} available models",
                    reason, snapshot.providers().size(), snapshot.availableModels().size());
            finish(result, snapshot, null);
        } catch (RuntimeException e) {
            // stays initialized with the previous data so callers do not retry forever
            log.error("Provider store {} failed", reason, e);
            var failed = state.updateAndGet(s -> s.failed(e.getMessage()));
            finish(result, failed, null);
        }
    }

    private void finish(CompletableFuture<ProviderSnapshot> result, ProviderSnapshot snapshot, Throwable error) {
        synchronized (this) {
            if (inFlight == result) inFlight = null;
        }
        if (error != null) {
            result.completeExceptionally(error);
        } else {
            result.complete(snapshot);
        }
    }

    private ProviderSnapshot build(CredentialLoader.LoadedCredentials loaded) {
        var now = clock.instant();
        var registry = ProviderRegistryBuilder.build(loaded.customProviders());
        var models = catalog.merged(loaded.customModels());
        var providers = ProviderFactory.createProviders(
                loaded.credentials(), registry, loaded.customProviders(), oauthStores, now);
        var available = ModelAvailability.computeAvailableModels(
                loaded.credentials(), registry, loaded.customProviders(), models, now);
        return new ProviderSnapshot(loaded.credentials(), loaded.customProviders(), loaded.customModels(),
                registry, models, providers, available, true, null, loaded.failures());
    }

    // ===== Readers =====

    public ProviderSnapshot snapshot() {
        return state.get();
    }

    public boolean isInitialized() {
        return state.get().initialized();
    }

    /**
     * Resolves a model identifier to a callable handle.
     *
     * @throws ModelUnavailableException when no usable provider serves the model
     * @throws ProviderNotInitializedException when a provider was selected but has no resolver
     */
    public CallableModel getProviderModel(String modelIdentifier) {
        var s = state.get();
        var id = ModelIdentifier.parse(modelIdentifier);
        var providerId = ModelAvailability.getBestProvider(
                modelIdentifier, s.models(), s.credentials(), s.registry(), s.customProviders(), clock.instant());
        if (providerId == null) throw new ModelUnavailableException(id.modelKey());

        var resolver = s.providers().get(providerId);
        if (resolver == null) throw new ProviderNotInitializedException(providerId, id.modelKey());

        return resolver.resolve(ModelAvailability.resolveProviderModelName(id.modelKey(), providerId, s.models()));
    }

    public boolean isModelAvailable(String modelIdentifier) {
        var s = state.get();
        return ModelAvailability.isModelAvailable(
                modelIdentifier, s.models(), s.credentials(), s.registry(), s.customProviders(), clock.instant());
    }

    /** @return the provider id, or null */
    public String getBestProviderForModel(String modelKey) {
        var s = state.get();
        return ModelAvailability.getBestProvider(
                modelKey, s.models(), s.credentials(), s.registry(), s.customProviders(), clock.instant());
    }

    /** Available pairings as of now. */
    public List<AvailableModel> availableModels() {
        var s = state.get();
        return ModelAvailability.computeAvailableModels(
                s.credentials(), s.registry(), s.customProviders(), s.models(), clock.instant());
    }

    /** Cheapest available model by input price, or null. */
    public AvailableModel getAvailableModel() {
        return ModelAvailability.cheapest(availableModels());
    }

    // ===== Mutators =====

    public CompletableFuture<ProviderSnapshot> setApiKey(String providerId, String apiKey) {
        return mutate("setApiKey " + providerId + " (hasKey=" + (apiKey != null && !apiKey.isBlank()) + ")",
                () -> settings.set(SettingsKeys.apiKey(providerId), apiKey));
    }

    public CompletableFuture<ProviderSnapshot> setBaseUrl(String providerId, String baseUrl) {
        return mutate("setBaseUrl " + providerId,
                () -> settings.set(SettingsKeys.baseUrl(providerId), baseUrl));
    }

    public CompletableFuture<ProviderSnapshot> setAltBilling(String providerId, boolean enabled) {
        return mutate("setAltBilling " + providerId + "=" + enabled,
                () -> settings.set(SettingsKeys.altBilling(providerId), String.valueOf(enabled)));
    }

    public CompletableFuture<ProviderSnapshot> setInternational(String providerId, boolean enabled) {
        return mutate("setInternational " + providerId + "=" + enabled,
                () -> settings.set(SettingsKeys.international(providerId), String.valueOf(enabled)));
    }

    public CompletableFuture<ProviderSnapshot> addCustomProvider(CustomProviderConfig config) {
        return mutate("addCustomProvider " + config.id(), () -> customProviderService.add(config));
    }

    public CompletableFuture<ProviderSnapshot> updateCustomProvider(String providerId, CustomProviderConfig patch) {
        return mutate("updateCustomProvider " + providerId, () -> customProviderService.update(providerId, patch));
    }

    public CompletableFuture<ProviderSnapshot> removeCustomProvider(String providerId) {
        return mutate("removeCustomProvider " + providerId, () -> customProviderService.remove(providerId));
    }

    public CompletableFuture<ProviderSnapshot> addCustomModel(String modelKey, ModelDescriptor model) {
        return mutate("addCustomModel " + modelKey, () -> customModelService.add(modelKey, model));
    }

    public CompletableFuture<ProviderSnapshot> removeCustomModel(String modelKey) {
        return mutate("removeCustomModel " + modelKey, () -> customModelService.remove(modelKey));
    }

    /**
     * Persists, then reloads. A load already running when the write finished
     * may have read stale data, so it is awaited and a fresh one started.
     * On a failed write the store still reloads, then the write's error is
     * propagated.
     */
    private CompletableFuture<ProviderSnapshot> mutate(String action, Runnable persist) {
        return CompletableFuture.runAsync(persist, executor)
                .handle((ignored, error) -> error)
                .<ProviderSnapshot>thenCompose(error -> {
                    if (error == null) {
                        log.info("Provider store: {}", action);
                        return reloadAfterPending();
                    }
                    var cause = unwrap(error);
                    log.warn("Provider store: {} failed: {}", action, cause.getMessage());
                    return reloadAfterPending().<ProviderSnapshot>handle((snapshot, reloadError) -> {
                        if (reloadError != null) cause.addSuppressed(unwrap(reloadError));
                        throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
                    });
                });
    }

    private CompletableFuture<ProviderSnapshot> reloadAfterPending() {
        CompletableFuture<ProviderSnapshot> pending;
        synchronized (this) {
            pending = inFlight;
        }
        if (pending == null) return refresh();
        return pending.handle((s, e) -> null).thenCompose(ignored -> refresh());
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
