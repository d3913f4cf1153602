package com.modelgate.settings;

import com.modelgate.auth.CredentialSet;
import com.modelgate.auth.OAuthBundle;
import com.modelgate.auth.OAuthTokenStore;
import com.modelgate.models.ModelDescriptor;
import com.modelgate.providers.BuiltinProviders;
import com.modelgate.providers.CustomProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reads every credential source. Each source is loaded independently: a
 * failing one is logged, recorded, and replaced by its empty default.
 */
public class CredentialLoader {

    private static final Logger log = LoggerFactory.getLogger(CredentialLoader.class);

    public record LoadedCredentials(
        CredentialSet credentials,
        List<CustomProviderConfig> customProviders,
        Map<String, ModelDescriptor> customModels,
        List<String> failures
    ) {
        public LoadedCredentials {
            customProviders = List.copyOf(customProviders);
            customModels = Collections.unmodifiableMap(new LinkedHashMap<>(customModels));
            failures = List.copyOf(failures);
        }

        public boolean degraded() {
            return !failures.isEmpty();
        }
    }

    private final SettingsStore settings;
    private final CustomProviderService customProviders;
    private final CustomModelService customModels;
    private final Map<String, OAuthTokenStore> oauthStores;
    private final Clock clock;

    public CredentialLoader(SettingsStore settings,
                            CustomProviderService customProviders,
                            CustomModelService customModels,
                            Map<String, OAuthTokenStore> oauthStores) {
        this(settings, customProviders, customModels, oauthStores, Clock.systemUTC());
    }

    public CredentialLoader(SettingsStore settings,
                            CustomProviderService customProviders,
                            CustomModelService customModels,
                            Map<String, OAuthTokenStore> oauthStores,
                            Clock clock) {
        this.settings = settings;
        this.customProviders = customProviders;
        this.customModels = customModels;
        this.oauthStores = Map.copyOf(oauthStores);
        this.clock = clock;
    }

    public LoadedCredentials load() {
        var failures = new ArrayList<String>();

        customProviders.reload();
        customModels.reload();
        List<CustomProviderConfig> customs = degrade("custom providers", failures, List.of(),
                customProviders::listEnabled);
        Map<String, ModelDescriptor> models = degrade("custom models", failures, Map.of(),
                customModels::getCustomModels);

        var providerIds = new LinkedHashSet<>(BuiltinProviders.definitions().keySet());
        customs.forEach(c -> providerIds.add(c.id()));

        Map<String, String> apiKeys = degrade("API keys", failures, Map.of(),
                () -> readKeyed(providerIds, SettingsKeys::apiKey));
        Map<String, String> baseUrls = degrade("base URLs", failures, Map.of(),
                () -> readKeyed(providerIds, SettingsKeys::baseUrl));
        Map<String, Boolean> altBilling = degrade("alt-billing flags", failures, Map.of(),
                () -> readFlags(BuiltinProviders.withAltBilling(), SettingsKeys::altBilling));
        Map<String, Boolean> international = degrade("international flags", failures, Map.of(),
                () -> readFlags(BuiltinProviders.withInternational(), SettingsKeys::international));

        var oauth = new HashMap<String, OAuthBundle>();
        var now = clock.instant();
        oauthStores.forEach((providerId, store) -> {
            OAuthBundle bundle = degrade("OAuth tokens for " + providerId, failures, null, store::currentToken);
            // an expired token is exchanged here; the old bundle stays when that fails
            if (bundle != null && !bundle.isUsable(now) && bundle.canRefresh()) {
                log.info("OAuth token for {} expired, refreshing", providerId);
                bundle = degrade("OAuth refresh for " + providerId, failures, bundle, store::refresh);
            }
            if (bundle != null) oauth.put(providerId, bundle);
        });

        var credentials = new CredentialSet(apiKeys, baseUrls, altBilling, international, oauth);
        log.info("Loaded credentials: {} API keys, {} base URL overrides, {} OAuth connections, "
                        + "{} custom providers, {} custom models{}",
                credentials.apiKeys().size(), credentials.baseUrlOverrides().size(), oauth.size(),
                customs.size(), models.size(), failures.isEmpty() ? "" : " (degraded: " + failures + ")");
        return new LoadedCredentials(credentials, customs, models, failures);
    }

    private Map<String, String> readKeyed(Iterable<String> providerIds, Function<String, String> naming) {
        var keys = new ArrayList<String>();
        providerIds.forEach(id -> keys.add(naming.apply(id)));
        var values = settings.getBatch(keys);
        var result = new HashMap<String, String>();
        for (var id : providerIds) {
            var value = values.get(naming.apply(id));
            if (value != null && !value.isBlank()) result.put(id, value);
        }
        return result;
    }

    private Map<String, Boolean> readFlags(List<String> providerIds, Function<String, String> naming) {
        var result = new HashMap<String, Boolean>();
        readKeyed(providerIds, naming).forEach((id, value) -> result.put(id, "true".equalsIgnoreCase(value)));
        return result;
    }

    private static <T> T degrade(String source, List<String> failures, T fallback, Supplier<T> loader) {
        try {
            return loader.get();
        } catch (RuntimeException e) {
            log.warn("Failed to load {}: {}", source, e.getMessage());
            failures.add(source + ": " + e.getMessage());
            return fallback;
        }
    }
}
