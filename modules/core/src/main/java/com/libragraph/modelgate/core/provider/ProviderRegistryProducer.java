package com.libragraph.modelgate.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import okhttp3.OkHttpClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class ProviderRegistryProducer {

    private static final Logger log = Logger.getLogger(ProviderRegistryProducer.class);

    @Inject
    OkHttpClient http;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "modelgate.providers.aliyun.api-key")
    Optional<String> aliyunApiKey;

    @ConfigProperty(name = "modelgate.providers.aliyun.base-url", defaultValue = AliyunProvider.DEFAULT_URL)
    String aliyunBaseUrl;

    @ConfigProperty(name = "modelgate.providers.aliyun.supported-models", defaultValue = AliyunProvider.DEFAULT_MODELS)
    List<String> aliyunModels;

    @ConfigProperty(name = "modelgate.providers.deepseek.api-key")
    Optional<String> deepseekApiKey;

    @ConfigProperty(name = "modelgate.providers.deepseek.base-url", defaultValue = DeepSeekProvider.DEFAULT_URL)
    String deepseekBaseUrl;

    @ConfigProperty(name = "modelgate.providers.deepseek.supported-models", defaultValue = DeepSeekProvider.DEFAULT_MODELS)
    List<String> deepseekModels;

    @Produces
    @Singleton
    public ProviderRegistry providerRegistry() {
        ProviderRegistry registry = ProviderRegistry.builder()
                .register(new AliyunProvider(
                        settings(AliyunProvider.NAME, aliyunApiKey, aliyunBaseUrl, aliyunModels),
                        http, objectMapper))
                .register(new DeepSeekProvider(
                        settings(DeepSeekProvider.NAME, deepseekApiKey, deepseekBaseUrl, deepseekModels),
                        http, objectMapper))
                .build();
        log.infof("ProviderRegistry initialized with %d providers", registry.size());
        return registry;
    }

    private static ProviderSettings settings(String name, Optional<String> apiKey,
                                             String baseUrl, List<String> models) {
        ProviderSettings settings = new ProviderSettings(name, apiKey.orElse(null), baseUrl, models);
        if (!settings.hasApiKey()) {
            log.warnf("No API key configured for provider '%s'; its tasks will fail", name);
        }
        log.infof("Registered provider: %s -> %s %s", name, baseUrl, models);
        return settings;
    }
}
