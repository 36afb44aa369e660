package com.libragraph.modelgate.core.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import okhttp3.OkHttpClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * Shared OkHttp client for vendor APIs and the auth gateway.
 */
@ApplicationScoped
public class HttpClientProducer {

    @ConfigProperty(name = "modelgate.http.connect-timeout", defaultValue = "PT10S")
    Duration connectTimeout;

    @ConfigProperty(name = "modelgate.http.read-timeout", defaultValue = "PT60S")
    Duration readTimeout;

    @Produces
    @Singleton
    public OkHttpClient okHttpClient() {
        return create(connectTimeout, readTimeout);
    }

    void close(@Disposes OkHttpClient client) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .addInterceptor(new LoggingInterceptor())
                .build();
    }
}
