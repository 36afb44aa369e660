package com.libragraph.modelgate.core.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * Logs outbound calls at DEBUG with credentials masked. Bodies are never logged:
 * they carry user prompts.
 */
public class LoggingInterceptor implements Interceptor {

    private static final Logger log = Logger.getLogger(LoggingInterceptor.class);

    private static final Set<String> SENSITIVE = Set.of("authorization", "x-api-key");

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        if (!log.isDebugEnabled()) {
            return chain.proceed(request);
        }

        long start = System.nanoTime();
        log.debugf("-> %s %s%n%s", request.method(), request.url(), redact(request.headers()));

        Response response = chain.proceed(request);

        log.debugf("<- %d %s in %.1f ms", Integer.valueOf(response.code()), response.request().url(),
                Double.valueOf((System.nanoTime() - start) / 1e6d));
        return response;
    }

    static String redact(Headers headers) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < headers.size(); i++) {
            String name = headers.name(i);
            String value = SENSITIVE.contains(name.toLowerCase(Locale.ROOT)) ? "██" : headers.value(i);
            out.append(name).append(": ").append(value).append('\n');
        }
        return out.toString();
    }
}
