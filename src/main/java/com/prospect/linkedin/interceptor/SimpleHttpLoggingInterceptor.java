package com.prospect.linkedin.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Logs outbound alert calls with timing. Bot tokens embedded in the path are masked.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    private static final Pattern BOT_TOKEN = Pattern.compile("/bot[^/]+/");

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String path = maskPath(request.url().encodedPath());

        log.debug("→ {} {}{}", request.method(), request.url().host(), path);

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.error("← FAILED {} after {}ms: {}", path, totalMs, e.getMessage());
            throw e;
        }

        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.debug("← {} {} | {}ms", response.code(), path, totalMs);
        return response;
    }

    static String maskPath(String path) {
        return BOT_TOKEN.matcher(path).replaceFirst("/bot***/");
    }
}
