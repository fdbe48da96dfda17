package com.mouse.surebet.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Logs method, path, status and elapsed time of every outgoing call. Bodies are left unread.
 */
@Slf4j
public class HttpTimingInterceptor implements Interceptor {

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        log.debug("→ {} {}", request.method(), request.url().encodedPath());

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long failedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.debug("← FAILED {} after {}ms: {}", request.url().encodedPath(), failedMs, e.getMessage());
            throw e;
        }

        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.debug("← {} {} | {}ms | Size: {} bytes",
                response.code(),
                request.url().encodedPath(),
                totalMs,
                response.body() != null ? response.body().contentLength() : -1);
        return response;
    }
}
