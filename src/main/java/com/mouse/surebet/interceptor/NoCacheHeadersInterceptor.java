package com.mouse.surebet.interceptor;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

/**
 * The published snapshot sits behind a CDN; ask every hop for a fresh copy.
 */
public class NoCacheHeadersInterceptor implements Interceptor {

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request original = chain.request();

        Request request = original.newBuilder()
                .header("Cache-Control", "no-cache")
                .header("Pragma", "no-cache")
                .header("Accept", "application/json")
                .build();

        return chain.proceed(request);
    }
}
