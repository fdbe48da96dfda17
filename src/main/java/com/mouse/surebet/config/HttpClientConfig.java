package com.mouse.surebet.config;

import com.mouse.surebet.interceptor.HttpTimingInterceptor;
import com.mouse.surebet.interceptor.NoCacheHeadersInterceptor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient surebetHttpClient(SurebetProperties properties) {
        Duration timeout = properties.getSnapshot().getTimeout() != null
                ? properties.getSnapshot().getTimeout()
                : Duration.ofSeconds(5);
        log.info("Creating OkHttp client | timeout={}ms", timeout.toMillis());

        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .followRedirects(true)
                .followSslRedirects(true)
                .retryOnConnectionFailure(true)
                .addInterceptor(new HttpTimingInterceptor())
                .addInterceptor(new NoCacheHeadersInterceptor())
                .build();
    }
}
