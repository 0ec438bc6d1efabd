package me.golemcore.courseqa.infrastructure.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the shared OkHttp client and the worker pool that
 * runs blocking outbound calls.
 *
 * <p>
 * Timeouts and pool sizing come from {@code courseqa.http.*}. Adapters derive
 * their own clients from this one via {@link OkHttpClient#newBuilder()} so the
 * connection pool is shared. Tools and the LLM adapter run their blocking work
 * on {@code ioExecutor} rather than the common fork-join pool.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final CourseQaProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        CourseQaProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeoutMs(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDurationMs(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ioExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getHttp().getIoThreads()), r -> {
            Thread t = new Thread(r, "courseqa-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
