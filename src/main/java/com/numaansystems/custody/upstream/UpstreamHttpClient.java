package com.numaansystems.custody.upstream;

import com.numaansystems.custody.error.UpstreamExchangeException;
import com.numaansystems.custody.error.UpstreamTimeoutException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Shared HTTP client for every call to Google.
 *
 * <p>Wraps a pooled Apache HttpClient with a connect timeout and a response
 * timeout. Automatic retries are disabled: a refresh or code exchange that
 * reached Google must not be sent twice behind the caller's back.</p>
 *
 * <p>Transport failures are translated into the service's own exceptions:</p>
 * <ul>
 *   <li>Connect or read timeout: {@link UpstreamTimeoutException}</li>
 *   <li>Any other I/O failure: {@link UpstreamExchangeException}</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class UpstreamHttpClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamHttpClient.class);

    private static final int MAX_CONNECTIONS = 50;

    private final CloseableHttpClient httpClient;

    /**
     * @param connectTimeout time allowed to establish a connection
     * @param responseTimeout time allowed between sending the request and reading the response
     */
    public UpstreamHttpClient(Duration connectTimeout, Duration responseTimeout) {
        Timeout connect = Timeout.ofMilliseconds(connectTimeout.toMillis());
        Timeout response = Timeout.ofMilliseconds(responseTimeout.toMillis());

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(MAX_CONNECTIONS)
                .setMaxConnPerRoute(MAX_CONNECTIONS)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(connect)
                        .setSocketTimeout(response)
                        .build())
                .build();

        this.httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(connect)
                        .setResponseTimeout(response)
                        .build())
                .disableAutomaticRetries()
                .disableRedirectHandling()
                .build();
    }

    /**
     * Sends a request and reads the whole response.
     *
     * @param request the request to send
     * @param operation short description used in log lines and error messages
     * @return status and body, whatever the status
     * @throws UpstreamTimeoutException if the call timed out
     * @throws UpstreamExchangeException if the call failed for any other I/O reason
     */
    public UpstreamResponse execute(HttpUriRequestBase request, String operation) {
        long started = System.nanoTime();
        try {
            UpstreamResponse result = httpClient.execute(request, response -> new UpstreamResponse(
                    response.getCode(),
                    response.getEntity() == null
                            ? ""
                            : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)));
            logger.debug("{} returned {} in {} ms", operation, result.status(),
                    Duration.ofNanos(System.nanoTime() - started).toMillis());
            return result;
        } catch (InterruptedIOException e) {
            logger.warn("{} timed out after {} ms", operation,
                    Duration.ofNanos(System.nanoTime() - started).toMillis());
            throw new UpstreamTimeoutException(operation + " timed out", e);
        } catch (IOException e) {
            logger.warn("{} failed: {}", operation, e.getMessage());
            throw new UpstreamExchangeException(operation + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
