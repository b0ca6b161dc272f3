package com.prime.client.http;

import com.prime.client.error.CancelledException;
import com.prime.client.error.RequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 *
 * <p>One instance holds one HTTP session (connection pool plus basic-auth
 * credentials) shared by every request of the owning client.</p>
 *
 * Usage:
 * <pre>
 * HttpTransport transport = JdkHttpTransport.builder()
 *     .credentials(new Credentials("admin", "secret"))
 *     .verifyTls(false)
 *     .build();
 * </pre>
 */
public class JdkHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final Credentials credentials;

    private JdkHttpTransport(Builder builder) {
        this.credentials = builder.credentials;
        HttpClient.Builder clientBuilder = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NEVER);
        if (!builder.verifyTls) {
            log.warn("TLS certificate verification is disabled");
            clientBuilder.sslContext(trustAllContext());
        }
        this.httpClient = clientBuilder.build();
    }

    @Override
    public HttpResult execute(HttpCall call) {
        String url = call.fullUrl();
        HttpRequest.Builder request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(url));
        } catch (IllegalArgumentException e) {
            throw RequestException.malformedUrl(url, e);
        }
        request.timeout(call.timeout())
                .header("Accept", "application/json");
        if (credentials != null) {
            request.header("Authorization", credentials.basicAuthHeader());
        }
        switch (call.bodyType()) {
            case JSON -> request.header("Content-Type", "application/json")
                    .method(call.method(), publisher(call.body()));
            case FORM -> request.header("Content-Type", "application/x-www-form-urlencoded")
                    .method(call.method(), publisher(call.body()));
            default -> request.method(call.method(), HttpRequest.BodyPublishers.noBody());
        }

        log.debug("{} {}", call.method(), url);
        try {
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            return new HttpResult(response.statusCode(), response.body(), url);
        } catch (HttpTimeoutException e) {
            throw RequestException.timedOut(url, e);
        } catch (IOException e) {
            throw RequestException.transport(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Request to " + url + " was interrupted", e);
        }
    }

    private static HttpRequest.BodyPublisher publisher(String body) {
        return body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body);
    }

    private static SSLContext trustAllContext() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[]{new TrustAllManager()}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot create TLS context", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Credentials credentials;
        private boolean verifyTls = true;
        private Duration connectTimeout;

        public Builder credentials(Credentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public JdkHttpTransport build() {
            return new JdkHttpTransport(this);
        }
    }

    // Extended manager: the JDK skips its own hostname check for these.
    private static class TrustAllManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
