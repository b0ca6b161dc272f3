package com.prime.client.api;

import com.prime.client.cache.CacheConfig;
import com.prime.client.fetch.FetchOptions;
import com.prime.client.fetch.ZeroCountPolicy;

import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection and default request settings of a {@link PrimeClient}.
 *
 * <p>Built programmatically, or read from {@link Properties} with
 * {@link #fromProperties(Properties)} using these keys (all but
 * {@code prime.baseUrl} optional):</p>
 * <pre>
 * prime.baseUrl=https://prime.example.com
 * prime.apiPath=/webacs/api/v1/
 * prime.username=admin
 * prime.password=secret
 * prime.verifyTls=true
 * prime.virtualDomain=ROOT-DOMAIN
 * prime.scopeFilterKey=_ctx.domain
 * prime.connectTimeout=PT30S
 * prime.pageSize=1000
 * prime.concurrency=5
 * prime.holdDuration=PT1S
 * prime.requestTimeout=PT300S
 * prime.checkCache=true
 * prime.zeroCountPolicy=FAIL
 * prime.classifierZeroCountCheck=false
 * prime.cache.enabled=true
 * prime.cache.maxSize=0
 * </pre>
 * Durations are ISO-8601 ({@code PT1S}) or plain milliseconds ({@code 1000}).
 */
public class ClientConfig {

    public static final String DEFAULT_API_PATH = "/webacs/api/v1/";
    public static final String DEFAULT_SCOPE_FILTER_KEY = "_ctx.domain";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final String PREFIX = "prime.";

    private final String baseUrl;
    private final String apiPath;
    private final String username;
    private final String password;
    private final boolean verifyTls;
    private final String virtualDomain;
    private final String scopeFilterKey;
    private final Duration connectTimeout;
    private final FetchOptions fetchOptions;
    private final boolean classifierZeroCountCheck;
    private final CacheConfig cacheConfig;

    private ClientConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.apiPath = builder.apiPath;
        this.username = builder.username;
        this.password = builder.password;
        this.verifyTls = builder.verifyTls;
        this.virtualDomain = builder.virtualDomain;
        this.scopeFilterKey = builder.scopeFilterKey;
        this.connectTimeout = builder.connectTimeout;
        this.fetchOptions = builder.fetchOptions;
        this.classifierZeroCountCheck = builder.classifierZeroCountCheck;
        this.cacheConfig = builder.cacheConfig;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiPath() {
        return apiPath;
    }

    /**
     * The REST API root: base URL joined with the API path, ending with '/'.
     */
    public String getApiUrl() {
        String path = apiPath.endsWith("/") ? apiPath : apiPath + "/";
        return URI.create(baseUrl).resolve(path).toString();
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean hasCredentials() {
        return username != null && password != null;
    }

    public boolean isVerifyTls() {
        return verifyTls;
    }

    /**
     * Default scope filter applied to every request, or null.
     */
    public String getVirtualDomain() {
        return virtualDomain;
    }

    public String getScopeFilterKey() {
        return scopeFilterKey;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public FetchOptions getFetchOptions() {
        return fetchOptions;
    }

    public boolean isClassifierZeroCountCheck() {
        return classifierZeroCountCheck;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Reads a configuration from properties, see the class documentation for keys.
     *
     * @throws IllegalArgumentException if a value is missing or malformed
     */
    public static ClientConfig fromProperties(Properties props) {
        Builder builder = builder().baseUrl(required(props, "baseUrl"));
        String value;
        if ((value = get(props, "apiPath")) != null) {
            builder.apiPath(value);
        }
        if (get(props, "username") != null || get(props, "password") != null) {
            builder.credentials(required(props, "username"), required(props, "password"));
        }
        if ((value = get(props, "verifyTls")) != null) {
            builder.verifyTls(Boolean.parseBoolean(value));
        }
        if ((value = get(props, "virtualDomain")) != null) {
            builder.virtualDomain(value);
        }
        if ((value = get(props, "scopeFilterKey")) != null) {
            builder.scopeFilterKey(value);
        }
        if ((value = get(props, "connectTimeout")) != null) {
            builder.connectTimeout(parseDuration("connectTimeout", value));
        }
        if ((value = get(props, "classifierZeroCountCheck")) != null) {
            builder.classifierZeroCountCheck(Boolean.parseBoolean(value));
        }

        FetchOptions.Builder fetch = FetchOptions.builder();
        if ((value = get(props, "pageSize")) != null) {
            fetch.pageSize(parseInt("pageSize", value));
        }
        if ((value = get(props, "concurrency")) != null) {
            fetch.concurrency(parseInt("concurrency", value));
        }
        if ((value = get(props, "holdDuration")) != null) {
            fetch.holdDuration(parseDuration("holdDuration", value));
        }
        if ((value = get(props, "requestTimeout")) != null) {
            fetch.requestTimeout(parseDuration("requestTimeout", value));
        }
        if ((value = get(props, "checkCache")) != null) {
            fetch.checkCache(Boolean.parseBoolean(value));
        }
        if ((value = get(props, "zeroCountPolicy")) != null) {
            try {
                fetch.zeroCountPolicy(ZeroCountPolicy.valueOf(value.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(PREFIX + "zeroCountPolicy must be FAIL or EMPTY: " + value, e);
            }
        }
        builder.fetchOptions(fetch.build());

        boolean cacheEnabled = !"false".equalsIgnoreCase(get(props, "cache.enabled"));
        String maxSize = get(props, "cache.maxSize");
        builder.cacheConfig(new CacheConfig(maxSize != null ? parseInt("cache.maxSize", maxSize) : 0, cacheEnabled));
        return builder.build();
    }

    private static String get(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    private static String required(Properties props, String key) {
        String value = get(props, key);
        if (value == null) {
            throw new IllegalArgumentException(PREFIX + key + " is required");
        }
        return value;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " must be an integer: " + value, e);
        }
    }

    static Duration parseDuration(String key, String value) {
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " must be an ISO-8601 duration or milliseconds: "
                    + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiPath = DEFAULT_API_PATH;
        private String username;
        private String password;
        private boolean verifyTls = true;
        private String virtualDomain;
        private String scopeFilterKey = DEFAULT_SCOPE_FILTER_KEY;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private FetchOptions fetchOptions = FetchOptions.defaults();
        private boolean classifierZeroCountCheck = false;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        /**
         * Server URL without the API path, e.g. {@code https://prime.example.com}.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiPath(String apiPath) {
            this.apiPath = Objects.requireNonNull(apiPath, "apiPath is required");
            return this;
        }

        public Builder credentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder verifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public Builder virtualDomain(String virtualDomain) {
            this.virtualDomain = virtualDomain;
            return this;
        }

        public Builder scopeFilterKey(String scopeFilterKey) {
            this.scopeFilterKey = Objects.requireNonNull(scopeFilterKey, "scopeFilterKey is required");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout is required");
            return this;
        }

        public Builder fetchOptions(FetchOptions fetchOptions) {
            this.fetchOptions = Objects.requireNonNull(fetchOptions, "fetchOptions is required");
            return this;
        }

        /**
         * Enables the zero-count check on page responses, for API versions that
         * report empty queries inside a successful response.
         */
        public Builder classifierZeroCountCheck(boolean classifierZeroCountCheck) {
            this.classifierZeroCountCheck = classifierZeroCountCheck;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public ClientConfig build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl is required");
            }
            URI uri;
            try {
                uri = URI.create(baseUrl);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("baseUrl is not a valid URL: " + baseUrl, e);
            }
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL: " + baseUrl);
            }
            if ((username == null) != (password == null)) {
                throw new IllegalArgumentException("username and password must be set together");
            }
            return new ClientConfig(this);
        }
    }
}
