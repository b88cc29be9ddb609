package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.auth.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable configuration of a {@link TaskStreamClient}: where requests go, how often they
 * are attempted and how long each attempt may take.
 * <p>
 * Example usage:
 * <pre>
 * ClientSettings settings = ClientSettings.builder()
 *     .baseUrl("https://tasks.example.com")
 *     .maxAttempts(3)
 *     .retryDelay(Duration.ofSeconds(1))
 *     .route("/alias_memory_service/user_profiling", "https://profiling.example.com")
 *     .build();
 * </pre>
 * <p>
 * Attempt counts include the first attempt. Idempotent verbs (GET, DELETE) get
 * {@link #getMaxAttempts()} attempts, POST and PUT get exactly one unless a per-verb
 * override says otherwise.
 */
public final class ClientSettings {
    private static final Logger logger = LoggerFactory.getLogger(ClientSettings.class);

    public static final String ENV_API_URL = "TASKSTREAM_API_URL";
    public static final String ENV_USER_PROFILING_API_URL = "TASKSTREAM_USER_PROFILING_API_URL";
    public static final String ENV_MAX_RETRIES = "TASKSTREAM_MAX_RETRIES";
    public static final String ENV_RETRY_DELAY_MS = "TASKSTREAM_RETRY_DELAY_MS";
    public static final String ENV_ACCESS_TOKEN = "TASKSTREAM_ACCESS_TOKEN";
    public static final String ENV_REFRESH_TOKEN = "TASKSTREAM_REFRESH_TOKEN";

    /** Path prefix served by the separate user-profiling service. */
    public static final String USER_PROFILING_PATH_PREFIX = "/alias_memory_service/user_profiling";

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(1000);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_REFRESH_PATH = "/api/v1/refresh-token";

    private final String baseUrl;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final double backoffMultiplier;
    private final boolean useJitter;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final String refreshPath;
    private final Map<HttpMethod, Integer> attemptOverrides;
    private final Map<String, String> routes;
    private final Credential fallbackCredential;

    private ClientSettings(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.maxAttempts = builder.maxAttempts;
        this.retryDelay = builder.retryDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.useJitter = builder.useJitter;
        this.requestTimeout = builder.requestTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.refreshPath = builder.refreshPath;
        this.attemptOverrides = Collections.unmodifiableMap(new EnumMap<>(builder.attemptOverrides));
        Map<String, String> routeCopy = new LinkedHashMap<>();
        builder.routes.forEach((prefix, url) -> routeCopy.put(prefix, stripTrailingSlash(url)));
        this.routes = Collections.unmodifiableMap(routeCopy);
        this.fallbackCredential = builder.fallbackCredential;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated from environment-style variables.
     * <p>
     * Recognized keys: {@value #ENV_API_URL}, {@value #ENV_USER_PROFILING_API_URL},
     * {@value #ENV_MAX_RETRIES}, {@value #ENV_RETRY_DELAY_MS}, {@value #ENV_ACCESS_TOKEN} and
     * {@value #ENV_REFRESH_TOKEN}. Numbers that cannot be parsed are ignored with a warning
     * and the default stays in place.
     *
     * @param env the variables, typically {@code System.getenv()}
     * @return a builder that can be adjusted further before {@link Builder#build()}
     */
    public static Builder fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String apiUrl = env.get(ENV_API_URL);
        if (apiUrl != null && !apiUrl.isBlank()) {
            builder.baseUrl(apiUrl.trim());
        }
        String profilingUrl = env.get(ENV_USER_PROFILING_API_URL);
        if (profilingUrl != null && !profilingUrl.isBlank()) {
            builder.route(USER_PROFILING_PATH_PREFIX, profilingUrl.trim());
        }
        parseInt(env, ENV_MAX_RETRIES, 1).ifPresent(builder::maxAttempts);
        parseInt(env, ENV_RETRY_DELAY_MS, 0).ifPresent(ms -> builder.retryDelay(Duration.ofMillis(ms)));

        String access = env.get(ENV_ACCESS_TOKEN);
        String refresh = env.get(ENV_REFRESH_TOKEN);
        if (access != null && !access.isBlank()) {
            builder.fallbackCredential(new Credential(access.trim(), refresh == null ? null : refresh.trim()));
        }
        return builder;
    }

    private static Optional<Integer> parseInt(Map<String, String> env, String key, int min) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min) {
                logger.warn("Ignoring value '{}' for {}, must be >= {}", raw, key, min);
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparsable value '{}' for {}: {}", raw, key, e.getMessage());
            return Optional.empty();
        }
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .baseUrl(baseUrl)
                .maxAttempts(maxAttempts)
                .retryDelay(retryDelay)
                .backoffMultiplier(backoffMultiplier)
                .useJitter(useJitter)
                .requestTimeout(requestTimeout)
                .connectTimeout(connectTimeout)
                .refreshPath(refreshPath)
                .fallbackCredential(fallbackCredential);
        attemptOverrides.forEach(builder::maxAttempts);
        routes.forEach(builder::route);
        return builder;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Attempt budget for idempotent verbs without a per-verb override.
     *
     * @return total attempts including the first one
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public boolean isUseJitter() {
        return useJitter;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public String getRefreshPath() {
        return refreshPath;
    }

    public Map<String, String> getRoutes() {
        return routes;
    }

    public Optional<Credential> getFallbackCredential() {
        return Optional.ofNullable(fallbackCredential);
    }

    /**
     * Total attempts for a verb: the per-verb override if one is set, otherwise
     * {@link #getMaxAttempts()} for idempotent verbs and 1 for the others.
     *
     * @param method the verb
     * @return the attempt budget
     */
    public int maxAttemptsFor(HttpMethod method) {
        Integer override = attemptOverrides.get(method);
        if (override != null) {
            return override;
        }
        return method.isIdempotent() ? maxAttempts : 1;
    }

    /**
     * Builds the retry policy for the given attempt budget using the configured delays.
     *
     * @param attempts total attempts
     * @return the policy
     */
    public RetryPolicy retryPolicy(int attempts) {
        return RetryPolicy.of(attempts, retryDelay)
                .withBackoffMultiplier(backoffMultiplier)
                .withJitter(useJitter);
    }

    /**
     * Resolves a request path against the base URL, or against a route's URL when the path
     * starts with a registered prefix. The longest matching prefix wins. Absolute
     * {@code http(s)} URLs are used as they are.
     *
     * @param path the request path
     * @return the absolute URI
     */
    public URI resolve(String path) {
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return URI.create(path);
        }
        String normalized = path.startsWith("/") ? path : "/" + path;
        String target = baseUrl;
        int longest = -1;
        for (Map.Entry<String, String> route : routes.entrySet()) {
            String prefix = route.getKey();
            if (normalized.startsWith(prefix) && prefix.length() > longest) {
                target = route.getValue();
                longest = prefix.length();
            }
        }
        return URI.create(target + normalized);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    public static final class Builder {
        private String baseUrl;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private double backoffMultiplier = 1.0;
        private boolean useJitter = false;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private String refreshPath = DEFAULT_REFRESH_PATH;
        private final Map<HttpMethod, Integer> attemptOverrides = new EnumMap<>(HttpMethod.class);
        private final Map<String, String> routes = new LinkedHashMap<>();
        private Credential fallbackCredential;

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Sets the attempt budget for GET and DELETE.
         *
         * @param maxAttempts total attempts including the first one (must be >= 1)
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Overrides the attempt budget of one verb. This is the only way to let POST or PUT
         * be repeated.
         *
         * @param method the verb
         * @param attempts total attempts including the first one (must be >= 1)
         * @return this builder
         */
        public Builder maxAttempts(HttpMethod method, int attempts) {
            this.attemptOverrides.put(method, attempts);
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * Values above 1.0 turn the fixed delay into exponential backoff.
         *
         * @param backoffMultiplier factor applied to the delay after each failed attempt
         * @return this builder
         */
        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder useJitter(boolean useJitter) {
            this.useJitter = useJitter;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder refreshPath(String refreshPath) {
            this.refreshPath = refreshPath;
            return this;
        }

        /**
         * Sends every request whose path starts with {@code pathPrefix} to {@code baseUrl}.
         *
         * @param pathPrefix the path prefix, starting with '/'
         * @param baseUrl the base URL serving that prefix
         * @return this builder
         */
        public Builder route(String pathPrefix, String baseUrl) {
            this.routes.put(pathPrefix, baseUrl);
            return this;
        }

        /**
         * Tokens used when the credential store is empty.
         *
         * @param fallbackCredential the fixed credential, or null for none
         * @return this builder
         */
        public Builder fallbackCredential(Credential fallbackCredential) {
            this.fallbackCredential = fallbackCredential;
            return this;
        }

        /**
         * Validates and builds the settings.
         *
         * @return the settings
         * @throws IllegalArgumentException if a value is missing or out of range
         */
        public ClientSettings build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl is required");
            }
            requireHttpUrl("baseUrl", baseUrl);
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
            }
            attemptOverrides.forEach((method, attempts) -> {
                if (attempts == null || attempts < 1) {
                    throw new IllegalArgumentException("maxAttempts for " + method + " must be >= 1 but was " + attempts);
                }
            });
            requirePositiveOrZero("retryDelay", retryDelay);
            requirePositive("requestTimeout", requestTimeout);
            requirePositive("connectTimeout", connectTimeout);
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1.0 but was " + backoffMultiplier);
            }
            if (refreshPath == null || refreshPath.isBlank()) {
                throw new IllegalArgumentException("refreshPath is required");
            }
            routes.forEach((prefix, url) -> {
                if (prefix == null || !prefix.startsWith("/")) {
                    throw new IllegalArgumentException("Route prefix must start with '/': " + prefix);
                }
                requireHttpUrl("route " + prefix, url);
            });
            return new ClientSettings(this);
        }

        private static void requireHttpUrl(String name, String url) {
            if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
                throw new IllegalArgumentException(name + " must be an http(s) URL but was " + url);
            }
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }

        private static void requirePositiveOrZero(String name, Duration value) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
        }
    }
}
