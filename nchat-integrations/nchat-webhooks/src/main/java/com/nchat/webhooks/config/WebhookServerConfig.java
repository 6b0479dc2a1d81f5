package com.nchat.webhooks.config;

/**
 * Immutable configuration for {@link com.nchat.webhooks.server.WebhookServer}.
 *
 * Build with the nested {@link Builder}:
 * <pre>
 *   WebhookServerConfig config = WebhookServerConfig.builder()
 *       .port(8443)
 *       .path("/hooks/*")
 *       .maxThreads(20)
 *       .build();
 * </pre>
 * A port of {@code 0} binds an ephemeral port; read it back with
 * {@link com.nchat.webhooks.server.WebhookServer#getPort()}.
 */
public final class WebhookServerConfig {

    private final String host;
    private final int    port;
    private final String path;
    private final int    maxThreads;
    private final int    minThreads;
    private final int    maxBodyBytes;

    private WebhookServerConfig(Builder b) {
        this.host         = b.host;
        this.port         = b.port;
        this.path         = b.path;
        this.maxThreads   = b.maxThreads;
        this.minThreads   = b.minThreads;
        this.maxBodyBytes = b.maxBodyBytes;
    }

    /** {@code null} binds all interfaces. */
    public String getHost()         { return host; }
    public int    getPort()         { return port; }
    public String getPath()         { return path; }
    public int    getMaxThreads()   { return maxThreads; }
    public int    getMinThreads()   { return minThreads; }
    public int    getMaxBodyBytes() { return maxBodyBytes; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String host;
        private int    port         = 8080;
        private String path         = "/webhooks/*";
        private int    maxThreads   = 10;
        private int    minThreads   = 2;
        private int    maxBodyBytes = 1024 * 1024;

        public Builder host(String host)              { this.host = host; return this; }
        public Builder port(int port)                 { this.port = port; return this; }
        public Builder path(String path)              { this.path = path; return this; }
        public Builder maxThreads(int maxThreads)     { this.maxThreads = maxThreads; return this; }
        public Builder minThreads(int minThreads)     { this.minThreads = minThreads; return this; }
        public Builder maxBodyBytes(int maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; return this; }

        public WebhookServerConfig build() {
            if (port < 0 || port > 65_535) {
                throw new IllegalStateException("port out of range: " + port);
            }
            if (path == null || !path.startsWith("/")) {
                throw new IllegalStateException("path must start with '/': " + path);
            }
            if (minThreads < 1 || maxThreads < minThreads) {
                throw new IllegalStateException("need 1 <= minThreads <= maxThreads, got "
                        + minThreads + ".." + maxThreads);
            }
            if (maxBodyBytes <= 0) {
                throw new IllegalStateException("maxBodyBytes must be > 0");
            }
            return new WebhookServerConfig(this);
        }
    }
}
