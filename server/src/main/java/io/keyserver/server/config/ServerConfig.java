package io.keyserver.server.config;

/**
 * Configuration of the REST server.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param host          bind address of the HTTP listener
 * @param port          listen port; {@code 0} picks a free port
 * @param maxBodyBytes  largest request body accepted, in bytes
 * @param healthEnabled whether the liveness endpoint is registered
 * @param healthPath    liveness endpoint path
 * @param loggingFormat {@code json} or {@code text}
 * @param loggingLevel  root log level
 */
public record ServerConfig(
        String host,
        int port,
        int maxBodyBytes,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private int maxBodyBytes = 1_048_576; // 1 MB
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(host, port, maxBodyBytes, healthEnabled, healthPath, loggingFormat, loggingLevel);
        }
    }
}
