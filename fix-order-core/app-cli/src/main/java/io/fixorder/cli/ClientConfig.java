package io.fixorder.cli;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fixorder.order.FixSession;
import io.fixorder.transport.TransportEndpoint;
import io.fixorder.transport.TransportTimeouts;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public final class ClientConfig {
    static final String DEFAULT_HOST = "127.0.0.1";
    static final int DEFAULT_PORT = 9876;
    static final String DEFAULT_SENDER_COMP_ID = "CLIENT1";
    static final String DEFAULT_TARGET_COMP_ID = "SERVER1";
    static final long DEFAULT_TIMEOUT_MS = 8_000L;

    private final String host;
    private final int port;
    private final String senderCompId;
    private final String targetCompId;
    private final long connectTimeoutMs;
    private final long readTimeoutMs;
    private final int receiveBufferSize;

    private ClientConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.senderCompId = builder.senderCompId;
        this.targetCompId = builder.targetCompId;
        this.connectTimeoutMs = builder.connectTimeoutMs;
        this.readTimeoutMs = builder.readTimeoutMs;
        this.receiveBufferSize = builder.receiveBufferSize;
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ClientConfig load(Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath)) {
            throw new IllegalArgumentException("Client config file does not exist: " + configPath);
        }
        ClientSpec spec = objectMapperFor(configPath).readValue(configPath.toFile(), ClientSpec.class);
        if (spec == null) {
            return defaults();
        }

        Builder builder = builder();
        if (spec.host != null && !spec.host.isBlank()) {
            builder.host(spec.host);
        }
        if (spec.port != null) {
            builder.port(spec.port);
        }
        if (spec.senderCompId != null && !spec.senderCompId.isBlank()) {
            builder.senderCompId(spec.senderCompId);
        }
        if (spec.targetCompId != null && !spec.targetCompId.isBlank()) {
            builder.targetCompId(spec.targetCompId);
        }
        if (spec.connectTimeoutMs != null) {
            builder.connectTimeoutMs(spec.connectTimeoutMs);
        }
        if (spec.readTimeoutMs != null) {
            builder.readTimeoutMs(spec.readTimeoutMs);
        }
        if (spec.receiveBufferSize != null) {
            builder.receiveBufferSize(spec.receiveBufferSize);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return builder()
            .host(host)
            .port(port)
            .senderCompId(senderCompId)
            .targetCompId(targetCompId)
            .connectTimeoutMs(connectTimeoutMs)
            .readTimeoutMs(readTimeoutMs)
            .receiveBufferSize(receiveBufferSize);
    }

    public TransportEndpoint endpoint() {
        return new TransportEndpoint(host, port);
    }

    public TransportTimeouts timeouts() {
        return new TransportTimeouts(Duration.ofMillis(connectTimeoutMs), Duration.ofMillis(readTimeoutMs), receiveBufferSize);
    }

    public FixSession newSession() {
        return new FixSession(senderCompId, targetCompId);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String senderCompId() {
        return senderCompId;
    }

    public String targetCompId() {
        return targetCompId;
    }

    public long connectTimeoutMs() {
        return connectTimeoutMs;
    }

    public long readTimeoutMs() {
        return readTimeoutMs;
    }

    public int receiveBufferSize() {
        return receiveBufferSize;
    }

    Map<String, Object> toSummary() {
        return Map.of(
            "host", host,
            "port", port,
            "senderCompId", senderCompId,
            "targetCompId", targetCompId,
            "connectTimeoutMs", connectTimeoutMs,
            "readTimeoutMs", readTimeoutMs
        );
    }

    private static ObjectMapper objectMapperFor(Path configPath) {
        String lower = configPath.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper;
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            mapper = new ObjectMapper(new YAMLFactory());
        } else {
            mapper = new ObjectMapper();
        }
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String senderCompId = DEFAULT_SENDER_COMP_ID;
        private String targetCompId = DEFAULT_TARGET_COMP_ID;
        private long connectTimeoutMs = DEFAULT_TIMEOUT_MS;
        private long readTimeoutMs = DEFAULT_TIMEOUT_MS;
        private int receiveBufferSize = TransportTimeouts.DEFAULT_RECEIVE_BUFFER_SIZE;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder senderCompId(String senderCompId) {
            this.senderCompId = senderCompId;
            return this;
        }

        public Builder targetCompId(String targetCompId) {
            this.targetCompId = targetCompId;
            return this;
        }

        public Builder connectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder readTimeoutMs(long readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public Builder receiveBufferSize(int receiveBufferSize) {
            this.receiveBufferSize = receiveBufferSize;
            return this;
        }

        public ClientConfig build() {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host must not be blank");
            }
            if (port < 1 || port > 65_535) {
                throw new IllegalArgumentException("port must be within 1..65535: " + port);
            }
            if (connectTimeoutMs <= 0) {
                throw new IllegalArgumentException("connectTimeoutMs must be > 0");
            }
            if (readTimeoutMs <= 0) {
                throw new IllegalArgumentException("readTimeoutMs must be > 0");
            }
            if (receiveBufferSize <= 0) {
                throw new IllegalArgumentException("receiveBufferSize must be > 0");
            }
            return new ClientConfig(this);
        }
    }

    static final class ClientSpec {
        public String host;
        public Integer port;
        @JsonAlias({"sender_comp_id", "sender"})
        public String senderCompId;
        @JsonAlias({"target_comp_id", "target"})
        public String targetCompId;
        @JsonAlias({"connect_timeout_ms"})
        public Long connectTimeoutMs;
        @JsonAlias({"read_timeout_ms"})
        public Long readTimeoutMs;
        @JsonAlias({"receive_buffer_size"})
        public Integer receiveBufferSize;
    }
}
