package io.lanmesh.network;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Node configuration. Defaults match a classroom LAN of twenty boards on
 * {@code 10.102.251.1-20:9090}.
 */
public class MeshOptions {

    public static final String RESOURCE = "lanmesh.properties";
    public static final String PREFIX = "lanmesh.";

    public final String bindHost;
    public final int port;
    public final String addressPrefix;
    public final int addressStart;
    public final int addressCount;
    public final Duration initiatorStepTimeout;
    public final Duration acceptorStepTimeout;
    public final int maxSeekAttempts;
    public final Duration seekBackoff;
    public final int maxFrameLength;
    public final boolean yieldToLowerId;

    private MeshOptions(Builder builder) {
        this.bindHost = builder.bindHost;
        this.port = builder.port;
        this.addressPrefix = builder.addressPrefix;
        this.addressStart = builder.addressStart;
        this.addressCount = builder.addressCount;
        this.initiatorStepTimeout = builder.initiatorStepTimeout;
        this.acceptorStepTimeout = builder.acceptorStepTimeout;
        this.maxSeekAttempts = builder.maxSeekAttempts;
        this.seekBackoff = builder.seekBackoff;
        this.maxFrameLength = builder.maxFrameLength;
        this.yieldToLowerId = builder.yieldToLowerId;
    }

    public static MeshOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code lanmesh.*} keys; absent keys keep their defaults.
     */
    public static MeshOptions fromProperties(Properties props) {
        Builder b = builder();
        String value;
        if ((value = get(props, "bindHost")) != null) b.bindHost(value);
        if ((value = get(props, "port")) != null) b.port(parseInt("port", value));
        if ((value = get(props, "addressPrefix")) != null) b.addressPrefix(value);
        if ((value = get(props, "addressStart")) != null) b.addressStart(parseInt("addressStart", value));
        if ((value = get(props, "addressCount")) != null) b.addressCount(parseInt("addressCount", value));
        if ((value = get(props, "initiatorStepTimeoutMs")) != null) {
            b.initiatorStepTimeout(Duration.ofMillis(parseInt("initiatorStepTimeoutMs", value)));
        }
        if ((value = get(props, "acceptorStepTimeoutMs")) != null) {
            b.acceptorStepTimeout(Duration.ofMillis(parseInt("acceptorStepTimeoutMs", value)));
        }
        if ((value = get(props, "maxSeekAttempts")) != null) b.maxSeekAttempts(parseInt("maxSeekAttempts", value));
        if ((value = get(props, "seekBackoffMs")) != null) {
            b.seekBackoff(Duration.ofMillis(parseInt("seekBackoffMs", value)));
        }
        if ((value = get(props, "maxFrameLength")) != null) b.maxFrameLength(parseInt("maxFrameLength", value));
        if ((value = get(props, "yieldToLowerId")) != null) b.yieldToLowerId(Boolean.parseBoolean(value));
        return b.build();
    }

    /**
     * Classpath {@value #RESOURCE} overlaid with {@code -Dlanmesh.*} system properties.
     */
    public static MeshOptions load() {
        Properties props = new Properties();
        try (InputStream in = MeshOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    private static String get(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    public AddressRange addressRange() {
        return new AddressRange(addressPrefix, addressStart, addressCount);
    }

    public boolean hasSpecificBindHost() {
        return !AddressRange.isWildcard(bindHost);
    }

    public Builder toBuilder() {
        return builder()
            .bindHost(bindHost)
            .port(port)
            .addressPrefix(addressPrefix)
            .addressStart(addressStart)
            .addressCount(addressCount)
            .initiatorStepTimeout(initiatorStepTimeout)
            .acceptorStepTimeout(acceptorStepTimeout)
            .maxSeekAttempts(maxSeekAttempts)
            .seekBackoff(seekBackoff)
            .maxFrameLength(maxFrameLength)
            .yieldToLowerId(yieldToLowerId);
    }

    public static class Builder {
        private String bindHost = "0.0.0.0";
        private int port = 9090;
        private String addressPrefix = "10.102.251.";
        private int addressStart = 1;
        private int addressCount = 20;
        private Duration initiatorStepTimeout = Duration.ofSeconds(2);
        private Duration acceptorStepTimeout = Duration.ofSeconds(5);
        private int maxSeekAttempts = 10;
        private Duration seekBackoff = Duration.ofSeconds(1);
        private int maxFrameLength = 64 * 1024;
        private boolean yieldToLowerId = true;

        public Builder bindHost(String host) { this.bindHost = host; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder addressPrefix(String prefix) { this.addressPrefix = prefix; return this; }
        public Builder addressStart(int start) { this.addressStart = start; return this; }
        public Builder addressCount(int count) { this.addressCount = count; return this; }
        public Builder initiatorStepTimeout(Duration timeout) { this.initiatorStepTimeout = timeout; return this; }
        public Builder acceptorStepTimeout(Duration timeout) { this.acceptorStepTimeout = timeout; return this; }
        public Builder maxSeekAttempts(int attempts) { this.maxSeekAttempts = attempts; return this; }
        public Builder seekBackoff(Duration backoff) { this.seekBackoff = backoff; return this; }
        public Builder maxFrameLength(int length) { this.maxFrameLength = length; return this; }
        public Builder yieldToLowerId(boolean yield) { this.yieldToLowerId = yield; return this; }

        public MeshOptions build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            if (maxSeekAttempts < 1) {
                throw new IllegalArgumentException("maxSeekAttempts must be at least 1");
            }
            if (initiatorStepTimeout.isNegative() || initiatorStepTimeout.isZero()
                    || acceptorStepTimeout.isNegative() || acceptorStepTimeout.isZero()) {
                throw new IllegalArgumentException("handshake step timeouts must be positive");
            }
            if (seekBackoff.isNegative()) {
                throw new IllegalArgumentException("seekBackoff must not be negative");
            }
            if (maxFrameLength < 256) {
                throw new IllegalArgumentException("maxFrameLength too small: " + maxFrameLength);
            }
            if (bindHost == null) {
                bindHost = "0.0.0.0";
            }
            return new MeshOptions(this);
        }
    }
}
