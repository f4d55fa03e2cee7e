package com.sparrowwallet.vortex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Tunable limits and parameters of the session engine. Instances are immutable; use {@link #builder()} or
 * {@link #fromJson(InputStream)} to create a non-default configuration.
 */
public class ProtocolConfig {
    public static final int DEFAULT_MAX_SKIP = 1000;
    public static final int DEFAULT_MAX_SKIPPED_KEYS = 2000;
    public static final long DEFAULT_SKIPPED_KEY_MAX_AGE_MS = 7L * 24 * 60 * 60 * 1000;
    public static final int DEFAULT_INITIAL_ONE_TIME_PRE_KEYS = 100;
    public static final int DEFAULT_ONE_TIME_PRE_KEY_LOW_WATER_MARK = 20;
    public static final int DEFAULT_ONE_TIME_PRE_KEY_BATCH_SIZE = 50;
    public static final String DEFAULT_CIPHER = "ChaChaPoly";
    public static final int DEFAULT_ARGON2_MEMORY_KIB = 65536;
    public static final int DEFAULT_ARGON2_ITERATIONS = 3;
    public static final int DEFAULT_ARGON2_PARALLELISM = 1;

    public static final ProtocolConfig DEFAULT = builder().build();

    private final int maxSkip;
    private final int maxSkippedKeys;
    private final long skippedKeyMaxAgeMs;
    private final int initialOneTimePreKeys;
    private final int oneTimePreKeyLowWaterMark;
    private final int oneTimePreKeyBatchSize;
    private final String cipher;
    private final int argon2MemoryKiB;
    private final int argon2Iterations;
    private final int argon2Parallelism;

    private ProtocolConfig(Builder builder) {
        if(builder.maxSkip < 0) {
            throw new IllegalArgumentException("maxSkip must not be negative");
        }
        if(builder.maxSkippedKeys < 2L * builder.maxSkip) {
            throw new IllegalArgumentException("maxSkippedKeys must be at least twice maxSkip");
        }
        if(builder.initialOneTimePreKeys < 0 || builder.oneTimePreKeyLowWaterMark < 0 || builder.oneTimePreKeyBatchSize < 1) {
            throw new IllegalArgumentException("Invalid one-time pre-key pool sizing");
        }
        if(builder.argon2MemoryKiB < 8 * builder.argon2Parallelism || builder.argon2Iterations < 1 || builder.argon2Parallelism < 1) {
            throw new IllegalArgumentException("Invalid Argon2 parameters");
        }

        this.maxSkip = builder.maxSkip;
        this.maxSkippedKeys = builder.maxSkippedKeys;
        this.skippedKeyMaxAgeMs = builder.skippedKeyMaxAgeMs;
        this.initialOneTimePreKeys = builder.initialOneTimePreKeys;
        this.oneTimePreKeyLowWaterMark = builder.oneTimePreKeyLowWaterMark;
        this.oneTimePreKeyBatchSize = builder.oneTimePreKeyBatchSize;
        this.cipher = builder.cipher;
        this.argon2MemoryKiB = builder.argon2MemoryKiB;
        this.argon2Iterations = builder.argon2Iterations;
        this.argon2Parallelism = builder.argon2Parallelism;
    }

    public int getMaxSkip() {
        return maxSkip;
    }

    public int getMaxSkippedKeys() {
        return maxSkippedKeys;
    }

    public long getSkippedKeyMaxAgeMs() {
        return skippedKeyMaxAgeMs;
    }

    public int getInitialOneTimePreKeys() {
        return initialOneTimePreKeys;
    }

    public int getOneTimePreKeyLowWaterMark() {
        return oneTimePreKeyLowWaterMark;
    }

    public int getOneTimePreKeyBatchSize() {
        return oneTimePreKeyBatchSize;
    }

    public String getCipher() {
        return cipher;
    }

    public int getArgon2MemoryKiB() {
        return argon2MemoryKiB;
    }

    public int getArgon2Iterations() {
        return argon2Iterations;
    }

    public int getArgon2Parallelism() {
        return argon2Parallelism;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from a JSON document. Properties that are absent keep their default values and unknown
     * properties are ignored.
     *
     * @param inputStream the JSON document
     * @return the configuration
     * @throws IOException if the document cannot be read or parsed
     */
    public static ProtocolConfig fromJson(InputStream inputStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ConfigFile file = mapper.readValue(inputStream, ConfigFile.class);

        Builder builder = builder();
        if(file.maxSkip != null) {
            builder.maxSkip(file.maxSkip);
        }
        if(file.maxSkippedKeys != null) {
            builder.maxSkippedKeys(file.maxSkippedKeys);
        }
        if(file.skippedKeyMaxAgeMs != null) {
            builder.skippedKeyMaxAgeMs(file.skippedKeyMaxAgeMs);
        }
        if(file.initialOneTimePreKeys != null) {
            builder.initialOneTimePreKeys(file.initialOneTimePreKeys);
        }
        if(file.oneTimePreKeyLowWaterMark != null) {
            builder.oneTimePreKeyLowWaterMark(file.oneTimePreKeyLowWaterMark);
        }
        if(file.oneTimePreKeyBatchSize != null) {
            builder.oneTimePreKeyBatchSize(file.oneTimePreKeyBatchSize);
        }
        if(file.cipher != null) {
            builder.cipher(file.cipher);
        }
        if(file.argon2MemoryKiB != null) {
            builder.argon2MemoryKiB(file.argon2MemoryKiB);
        }
        if(file.argon2Iterations != null) {
            builder.argon2Iterations(file.argon2Iterations);
        }
        if(file.argon2Parallelism != null) {
            builder.argon2Parallelism(file.argon2Parallelism);
        }

        try {
            return builder.build();
        } catch(IllegalArgumentException e) {
            throw new IOException("Invalid protocol configuration: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConfigFile {
        public Integer maxSkip;
        public Integer maxSkippedKeys;
        public Long skippedKeyMaxAgeMs;
        public Integer initialOneTimePreKeys;
        public Integer oneTimePreKeyLowWaterMark;
        public Integer oneTimePreKeyBatchSize;
        public String cipher;
        public Integer argon2MemoryKiB;
        public Integer argon2Iterations;
        public Integer argon2Parallelism;
    }

    public static class Builder {
        private int maxSkip = DEFAULT_MAX_SKIP;
        private int maxSkippedKeys = DEFAULT_MAX_SKIPPED_KEYS;
        private long skippedKeyMaxAgeMs = DEFAULT_SKIPPED_KEY_MAX_AGE_MS;
        private int initialOneTimePreKeys = DEFAULT_INITIAL_ONE_TIME_PRE_KEYS;
        private int oneTimePreKeyLowWaterMark = DEFAULT_ONE_TIME_PRE_KEY_LOW_WATER_MARK;
        private int oneTimePreKeyBatchSize = DEFAULT_ONE_TIME_PRE_KEY_BATCH_SIZE;
        private String cipher = DEFAULT_CIPHER;
        private int argon2MemoryKiB = DEFAULT_ARGON2_MEMORY_KIB;
        private int argon2Iterations = DEFAULT_ARGON2_ITERATIONS;
        private int argon2Parallelism = DEFAULT_ARGON2_PARALLELISM;

        private Builder() {}

        public Builder maxSkip(int maxSkip) {
            this.maxSkip = maxSkip;
            return this;
        }

        public Builder maxSkippedKeys(int maxSkippedKeys) {
            this.maxSkippedKeys = maxSkippedKeys;
            return this;
        }

        public Builder skippedKeyMaxAgeMs(long skippedKeyMaxAgeMs) {
            this.skippedKeyMaxAgeMs = skippedKeyMaxAgeMs;
            return this;
        }

        public Builder initialOneTimePreKeys(int initialOneTimePreKeys) {
            this.initialOneTimePreKeys = initialOneTimePreKeys;
            return this;
        }

        public Builder oneTimePreKeyLowWaterMark(int oneTimePreKeyLowWaterMark) {
            this.oneTimePreKeyLowWaterMark = oneTimePreKeyLowWaterMark;
            return this;
        }

        public Builder oneTimePreKeyBatchSize(int oneTimePreKeyBatchSize) {
            this.oneTimePreKeyBatchSize = oneTimePreKeyBatchSize;
            return this;
        }

        public Builder cipher(String cipher) {
            this.cipher = cipher;
            return this;
        }

        public Builder argon2MemoryKiB(int argon2MemoryKiB) {
            this.argon2MemoryKiB = argon2MemoryKiB;
            return this;
        }

        public Builder argon2Iterations(int argon2Iterations) {
            this.argon2Iterations = argon2Iterations;
            return this;
        }

        public Builder argon2Parallelism(int argon2Parallelism) {
            this.argon2Parallelism = argon2Parallelism;
            return this;
        }

        public ProtocolConfig build() {
            return new ProtocolConfig(this);
        }
    }
}
