package com.embedbot.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads {@link AppConfig} from YAML and applies {@code EMBEDBOT_*} environment overrides on top.
 */
public final class AppConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);

    private AppConfigLoader() {
    }

    public static AppConfig load(Path configPath, Map<String, String> environment) throws IOException {
        AppConfig config;
        if (configPath != null && Files.exists(configPath)) {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            config = mapper.readValue(configPath.toFile(), AppConfig.class);
        } else {
            log.info("config.defaults reason=missing-file path={}", configPath);
            config = new AppConfig();
        }
        applyEnvironment(config, environment);
        return config;
    }

    static void applyEnvironment(AppConfig config, Map<String, String> env) {
        AppConfig.ControlDbConfig controlDb = config.getControlDb();
        override(env, "EMBEDBOT_CONTROL_DB_URL", controlDb::setUrl);
        override(env, "EMBEDBOT_CONTROL_DB_USER", controlDb::setUser);
        override(env, "EMBEDBOT_CONTROL_DB_PASSWORD", controlDb::setPassword);

        override(env, "EMBEDBOT_UPLOADS_DIR", config.getStorage()::setUploadsDir);
        override(env, "EMBEDBOT_ENCRYPTION_KEY", config.getEncryption()::setKey);

        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        override(env, "EMBEDBOT_EMBEDDING_URL", embedding::setBaseUrl);
        override(env, "EMBEDBOT_EMBEDDING_MODEL", embedding::setModel);
        overrideInt(env, "EMBEDBOT_EMBEDDING_DIMENSIONS", embedding::setDimensions);
        overrideInt(env, "EMBEDBOT_BATCH_SIZE", embedding::setBatchSize);
        overrideInt(env, "EMBEDBOT_MAX_ATTEMPTS", embedding::setMaxAttempts);
        overrideLong(env, "EMBEDBOT_REQUEST_DELAY_MS", embedding::setRequestDelayMs);

        AppConfig.IngestionConfig ingestion = config.getIngestion();
        overrideInt(env, "EMBEDBOT_MAX_UPLOAD_MB", ingestion::setMaxUploadMb);
        override(env, "EMBEDBOT_ALLOWED_EXTENSIONS", value -> ingestion.setAllowedExtensions(Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(ext -> !ext.isEmpty())
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .toList()));

        AppConfig.FallbackConfig fallback = config.getFallback();
        override(env, "EMBEDBOT_DEFAULT_STORE_HOST", fallback::setStoreHost);
        overrideInt(env, "EMBEDBOT_DEFAULT_STORE_PORT", fallback::setStorePort);
        override(env, "EMBEDBOT_DEFAULT_STORE_DATABASE", fallback::setStoreDatabase);
        override(env, "EMBEDBOT_DEFAULT_STORE_USER", fallback::setStoreUser);
        override(env, "EMBEDBOT_DEFAULT_STORE_PASSWORD", fallback::setStorePassword);
        override(env, "EMBEDBOT_DEFAULT_PROVIDER_API_KEY", fallback::setProviderApiKey);
    }

    private static void override(Map<String, String> env, String name, Consumer<String> setter) {
        String value = env.get(name);
        if (value != null && !value.isBlank()) {
            setter.accept(value.trim());
        }
    }

    private static void overrideInt(Map<String, String> env, String name, Consumer<Integer> setter) {
        override(env, name, value -> {
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer", e);
            }
        });
    }

    private static void overrideLong(Map<String, String> env, String name, Consumer<Long> setter) {
        override(env, name, value -> {
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer", e);
            }
        });
    }
}
