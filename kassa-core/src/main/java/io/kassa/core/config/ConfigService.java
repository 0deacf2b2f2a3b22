package io.kassa.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kassa.core.config.model.AccountConfig;
import io.kassa.core.config.model.InstanceConfig;
import io.kassa.core.config.model.KassaConfig;
import io.kassa.core.config.model.MerchantSettings;
import io.kassa.core.crypto.MerchantKeyPair;
import io.kassa.core.instance.InstanceRegistry;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.instance.WireMethod;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    public static final String DATABASE_ENV = "KASSA_DATABASE";
    public static final String PORT_ENV = "KASSA_PORT";

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public KassaConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return KassaConfig.defaults();
        }

        ObjectNode merged = mapper.valueToTree(KassaConfig.defaults());
        JsonNode fromFile = mapper.readTree(configPath.toFile());
        if (fromFile != null && fromFile.isObject()) {
            mergeInto(merged, fromFile);
        } else if (fromFile != null && !fromFile.isMissingNode()) {
            throw new IOException("configuration " + configPath + " is not a JSON object");
        }
        return mapper.treeToValue(merged, KassaConfig.class);
    }

    /**
     * Applies {@code KASSA_DATABASE} and {@code KASSA_PORT} on top of a loaded configuration.
     */
    public KassaConfig applyEnvironment(KassaConfig config, Map<String, String> env) {
        MerchantSettings merchant = config.merchant();
        String database = env.get(DATABASE_ENV);
        if (database != null && !database.isBlank()) {
            merchant = merchant.withDatabase(database.trim());
        }
        String port = env.get(PORT_ENV);
        if (port != null && !port.isBlank()) {
            try {
                merchant = merchant.withPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PORT_ENV + " is not a port number: " + port, e);
            }
        }
        return config.withMerchant(merchant);
    }

    public void save(Path configPath, KassaConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Makes sure a configuration with a {@code default} instance exists, generating a fresh signing
     * key for it when none is configured yet.
     */
    public InitResult initialize(Path configPath, SecureRandom random) throws IOException {
        boolean created = !Files.exists(configPath);
        KassaConfig config = load(configPath);
        boolean hasDefault = config.instances().stream()
            .anyMatch(instance -> MerchantInstance.DEFAULT_ID.equals(instance.id()));
        if (!hasDefault) {
            List<InstanceConfig> instances = new ArrayList<>(config.instances());
            MerchantKeyPair keys = MerchantKeyPair.generate(random);
            instances.add(new InstanceConfig(MerchantInstance.DEFAULT_ID, keys.seedBase32(), List.of()));
            config = config.withInstances(instances);
        }
        if (created || !hasDefault) {
            save(configPath, config);
        }
        return new InitResult(configPath, config, created, !hasDefault);
    }

    /**
     * Builds the live instances. Fails when an instance has no usable key or a malformed account.
     */
    public InstanceRegistry buildInstances(KassaConfig config) {
        List<MerchantInstance> instances = new ArrayList<>();
        for (InstanceConfig instance : config.instances()) {
            if (instance.id() == null || instance.id().isBlank()) {
                throw new IllegalArgumentException("instance without id in configuration");
            }
            if (instance.privateKey() == null || instance.privateKey().isBlank()) {
                throw new IllegalArgumentException("instance " + instance.id() + " has no private key");
            }
            List<WireMethod> wireMethods = new ArrayList<>();
            for (AccountConfig account : instance.accounts()) {
                wireMethods.add(WireMethod.fromPayto(account.paytoUri(), account.salt(), account.enabled()));
            }
            instances.add(new MerchantInstance(
                instance.id(),
                MerchantKeyPair.fromBase32(instance.privateKey()),
                wireMethods
            ));
        }
        return new InstanceRegistry(instances);
    }

    public String toPrettyJson(KassaConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    /**
     * Overlays {@code overrides} onto {@code target} in place; nested objects merge key by key,
     * anything else replaces the default.
     */
    private static void mergeInto(ObjectNode target, JsonNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode current = target.get(field.getKey());
            if (current instanceof ObjectNode nested && field.getValue().isObject()) {
                mergeInto(nested, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    public record InitResult(Path configPath, KassaConfig config, boolean createdConfig, boolean generatedKey) {
    }
}
