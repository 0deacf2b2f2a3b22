package io.kassa.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KassaConfig(
    MerchantSettings merchant,
    List<InstanceConfig> instances,
    List<ExchangeConfig> exchanges,
    List<AuditorConfig> auditors
) {

    public KassaConfig {
        merchant = merchant == null ? MerchantSettings.defaults() : merchant;
        instances = instances == null ? List.of() : List.copyOf(instances);
        exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
        auditors = auditors == null ? List.of() : List.copyOf(auditors);
    }

    public static KassaConfig defaults() {
        return new KassaConfig(MerchantSettings.defaults(), List.of(), List.of(), List.of());
    }

    public KassaConfig withMerchant(MerchantSettings settings) {
        return new KassaConfig(settings, instances, exchanges, auditors);
    }

    public KassaConfig withInstances(List<InstanceConfig> newInstances) {
        return new KassaConfig(merchant, newInstances, exchanges, auditors);
    }
}
