package io.kassa.core.instance;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InstanceRegistry {
    private final Map<String, MerchantInstance> instances;

    public InstanceRegistry(List<MerchantInstance> instances) {
        this.instances = new LinkedHashMap<>();
        for (MerchantInstance instance : instances) {
            if (this.instances.putIfAbsent(instance.id(), instance) != null) {
                throw new IllegalArgumentException("duplicate instance id: " + instance.id());
            }
        }
    }

    public Optional<MerchantInstance> lookup(String id) {
        return Optional.ofNullable(instances.get(id == null || id.isBlank() ? MerchantInstance.DEFAULT_ID : id));
    }

    public Collection<MerchantInstance> all() {
        return instances.values();
    }
}
