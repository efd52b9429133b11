package com.fraud.analytics.detector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of detector providers keyed by {@link DetectorType}.
 * Built once when the application context starts; immutable afterwards.
 */
@Component
public class DetectorFactory {

    private static final Logger log = LoggerFactory.getLogger(DetectorFactory.class);

    private final Map<DetectorType, DetectorProvider> providers;

    public DetectorFactory(List<DetectorProvider> providers) {
        Map<DetectorType, DetectorProvider> registry = new EnumMap<>(DetectorType.class);
        for (DetectorProvider provider : providers) {
            DetectorProvider previous = registry.put(provider.getSupportedType(), provider);
            if (previous != null) {
                throw new IllegalStateException(String.format("Duplicate detector provider for %s: %s and %s",
                        provider.getSupportedType(), previous.getClass().getSimpleName(),
                        provider.getClass().getSimpleName()));
            }
            log.info("Registered detector provider: {} -> {}",
                    provider.getSupportedType().getTag(), provider.getClass().getSimpleName());
        }
        this.providers = Collections.unmodifiableMap(registry);
    }

    /**
     * Build a detector from a stored type tag.
     *
     * @throws UnknownDetectorTypeException if the tag is not recognised or has no registered provider
     */
    public AnomalyDetector create(String typeTag, Map<String, String> params) {
        DetectorType type = DetectorType.fromTag(typeTag);
        if (type == null) {
            throw new UnknownDetectorTypeException(typeTag, getAvailableTypes());
        }
        return create(type, DetectorParams.of(params));
    }

    public AnomalyDetector create(DetectorType type, DetectorParams params) {
        DetectorProvider provider = type == null ? null : providers.get(type);
        if (provider == null) {
            throw new UnknownDetectorTypeException(type == null ? null : type.getTag(), getAvailableTypes());
        }
        return provider.create(params == null ? DetectorParams.empty() : params);
    }

    public boolean supports(DetectorType type) {
        return providers.containsKey(type);
    }

    /**
     * Registered type tags, in declaration order of {@link DetectorType}.
     */
    public List<String> getAvailableTypes() {
        return providers.keySet().stream()
                .map(DetectorType::getTag)
                .toList();
    }
}
