package com.guno.salesintel.collector;

import com.guno.salesintel.catalog.SourceType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Source id to collector lookup, filled once at start-up. Adding a source means registering
 * another {@link SourceCollector}; the engine never branches on source ids.
 */
@Slf4j
public class SourceCollectorRegistry {

    private final Map<SourceType, SourceCollector> bySource;

    /**
     * When two collectors claim the same source the first one wins.
     */
    public SourceCollectorRegistry(Collection<? extends SourceCollector> collectors) {
        Map<SourceType, SourceCollector> map = new EnumMap<>(SourceType.class);
        for (SourceCollector collector : collectors) {
            SourceCollector existing = map.putIfAbsent(collector.source(), collector);
            if (existing != null) {
                log.warn("Duplicate collector for source {} - keeping {}", collector.source(),
                        existing.getClass().getSimpleName());
            }
        }
        this.bySource = Collections.unmodifiableMap(map);
        log.info("Registered source collectors: {}", bySource.keySet());
    }

    public Optional<SourceCollector> find(SourceType source) {
        return Optional.ofNullable(source != null ? bySource.get(source) : null);
    }

    public boolean isRegistered(SourceType source) {
        return source != null && bySource.containsKey(source);
    }

    public Set<SourceType> supportedSources() {
        return bySource.keySet();
    }
}
