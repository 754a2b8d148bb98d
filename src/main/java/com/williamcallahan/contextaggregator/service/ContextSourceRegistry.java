package com.williamcallahan.contextaggregator.service;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.service.source.ContextSource;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapters keyed by source type. At most one adapter per type.
 *
 * <p>Registration initializes the adapter with its settings from the given snapshot; removal
 * disposes it.</p>
 */
public class ContextSourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ContextSourceRegistry.class);

    private final Map<ContextSourceType, ContextSource> adapters = new EnumMap<>(ContextSourceType.class);

    /**
     * Registers an adapter, replacing and disposing any adapter already registered for its type.
     *
     * @param adapter adapter to register
     * @param config snapshot supplying the adapter's settings
     */
    public synchronized void register(ContextSource adapter, AggregatorConfig config) {
        Objects.requireNonNull(adapter, "adapter");
        adapter.initialize(config.sourceSettings(adapter.type()));
        ContextSource previous = adapters.put(adapter.type(), adapter);
        if (previous != null && previous != adapter) {
            previous.dispose();
            log.info("Replaced {} source adapter", adapter.type());
        }
    }

    /**
     * Removes and disposes the adapter for a type.
     *
     * @param sourceType type to remove
     * @return true when an adapter was registered
     */
    public synchronized boolean remove(ContextSourceType sourceType) {
        ContextSource removed = adapters.remove(sourceType);
        if (removed == null) {
            return false;
        }
        removed.dispose();
        return true;
    }

    public synchronized Optional<ContextSource> find(ContextSourceType sourceType) {
        return Optional.ofNullable(adapters.get(sourceType));
    }

    public synchronized Set<ContextSourceType> registeredSources() {
        return adapters.isEmpty() ? EnumSet.noneOf(ContextSourceType.class) : EnumSet.copyOf(adapters.keySet());
    }

    /**
     * Re-applies settings from a new snapshot to every registered adapter.
     *
     * @param config new snapshot
     */
    public synchronized void reinitialize(AggregatorConfig config) {
        adapters.forEach((sourceType, adapter) -> adapter.initialize(config.sourceSettings(sourceType)));
    }

    /**
     * Disposes and removes every adapter.
     */
    public synchronized void disposeAll() {
        List<ContextSource> registered = new ArrayList<>(adapters.values());
        adapters.clear();
        for (ContextSource adapter : registered) {
            try {
                adapter.dispose();
            } catch (RuntimeException disposeFailure) {
                log.warn("Failed to dispose {} source (exceptionType={})",
                        adapter.type(), disposeFailure.getClass().getSimpleName());
            }
        }
    }
}
