package io.fullerstack.inject.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Invalidate-and-recompute cache of namespace resolution chains.
 *
 * <p>A chain for {@code "a.b.c"} lists the registrations bound to {@code "a.b.c"},
 * {@code "a.b"} and {@code "a"}, most specific first, skipping unbound levels.
 *
 * <p><b>Generations:</b> entries live in a generation map that {@link #invalidate()}
 * swaps for an empty one. A build reads the generation before it reads the index and
 * stores into that same generation, so a build racing an invalidation can only land in
 * the discarded map. Callers must update the index before invalidating.
 */
final class NamespaceChainCache {

    private static final Logger logger = LoggerFactory.getLogger(NamespaceChainCache.class);

    private final AtomicReference<ConcurrentMap<String, List<ContainerRegistration>>> generation =
        new AtomicReference<>(new ConcurrentHashMap<>());

    /**
     * Returns the cached chain for {@code scope}, building it on a miss.
     *
     * @param scope the queried namespace
     * @param index lookup from an exact namespace scope to its registration, or null
     * @return immutable chain, most specific first; empty if no ancestor is bound
     */
    List<ContainerRegistration> chain(String scope, Function<String, ContainerRegistration> index) {
        ConcurrentMap<String, List<ContainerRegistration>> current = generation.get();
        List<ContainerRegistration> cached = current.get(scope);
        if (cached != null) {
            return cached;
        }
        List<ContainerRegistration> built = build(scope, index);
        List<ContainerRegistration> raced = current.putIfAbsent(scope, built);
        if (raced != null) {
            return raced;
        }
        logger.debug("Built chain for '{}': {}", scope, built);
        return built;
    }

    static List<ContainerRegistration> build(String scope, Function<String, ContainerRegistration> index) {
        List<ContainerRegistration> chain = new ArrayList<>(4);
        String current = scope;
        while (true) {
            ContainerRegistration registration = index.apply(current);
            if (registration != null) {
                chain.add(registration);
            }
            int lastDot = current.lastIndexOf('.');
            if (lastDot < 0) {
                break;
            }
            current = current.substring(0, lastDot);
        }
        return List.copyOf(chain);
    }

    void invalidate() {
        generation.set(new ConcurrentHashMap<>());
    }

    /**
     * @return number of chains cached in the current generation
     */
    int size() {
        return generation.get().size();
    }
}
