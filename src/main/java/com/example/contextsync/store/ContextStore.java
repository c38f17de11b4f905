package com.example.contextsync.store;

import com.example.contextsync.error.ValidationException;
import com.example.contextsync.model.ContextEntry;
import com.example.contextsync.model.ContextSnapshot;
import com.example.contextsync.model.QueryFilter;
import com.example.contextsync.tokens.TokenAccountant;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Authoritative, token-budgeted map of context entries.
 *
 * <p>Mutations are serialized by a single writer lock; readers share the read
 * lock and always observe a committed state. After every mutation the entry
 * set is pruned so that its token total fits the budget, keeping higher
 * priority entries first and, within a priority, the most recent ones. The
 * first entry in that order is always kept, even when it alone exceeds the
 * budget, so a write is never refused for size.</p>
 */
public class ContextStore {

    private static final Logger logger = LoggerFactory.getLogger(ContextStore.class);

    static final Comparator<ContextEntry> RETENTION_ORDER = Comparator
            .<ContextEntry>comparingInt(ContextEntry::getPriority).reversed()
            .thenComparing(ContextEntry::getTimestamp, Comparator.reverseOrder())
            .thenComparing(ContextEntry::getSequence, Comparator.reverseOrder());

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ContextEntry> entries = new LinkedHashMap<>();
    private final long maxTokens;
    private final TokenAccountant tokenAccountant;
    private final Clock clock;
    private final List<ContextMutationListener> listeners;

    private long totalTokens;
    private long version;
    private long sequence;

    public ContextStore(long maxTokens, TokenAccountant tokenAccountant, Clock clock,
                        List<ContextMutationListener> listeners) {
        if (maxTokens < 0) {
            throw new IllegalArgumentException("maxTokens must be >= 0, was " + maxTokens);
        }
        this.maxTokens = maxTokens;
        this.tokenAccountant = tokenAccountant;
        this.clock = clock;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Writes or replaces the entry for {@code key}, then prunes to the budget.
     *
     * @throws ValidationException if the key is blank or the payload cannot be serialized
     */
    public MutationResult update(String key, Object payload, String source, Integer priority) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("Context key is required");
        }
        JsonNode node = tokenAccountant.toPayload(payload);
        long tokens = tokenAccountant.estimate(node);
        int clamped = ContextEntry.clampPriority(priority);

        MutationResult result;
        lock.writeLock().lock();
        try {
            ContextEntry entry = ContextEntry.builder()
                    .key(key)
                    .payload(node)
                    .tokenCount(tokens)
                    .source(source == null ? "" : source)
                    .priority(clamped)
                    .timestamp(clock.instant())
                    .sequence(++sequence)
                    .build();

            ContextEntry previous = entries.remove(key);
            if (previous != null) {
                totalTokens -= previous.getTokenCount();
            }
            entries.put(key, entry);
            totalTokens += tokens;

            List<String> evicted = evictLocked();
            result = commitLocked(key, evicted);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Stored key {} ({} tokens, priority {}), total {}/{}",
                key, tokens, clamped, result.getTotalTokens(), maxTokens);
        notifyListeners(result.getSnapshot());
        return result;
    }

    /**
     * Changes the priority of an existing entry in place; its timestamp is kept.
     *
     * @throws ValidationException if no entry exists for {@code key}
     */
    public MutationResult setPriority(String key, Integer priority) {
        int clamped = ContextEntry.clampPriority(priority);
        MutationResult result;
        lock.writeLock().lock();
        try {
            ContextEntry existing = entries.get(key);
            if (existing == null) {
                throw new ValidationException("Unknown context key: " + key);
            }
            entries.put(key, existing.toBuilder().priority(clamped).build());
            List<String> evicted = evictLocked();
            result = commitLocked(key, evicted);
        } finally {
            lock.writeLock().unlock();
        }
        notifyListeners(result.getSnapshot());
        return result;
    }

    /**
     * Removes the given keys, or every entry when {@code keys} is null.
     * Unknown keys are ignored.
     */
    public MutationResult clear(Collection<String> keys) {
        return clear(keys, entry -> { });
    }

    /**
     * Like {@link #clear(Collection)}, but first passes every entry that would
     * be removed to {@code removalCheck} under the writer lock. An exception
     * thrown by the check aborts the clear before anything is removed.
     */
    public MutationResult clear(Collection<String> keys, Consumer<ContextEntry> removalCheck) {
        MutationResult result;
        lock.writeLock().lock();
        try {
            if (keys == null) {
                entries.values().forEach(removalCheck);
            } else {
                for (String key : keys) {
                    ContextEntry entry = entries.get(key);
                    if (entry != null) {
                        removalCheck.accept(entry);
                    }
                }
            }
            List<String> removed = new ArrayList<>();
            if (keys == null) {
                removed.addAll(entries.keySet());
                entries.clear();
                totalTokens = 0L;
            } else {
                for (String key : keys) {
                    ContextEntry gone = entries.remove(key);
                    if (gone != null) {
                        totalTokens -= gone.getTokenCount();
                        removed.add(key);
                    }
                }
            }
            result = commitLocked(null, removed);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Cleared {} context entries", result.getRemovedKeys().size());
        notifyListeners(result.getSnapshot());
        return result;
    }

    /**
     * Removes every entry written by {@code source}.
     */
    public MutationResult clearSource(String source) {
        MutationResult result;
        lock.writeLock().lock();
        try {
            List<String> removed = new ArrayList<>();
            entries.values().removeIf(entry -> {
                if (entry.getSource().equals(source)) {
                    removed.add(entry.getKey());
                    totalTokens -= entry.getTokenCount();
                    return true;
                }
                return false;
            });
            result = commitLocked(null, removed);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Cleared {} context entries of source {}", result.getRemovedKeys().size(), source);
        notifyListeners(result.getSnapshot());
        return result;
    }

    public ContextSnapshot get() {
        lock.readLock().lock();
        try {
            return snapshotLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, ContextEntry> query(QueryFilter filter) {
        QueryFilter effective = filter == null ? QueryFilter.ALL : filter;
        lock.readLock().lock();
        try {
            Map<String, ContextEntry> matches = new LinkedHashMap<>();
            for (ContextEntry entry : entries.values()) {
                if (effective.matches(entry)) {
                    matches.put(entry.getKey(), entry);
                }
            }
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getMaxTokens() {
        return maxTokens;
    }

    private List<String> evictLocked() {
        if (totalTokens <= maxTokens) {
            return List.of();
        }
        List<ContextEntry> ordered = new ArrayList<>(entries.values());
        ordered.sort(RETENTION_ORDER);

        Set<String> kept = new HashSet<>();
        long keptTokens = 0L;
        for (ContextEntry entry : ordered) {
            if (!kept.isEmpty() && keptTokens + entry.getTokenCount() > maxTokens) {
                break;
            }
            kept.add(entry.getKey());
            keptTokens += entry.getTokenCount();
        }

        List<String> evicted = new ArrayList<>();
        entries.values().removeIf(entry -> {
            if (kept.contains(entry.getKey())) {
                return false;
            }
            evicted.add(entry.getKey());
            return true;
        });
        totalTokens = keptTokens;

        if (keptTokens > maxTokens) {
            logger.warn("Single entry {} exceeds the token budget ({} > {}), kept alone",
                    ordered.get(0).getKey(), keptTokens, maxTokens);
        }
        logger.info("Evicted {} context entries, {} tokens remain of {}", evicted.size(), keptTokens, maxTokens);
        return evicted;
    }

    private MutationResult commitLocked(String key, List<String> removed) {
        version++;
        ContextSnapshot snapshot = snapshotLocked();
        return MutationResult.builder()
                .key(key)
                .accepted(true)
                .totalTokens(snapshot.getTotalTokens())
                .entryCount(snapshot.getEntryCount())
                .removedKeys(List.copyOf(removed))
                .snapshot(snapshot)
                .build();
    }

    private ContextSnapshot snapshotLocked() {
        return new ContextSnapshot(entries, totalTokens, maxTokens, version, clock.instant());
    }

    private void notifyListeners(ContextSnapshot snapshot) {
        for (ContextMutationListener listener : listeners) {
            try {
                listener.onMutation(snapshot);
            } catch (RuntimeException e) {
                logger.error("Mutation listener {} failed for version {}",
                        listener.getClass().getSimpleName(), snapshot.getVersion(), e);
            }
        }
    }
}
