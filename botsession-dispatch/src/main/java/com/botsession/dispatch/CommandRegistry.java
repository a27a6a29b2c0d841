package com.botsession.dispatch;

import com.botsession.dispatch.errors.DuplicateBindingError;
import com.botsession.dispatch.errors.InvalidConfigurationError;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only table of command bindings keyed by (prefix, trigger).
 * <p>
 * Writers are serialized and publish a fresh immutable snapshot; readers never
 * lock, so registering late while messages are being dispatched is safe.
 */
@Slf4j
public final class CommandRegistry {

    private record Key(String prefix, String trigger) {
    }

    private record Snapshot(
            List<CommandBinding> bindings,
            Map<Key, List<CommandBinding>> index,
            List<String> prefixes) {

        static final Snapshot EMPTY = new Snapshot(List.of(), Map.of(), List.of());
    }

    private final Object writeLock = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * Add a binding.
     *
     * @throws DuplicateBindingError if any of its (prefix, trigger) pairs is
     *                               already bound in an overlapping scope; the
     *                               registry is left unchanged
     */
    public void register(CommandBinding binding) {
        if (binding == null) {
            throw new InvalidConfigurationError("binding must not be null");
        }
        synchronized (writeLock) {
            Snapshot current = snapshot;
            for (String prefix : binding.prefixes()) {
                for (String trigger : binding.triggerNames()) {
                    for (CommandBinding existing : current.index().getOrDefault(new Key(prefix, trigger), List.of())) {
                        if (existing.scopesOverlap(binding)) {
                            throw new DuplicateBindingError(prefix, trigger);
                        }
                    }
                }
            }

            List<CommandBinding> bindings = new ArrayList<>(current.bindings());
            bindings.add(binding);

            Map<Key, List<CommandBinding>> index = new LinkedHashMap<>(current.index());
            for (String prefix : binding.prefixes()) {
                for (String trigger : binding.triggerNames()) {
                    Key key = new Key(prefix, trigger);
                    List<CommandBinding> entries = new ArrayList<>(index.getOrDefault(key, List.of()));
                    entries.add(binding);
                    index.put(key, List.copyOf(entries));
                }
            }

            List<String> prefixes = new ArrayList<>(current.prefixes());
            for (String prefix : binding.prefixes()) {
                if (!prefixes.contains(prefix)) {
                    prefixes.add(prefix);
                }
            }
            // stable sort: equal lengths keep registration order
            prefixes.sort(Comparator.comparingInt(String::length).reversed());

            snapshot = new Snapshot(List.copyOf(bindings), Collections.unmodifiableMap(index),
                    List.copyOf(prefixes));
        }
        log.debug("Bound command {} prefixes={} scopes={}",
                binding.triggerNames(), binding.prefixes(), binding.allowedScopes());
    }

    /**
     * All bindings in registration order. Each call returns a new snapshot that
     * later registrations do not affect.
     */
    public List<CommandBinding> allBindings() {
        return snapshot.bindings();
    }

    /**
     * Bindings sharing a (prefix, trigger) pair, in registration order.
     */
    public List<CommandBinding> lookup(String prefix, String trigger) {
        return snapshot.index().getOrDefault(new Key(prefix, trigger), List.of());
    }

    /**
     * Every registered prefix, longest first; prefixes of equal length keep
     * their registration order.
     */
    public List<String> prefixesLongestFirst() {
        return snapshot.prefixes();
    }

    public int size() {
        return snapshot.bindings().size();
    }
}
