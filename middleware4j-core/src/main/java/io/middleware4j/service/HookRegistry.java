package io.middleware4j.service;

import io.middleware4j.errors.CallException;
import io.middleware4j.errors.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Named hooks such as {@code <namespace>.post_create}. Listeners run in registration order on the caller's thread;
 * the first failure stops the chain and propagates.
 */
public class HookRegistry {
    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    private final Map<String, List<HookListener>> hooks = new ConcurrentHashMap<>();

    public void register(String name, HookListener listener) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        hooks.computeIfAbsent(name, n -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("hook registered name={}", name);
    }

    public Set<String> names() {
        return Set.copyOf(hooks.keySet());
    }

    public int run(String name, Object... args) {
        return run(name, new ArrayList<>(Arrays.asList(args)));
    }

    /**
     * Run every listener of {@code name}. Returns the number of listeners run.
     */
    public int run(String name, List<Object> args) {
        List<HookListener> listeners = hooks.get(name);
        if (listeners == null || listeners.isEmpty()) {
            return 0;
        }
        for (HookListener listener : listeners) {
            try {
                listener.call(args);
            } catch (RuntimeException e) {
                log.debug("hook failed name={} msg={}", name, e.getMessage());
                throw e;
            } catch (Exception e) {
                log.debug("hook failed name={} msg={}", name, e.getMessage());
                throw new CallException("Hook " + name + " failed: " + e.getMessage(), ErrorCode.EFAULT, e);
            }
        }
        return listeners.size();
    }
}
