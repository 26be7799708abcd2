package de.jwiegmann.archive.control.upload;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

@Component
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    @Override
    public <R> R compute(String key, Function<Deque<Instant>, R> update) {
        Deque<Instant> window = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (window) {
            return update.apply(window);
        }
    }
}
