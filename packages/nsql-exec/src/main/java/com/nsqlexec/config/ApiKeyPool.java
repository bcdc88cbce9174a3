package com.nsqlexec.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The LLM API keys of a run. The pool is read-only and shared by all workers; each worker
 * always uses the same key, chosen by its id.
 */
public final class ApiKeyPool {

    private static final ApiKeyPool EMPTY = new ApiKeyPool(Collections.emptyList());

    private final List<String> keys;

    private ApiKeyPool(List<String> keys) {
        this.keys = keys;
    }

    public static ApiKeyPool empty() {
        return EMPTY;
    }

    /**
     * Pool of the non-blank keys, trimmed, duplicates dropped, in their original order.
     */
    public static ApiKeyPool of(Collection<String> keys) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String key : keys) {
            if (key != null && !key.trim().isEmpty()) {
                distinct.add(key.trim());
            }
        }
        return distinct.isEmpty() ? EMPTY : new ApiKeyPool(Collections.unmodifiableList(new ArrayList<>(distinct)));
    }

    /**
     * Reads one key per line. Blank lines and lines starting with {@code #} are skipped.
     */
    public static ApiKeyPool load(Path file) throws IOException {
        List<String> keys = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.trim().startsWith("#")) {
                keys.add(line);
            }
        }
        return of(keys);
    }

    /** Union of this pool and {@code other}, keys of this pool first. */
    public ApiKeyPool plus(ApiKeyPool other) {
        List<String> merged = new ArrayList<>(keys);
        merged.addAll(other.keys);
        return of(merged);
    }

    /**
     * The key of worker {@code workerId}, or null when the pool is empty.
     */
    public String keyFor(int workerId) {
        if (keys.isEmpty()) {
            return null;
        }
        return keys.get(Math.floorMod(workerId, keys.size()));
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public int size() {
        return keys.size();
    }

    @Override
    public String toString() {
        // never print the keys themselves
        return "ApiKeyPool{" + keys.size() + " keys}";
    }
}
