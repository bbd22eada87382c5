package com.drover.core.inference;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference-counted model residency.
 * <p>
 * Always-loaded keys are pinned. Managed keys are loaded on first use and unloaded once they
 * have had no users for the configured idle period. Other keys are left to the backend.
 */
@Service
public class ModelLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(ModelLifecycleManager.class);

    private final InferenceRouter router;
    private final Set<String> alwaysLoaded;
    private final Set<String> managed;
    private final Duration unloadAfter;
    private final ScheduledExecutorService unloader;

    private final Map<String, Integer> refCounts = new HashMap<>();
    private final Map<String, ScheduledFuture<?>> pendingUnloads = new HashMap<>();
    private final Map<String, CompletableFuture<Boolean>> loads = new HashMap<>();
    private final ReentrantLock loadLock = new ReentrantLock();

    @Autowired
    public ModelLifecycleManager(InferenceRouter router, InferenceProperties properties) {
        this(router, properties.getLifecycle(), Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "model-unloader");
            t.setDaemon(true);
            return t;
        }));
    }

    ModelLifecycleManager(InferenceRouter router, InferenceProperties.Lifecycle lifecycle,
                          ScheduledExecutorService unloader) {
        this.router = router;
        this.alwaysLoaded = Set.copyOf(lifecycle.getAlwaysLoaded());
        this.managed = Set.copyOf(lifecycle.getManaged());
        this.unloadAfter = lifecycle.getUnloadAfter();
        this.unloader = unloader;
    }

    /**
     * Loads every always-loaded key. Failures are logged and skipped.
     *
     * @return keys that could not be loaded
     */
    public List<String> warmUp() {
        var failed = new ArrayList<String>();
        for (String key : alwaysLoaded) {
            if (!loadSerially(key)) {
                log.warn("Always-loaded model {} could not be loaded", key);
                failed.add(key);
            }
        }
        return failed;
    }

    /**
     * Registers one user of the model and makes sure it is resident. A managed model is loaded
     * once per residency: users arriving while that load is in flight wait for it and share its
     * outcome, and a failed load is retried by the next user.
     *
     * @return true if the model is loaded or left to the backend to manage
     */
    public boolean ensureLoaded(String modelKey) {
        if (!managed.contains(modelKey)) {
            synchronized (this) {
                refCounts.merge(modelKey, 1, Integer::sum);
            }
            return true;
        }
        CompletableFuture<Boolean> load;
        boolean firstUser;
        synchronized (this) {
            refCounts.merge(modelKey, 1, Integer::sum);
            ScheduledFuture<?> pending = pendingUnloads.remove(modelKey);
            if (pending != null) {
                pending.cancel(false);
                log.debug("Cancelled pending unload of {}", modelKey);
            }
            firstUser = !loads.containsKey(modelKey);
            if (firstUser) {
                load = new CompletableFuture<>();
                loads.put(modelKey, load);
            } else {
                load = loads.get(modelKey);
            }
        }
        if (!firstUser) {
            return load.join();
        }
        boolean loaded = false;
        try {
            loaded = loadSerially(modelKey);
        } finally {
            load.complete(loaded);
            if (!loaded) {
                synchronized (this) {
                    loads.remove(modelKey, load);
                }
            }
        }
        return loaded;
    }

    /**
     * Drops one user. A managed key with no users left is scheduled for unload.
     */
    public void release(String modelKey) {
        synchronized (this) {
            Integer count = refCounts.get(modelKey);
            if (count == null) {
                return;
            }
            if (count > 1) {
                refCounts.put(modelKey, count - 1);
                return;
            }
            refCounts.remove(modelKey);
            if (managed.contains(modelKey) && !alwaysLoaded.contains(modelKey)) {
                pendingUnloads.put(modelKey, unloader.schedule(() -> unloadIfIdle(modelKey),
                        unloadAfter.toMillis(), TimeUnit.MILLISECONDS));
                log.debug("Scheduled unload of {} in {}s", modelKey, unloadAfter.toSeconds());
            }
        }
    }

    public synchronized int users(String modelKey) {
        return refCounts.getOrDefault(modelKey, 0);
    }

    private void unloadIfIdle(String modelKey) {
        synchronized (this) {
            pendingUnloads.remove(modelKey);
            if (refCounts.containsKey(modelKey)) {
                return;
            }
            loads.remove(modelKey);
        }
        log.info("Unloading idle model {}", modelKey);
        router.unloadModel(modelKey);
    }

    private boolean loadSerially(String modelKey) {
        loadLock.lock();
        try {
            int ttl = (int) unloadAfter.toSeconds();
            return router.loadModel(modelKey, managed.contains(modelKey) ? ttl : null);
        } finally {
            loadLock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        unloader.shutdownNow();
    }
}
