package org.gudu0.xpbot.state;

import org.gudu0.xpbot.progression.ProgressionCalculator;
import org.gudu0.xpbot.progression.UserProgress;
import org.gudu0.xpbot.util.ConsoleLog;
import org.gudu0.xpbot.util.JsonStore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Owns the engine state and its JSON snapshot.
 * <p>
 * {@link #lock} is the single mutation boundary: event handling, the periodic snapshot and the
 * periodic report all synchronize on it, and read views take it too so they never see half an update.
 */
public class StateStore {
    public final Object lock;
    private final JsonStore<BotSnapshot> store;
    private final ProgressionCalculator calc;

    private ProgressionState state = new ProgressionState();

    public StateStore(Path path, ProgressionCalculator calc) {
        this.calc = calc;
        this.store = new JsonStore<>(path, BotSnapshot.class, this::snapshot, "progress.json");
        this.lock = store.lock;
    }

    /** Replaces the in-memory state with the snapshot on disk (or a fresh state). */
    public void load() {
        ProgressionState loaded = store.load()
                .map(s -> SnapshotCodec.decode(s, calc))
                .orElseGet(ProgressionState::new);

        synchronized (lock) {
            state = loaded;
        }
        ConsoleLog.info("StateStore", "State ready: users=" + loaded.users.size()
                + " historyDays=" + loaded.dailyHistory.size()
                + " totalServerMessages=" + loaded.totalServerMessages);
    }

    public ProgressionState state() {
        requireLock();
        return state;
    }

    /** Progress entry for mutation (created on first use). */
    public UserProgress user(long userId) {
        requireLock();
        return state.getOrCreate(userId);
    }

    /** Read-only lookup; never creates an entry. */
    public UserProgress userOrDefault(long userId) {
        requireLock();
        return state.getOrDefault(userId);
    }

    /**
     * State may only be touched under {@link #lock}. Reaching here without it is a programming error:
     * fails fast with assertions on, otherwise logged.
     */
    public void requireLock() {
        if (Thread.holdsLock(lock)) return;
        assert false : "StateStore accessed without holding its lock";
        ConsoleLog.error("StateStore", "State accessed without lock on thread " + Thread.currentThread().getName());
    }

    public void markDirty() { store.markDirty(); }
    public void startAutoFlush(long periodSeconds) { store.startAutoFlush(periodSeconds); }

    /** Writes the snapshot now, whether or not anything changed. */
    public void save() throws IOException {
        store.markDirty();
        store.flushNow();
    }

    // Called by JsonStore while holding lock.
    private BotSnapshot snapshot() {
        return SnapshotCodec.encode(state);
    }
}
