package me.golemcore.toolloop.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation handle threaded from the caller through the tool
 * loop into every LLM call and tool invocation.
 *
 * <p>
 * A token fires at most once. Derived tokens ({@link #child()},
 * {@link #withTimeout(Duration)}) fire when their parent fires, but firing a
 * derived token never affects the parent. Timeouts are expressed as derived
 * tokens rather than as a separate mechanism.
 *
 * <p>
 * A parent only references its derived tokens until they fire or are
 * {@link #release() released}, so a long-lived token can be shared by many
 * invocations.
 *
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * CompletableFuture<ToolLoopResult> run = CompletableFuture.supplyAsync(() -> toolLoop.run(invocation));
 * token.cancel("user pressed stop");
 * }</pre>
 */
public final class CancellationToken {

    private static final String DEFAULT_REASON = "cancelled";

    private static final ScheduledThreadPoolExecutor TIMER = createTimer();

    private final CompletableFuture<String> signal = new CompletableFuture<>();
    private final Set<CancellationToken> children = ConcurrentHashMap.newKeySet();
    private final CancellationToken parent;
    private volatile ScheduledFuture<?> pendingTimeout;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    /**
     * Creates a new token that fires only when {@link #cancel()} is called.
     */
    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /**
     * Creates a token that no caller holds a reference to cancel. Used when the
     * caller does not supply one.
     */
    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    /**
     * Fires the token.
     *
     * @return true if this call fired the token, false if it had already fired
     */
    public boolean cancel() {
        return cancel(DEFAULT_REASON);
    }

    /**
     * Fires the token with a human-readable reason.
     *
     * @return true if this call fired the token, false if it had already fired
     */
    public boolean cancel(String reason) {
        String effective = reason != null && !reason.isBlank() ? reason : DEFAULT_REASON;
        if (!signal.complete(effective)) {
            return false;
        }
        release();
        for (CancellationToken child : children) {
            child.cancel(effective);
        }
        children.clear();
        return true;
    }

    public boolean isCancellationRequested() {
        return signal.isDone();
    }

    /**
     * Returns the reason passed to {@link #cancel(String)}, or null while the
     * token has not fired.
     */
    public String getReason() {
        return signal.getNow(null);
    }

    /**
     * Throws {@link CancellationException} if the token has fired.
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException(getReason());
        }
    }

    /**
     * Returns a future completed with the cancellation reason once the token
     * fires. Completing the returned future does not fire the token.
     */
    public CompletableFuture<String> whenCancelled() {
        return signal.copy();
    }

    /**
     * Registers a callback run (on the cancelling thread) when the token fires.
     * Runs immediately if the token has already fired.
     */
    public void onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        signal.thenRun(callback);
    }

    /**
     * Creates a derived token that fires when this token fires, and can also be
     * fired on its own.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken(this);
        children.add(child);
        if (isCancellationRequested()) {
            child.cancel(getReason());
        }
        return child;
    }

    /**
     * Creates a derived token that additionally fires after the given timeout.
     * A null, zero or negative timeout yields a plain {@link #child()}.
     */
    public CancellationToken withTimeout(Duration timeout) {
        CancellationToken child = child();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            String reason = "timed out after " + timeout;
            child.pendingTimeout = TIMER.schedule(() -> child.cancel(reason), timeout.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (child.isCancellationRequested()) {
                child.pendingTimeout.cancel(false);
            }
        }
        return child;
    }

    /**
     * Detaches this token from its parent and drops its pending timeout. A
     * released token no longer fires because of its parent; it can still be
     * fired directly. Call once the work guarded by a derived token is over.
     */
    public void release() {
        if (parent != null) {
            parent.children.remove(this);
        }
        ScheduledFuture<?> pending = pendingTimeout;
        if (pending != null) {
            pending.cancel(false);
        }
    }

    private static ScheduledThreadPoolExecutor createTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "toolloop-cancel-timer");
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    @Override
    public String toString() {
        return isCancellationRequested() ? "CancellationToken[cancelled: " + getReason() + "]"
                : "CancellationToken[active]";
    }
}
