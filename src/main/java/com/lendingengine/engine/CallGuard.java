package com.lendingengine.engine;

import com.lendingengine.common.exception.ReentrantCallException;
import org.springframework.stereotype.Component;

/**
 * Reentrancy guard for engine operations.
 *
 * Each operation enters the guard and receives a {@link Token}. While a token is
 * active on the current thread, entering again fails with {@link ReentrantCallException},
 * except inside a callback window opened by the active operation through
 * {@link #runCallback(Runnable)}. Token transfers run outside the window, so receive
 * hooks cannot re-enter.
 */
@Component
public class CallGuard {

    private final ThreadLocal<Frame> current = new ThreadLocal<>();

    public Token enter(String operation) {
        Frame active = current.get();
        if (active != null && !active.callbackOpen) {
            throw new ReentrantCallException(operation, active.operation);
        }
        Frame frame = new Frame(operation, active);
        current.set(frame);
        return new Token(frame);
    }

    /**
     * Run a caller-supplied callback with nested calls permitted.
     */
    public void runCallback(Runnable callback) {
        Frame active = current.get();
        if (active == null) {
            throw new IllegalStateException("Callback outside of a guarded operation");
        }
        active.callbackOpen = true;
        try {
            callback.run();
        } finally {
            active.callbackOpen = false;
        }
    }

    public boolean isActive() {
        return current.get() != null;
    }

    private void exit(Frame frame) {
        if (current.get() != frame) {
            throw new IllegalStateException("Guard exited out of order: " + frame.operation);
        }
        if (frame.parent == null) {
            current.remove();
        } else {
            current.set(frame.parent);
        }
    }

    private static final class Frame {
        final String operation;
        final Frame parent;
        boolean callbackOpen;

        Frame(String operation, Frame parent) {
            this.operation = operation;
            this.parent = parent;
        }
    }

    public final class Token implements AutoCloseable {
        private final Frame frame;

        private Token(Frame frame) {
            this.frame = frame;
        }

        @Override
        public void close() {
            exit(frame);
        }
    }
}
