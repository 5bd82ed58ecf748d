package com.ourolang.compiler.compiler;

import java.util.concurrent.CancellationException;

/**
 * 协作式取消标记，编译器在阶段之间检查
 */
public final class CancellationToken {

    /** 永不取消 */
    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * 已取消时抛出 {@link CancellationException}
     */
    public void throwIfCancelled(String stage) {
        if (cancelled) {
            throw new CancellationException("Compilation cancelled before " + stage);
        }
    }
}
