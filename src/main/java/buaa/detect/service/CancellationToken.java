package buaa.detect.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 评测取消标记，在每张图像开始前检查
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
