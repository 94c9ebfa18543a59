package com.example.llmexplorer.session;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 调度器与各会话共享的停止信号，会话在步与步之间检查
 */
public class StopSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * @return 是否是第一次请求停止
     */
    public boolean requestStop(String why) {
        return reason.compareAndSet(null, why == null ? "stop requested" : why);
    }

    public boolean isStopRequested() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }
}
