package org.l5xexport.l5x;

/**
 * L5X 加载阶段的致命错误基类。
 * <p>
 * 这些错误都发生在任何抽取开始之前，调用方（命令行）应直接终止本次导出。
 */
public abstract class L5xException extends RuntimeException {

    protected L5xException(String message) {
        super(message);
    }

    protected L5xException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory category();
}
