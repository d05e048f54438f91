package cn.bafuka.armorcache.exception;

/**
 * 缓存异常
 * 所有缓存操作失败都以该异常抛出，携带错误类型、操作名以及（可用时的）缓存键
 *
 * <p>未命中同样以该异常表示（{@link ErrorKind#CACHE_MISS}），调用方可通过
 * {@link #isCacheMiss()} 区分。未命中异常不填充堆栈。</p>
 */
public class CacheException extends RuntimeException {

    /**
     * 错误类型
     */
    private final ErrorKind kind;

    /**
     * 操作名
     */
    private final String operation;

    /**
     * 缓存键（可能为 null）
     */
    private final String key;

    public CacheException(ErrorKind kind, String operation, String key) {
        this(kind, operation, key, null);
    }

    public CacheException(ErrorKind kind, String operation, String key, Throwable cause) {
        this(kind, operation, key, cause, null);
    }

    private CacheException(ErrorKind kind, String operation, String key, Throwable cause, String detail) {
        super(formatMessage(kind, operation, key, cause, detail), cause, true, kind != ErrorKind.CACHE_MISS);
        this.kind = kind;
        this.operation = operation;
        this.key = key;
    }

    public static CacheException miss(String operation, String key) {
        return new CacheException(ErrorKind.CACHE_MISS, operation, key);
    }

    public static CacheException keyEmpty(String operation) {
        return new CacheException(ErrorKind.KEY_EMPTY, operation, null);
    }

    public static CacheException invalidConfig(String detail) {
        return new CacheException(ErrorKind.INVALID_CONFIG, "init", null, null, detail);
    }

    public static CacheException unsupported(String operation) {
        return new CacheException(ErrorKind.UNSUPPORTED, operation, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getOperation() {
        return operation;
    }

    public String getKey() {
        return key;
    }

    public boolean isCacheMiss() {
        return kind == ErrorKind.CACHE_MISS;
    }

    public boolean isCancellation() {
        return kind == ErrorKind.CANCELLED || kind == ErrorKind.DEADLINE_EXCEEDED;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * 判断任意异常是否为缓存未命中
     */
    public static boolean isCacheMiss(Throwable t) {
        return t instanceof CacheException && ((CacheException) t).isCacheMiss();
    }

    /**
     * 判断任意异常是否为取消/超时
     */
    public static boolean isCancellation(Throwable t) {
        return t instanceof CacheException && ((CacheException) t).isCancellation();
    }

    /**
     * 判断任意异常是否值得重试
     */
    public static boolean isRetryable(Throwable t) {
        return t instanceof CacheException && ((CacheException) t).isRetryable();
    }

    private static String formatMessage(ErrorKind kind, String operation, String key, Throwable cause, String detail) {
        StringBuilder sb = new StringBuilder(operation == null ? "unknown" : operation);
        if (key != null && !key.isEmpty()) {
            sb.append(" [").append(key).append(']');
        }
        sb.append(": ").append(kind.getDescription());
        if (detail != null && !detail.isEmpty()) {
            sb.append(": ").append(detail);
        }
        if (cause != null && cause.getMessage() != null) {
            sb.append(": ").append(cause.getMessage());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "CacheException{" +
                "kind=" + kind +
                ", operation=" + operation +
                ", key=" + key +
                ", message=" + getMessage() +
                '}';
    }
}
