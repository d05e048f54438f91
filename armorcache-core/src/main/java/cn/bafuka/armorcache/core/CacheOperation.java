package cn.bafuka.armorcache.core;

/**
 * 缓存操作名
 * 用于指标统计和错误标注，名称稳定不变
 */
public enum CacheOperation {

    GET("get"),
    SET("set"),
    DELETE("delete"),
    EXISTS("exists"),
    CLEAR("clear"),
    LEN("len"),
    GET_OR_SET("get_or_set"),
    GET_OR_SET_LOCKED("get_or_set_locked"),
    GET_MANY_PIPELINE("get_many_pipeline"),
    SET_MANY_PIPELINE("set_many_pipeline"),
    DELETE_BY_PREFIX("delete_by_prefix"),
    PING("ping"),
    LOCK("lock"),
    UNLOCK("unlock"),
    POPULATE("populate"),
    INIT("init");

    private final String opName;

    CacheOperation(String opName) {
        this.opName = opName;
    }

    public String getOpName() {
        return opName;
    }

    @Override
    public String toString() {
        return opName;
    }
}
