package cn.bafuka.armorcache.serializer;

/**
 * 缓存值序列化器
 * 供需要落盘/走网络的后端使用
 *
 * @param <V> 缓存值类型
 */
public interface ValueSerializer<V> {

    /**
     * 编码
     *
     * @throws cn.bafuka.armorcache.exception.CacheException SERIALIZE
     */
    byte[] encode(V value);

    /**
     * 解码
     *
     * @throws cn.bafuka.armorcache.exception.CacheException DESERIALIZE
     */
    V decode(byte[] data);
}
