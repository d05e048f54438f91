package cn.bafuka.armorcache.serializer;

import cn.bafuka.armorcache.exception.CacheException;
import cn.bafuka.armorcache.exception.ErrorKind;
import com.alibaba.fastjson.JSON;

import java.lang.reflect.Type;

/**
 * 基于 fastjson 的 JSON 序列化器
 *
 * @param <V> 缓存值类型
 */
public class FastJsonSerializer<V> implements ValueSerializer<V> {

    private final Type type;

    public FastJsonSerializer(Class<V> type) {
        this.type = type;
    }

    public FastJsonSerializer(Type type) {
        this.type = type;
    }

    @Override
    public byte[] encode(V value) {
        try {
            return JSON.toJSONBytes(value);
        } catch (RuntimeException e) {
            throw new CacheException(ErrorKind.SERIALIZE, "encode", null, e);
        }
    }

    @Override
    public V decode(byte[] data) {
        try {
            return JSON.parseObject(data, type);
        } catch (RuntimeException e) {
            throw new CacheException(ErrorKind.DESERIALIZE, "decode", null, e);
        }
    }
}
