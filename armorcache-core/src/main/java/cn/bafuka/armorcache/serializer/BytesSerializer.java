package cn.bafuka.armorcache.serializer;

/**
 * 原样透传的字节序列化器
 */
public class BytesSerializer implements ValueSerializer<byte[]> {

    @Override
    public byte[] encode(byte[] value) {
        return value == null ? new byte[0] : value;
    }

    @Override
    public byte[] decode(byte[] data) {
        return data;
    }
}
