package cn.bafuka.armorcache.serializer;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 字符串序列化器
 */
public class StringSerializer implements ValueSerializer<String> {

    @Override
    public byte[] encode(String value) {
        return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String decode(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }
}
