package com.bit.staking.common;

import lombok.EqualsAndHashCode;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.Arrays;

/**
 * 公钥封装（32字节），统一质押参与者/管理员/托管账户的地址表示
 * 对外一律使用64位十六进制字符串
 */
@EqualsAndHashCode
public class Pubkey {
    public static final int LENGTH = 32;
    private final byte[] value;

    private Pubkey(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("公钥不能为空");
        }
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("公钥必须为32字节, got " + value.length);
        }
        this.value = value;
    }

    public static Pubkey fromBytes(byte[] bytes) {
        return new Pubkey(bytes == null ? null : Arrays.copyOf(bytes, bytes.length));
    }

    public static Pubkey fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("公钥十六进制长度必须为64: " + hex);
        }
        try {
            return new Pubkey(Hex.decodeHex(hex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("公钥十六进制格式错误: " + hex, e);
        }
    }

    /**
     * 以单字节填充的公钥，测试和示例配置常用
     */
    public static Pubkey filled(byte b) {
        byte[] bytes = new byte[LENGTH];
        Arrays.fill(bytes, b);
        return new Pubkey(bytes);
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    public String toHex() {
        return Hex.encodeHexString(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
