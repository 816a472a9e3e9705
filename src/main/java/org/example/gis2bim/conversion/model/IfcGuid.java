package org.example.gis2bim.conversion.model;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * IFC GlobalId：128 位 UUID 压缩成 22 个字符（IFC 专用 64 进制字母表）。
 * <p>
 * 首字符只承载最高 2 位，其余 21 个字符每个 6 位。
 */
public final class IfcGuid {

    private static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz_$";
    private static final int LENGTH = 22;
    private static final BigInteger MASK_64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private IfcGuid() {
    }

    /**
     * 由名称生成确定性的 GlobalId（基于名称的 UUID，版本 3）。
     */
    public static String fromName(String name) {
        return compress(UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)));
    }

    public static String compress(UUID uuid) {
        BigInteger value = toUnsigned(uuid);
        char[] out = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            int digit = value.shiftRight(6 * (LENGTH - 1 - i)).intValue() & 0x3F;
            out[i] = ALPHABET.charAt(digit);
        }
        return new String(out);
    }

    public static UUID expand(String globalId) {
        if (globalId == null || globalId.length() != LENGTH) {
            throw new IllegalArgumentException("GlobalId 长度必须为 22：" + globalId);
        }
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < LENGTH; i++) {
            int digit = ALPHABET.indexOf(globalId.charAt(i));
            if (digit < 0 || (i == 0 && digit > 3)) {
                throw new IllegalArgumentException("GlobalId 含非法字符：" + globalId);
            }
            value = value.shiftLeft(6).or(BigInteger.valueOf(digit));
        }
        long most = value.shiftRight(64).longValue();
        long least = value.and(MASK_64).longValue();
        return new UUID(most, least);
    }

    public static boolean isValid(String globalId) {
        try {
            expand(globalId);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static BigInteger toUnsigned(UUID uuid) {
        BigInteger most = new BigInteger(Long.toUnsignedString(uuid.getMostSignificantBits()));
        BigInteger least = new BigInteger(Long.toUnsignedString(uuid.getLeastSignificantBits()));
        return most.shiftLeft(64).or(least);
    }
}
