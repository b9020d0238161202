package fr.lapetina.inference.domain.model;

/**
 * Element type of a tensor.
 *
 * Tensors are always stored as floats; FLOAT16 tensors hold values that have
 * been rounded to half precision.
 */
public enum ElemKind {
    /** 32-bit IEEE float */
    FLOAT,

    /** 16-bit IEEE half, stored widened to float */
    FLOAT16;

    /**
     * Rounds a float to the nearest representable half-precision value and
     * widens it back. Values beyond the half range become infinite.
     */
    public static float roundToFloat16(float value) {
        return halfBitsToFloat(floatToHalfBits(value));
    }

    static int floatToHalfBits(float value) {
        int bits = Float.floatToIntBits(value);
        int sign = (bits >>> 16) & 0x8000;
        int magnitude = bits & 0x7fffffff;

        if (magnitude >= 0x7f800000) {
            // Infinity or NaN
            return sign | 0x7c00 | (magnitude > 0x7f800000 ? 0x200 : 0);
        }
        int rounded = magnitude + 0x1000;
        if (rounded >= 0x47800000) {
            // Overflow
            return sign | 0x7c00;
        }
        if (rounded >= 0x38800000) {
            return sign | ((rounded - 0x38000000) >>> 13);
        }
        if (rounded < 0x33000000) {
            // Too small even for a subnormal
            return sign;
        }
        int exponent = magnitude >>> 23;
        int mantissa = (magnitude & 0x7fffff) | 0x800000;
        return sign | ((mantissa + (0x800000 >>> (exponent - 102))) >>> (126 - exponent));
    }

    static float halfBitsToFloat(int halfBits) {
        int sign = (halfBits & 0x8000) << 16;
        int exponent = halfBits & 0x7c00;
        int mantissa = halfBits & 0x03ff;

        if (exponent == 0x7c00) {
            exponent = 0x3fc00;
        } else if (exponent != 0) {
            exponent += 0x1c000;
        } else if (mantissa != 0) {
            // Subnormal half, normalize
            exponent = 0x1c400;
            do {
                mantissa <<= 1;
                exponent -= 0x400;
            } while ((mantissa & 0x400) == 0);
            mantissa &= 0x3ff;
        }
        return Float.intBitsToFloat(sign | ((exponent | mantissa) << 13));
    }
}
