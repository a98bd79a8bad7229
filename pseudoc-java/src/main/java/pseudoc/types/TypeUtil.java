package pseudoc.types;

public final class TypeUtil {
    private TypeUtil() {}

    public static boolean isAssignable(Type dst, Type src) {
        if (dst.equals(src)) return true;
        // implicit ENTIER -> REEL
        return dst == PrimitiveType.FLOAT && src == PrimitiveType.INT;
    }

    public static Type numericResult(Type a, Type b) {
        if (!a.isNumeric() || !b.isNumeric()) return null;
        return (a == PrimitiveType.FLOAT || b == PrimitiveType.FLOAT) ? PrimitiveType.FLOAT : PrimitiveType.INT;
    }
}
