package pseudoc.types;

public sealed interface Type permits PrimitiveType, ArrayType {
    default boolean isNumeric() {
        return this == PrimitiveType.INT || this == PrimitiveType.FLOAT;
    }
}
