package pseudoc.types;

public record ArrayType(PrimitiveType element) implements Type {
    @Override
    public String toString() {
        return "TABLEAU DE " + element;
    }
}
