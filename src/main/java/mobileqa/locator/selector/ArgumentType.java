package mobileqa.locator.selector;

/** Java type accepted as the single argument of a {@link UiMethod}. */
public enum ArgumentType {
    STRING(String.class),
    BOOLEAN(Boolean.class),
    INTEGER(Integer.class),
    SELECTOR(Selector.class);

    private final Class<?> javaType;

    ArgumentType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public boolean accepts(Object value) {
        return javaType.isInstance(value);
    }

    public Class<?> getJavaType() { return javaType; }
}
