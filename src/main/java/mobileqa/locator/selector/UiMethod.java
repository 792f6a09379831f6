package mobileqa.locator.selector;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The recognized vocabulary of the selector grammar.
 *
 * <p>Each method carries everything the converters need: the argument type the
 * parser enforces, the key used in attribute-map locators, and the node
 * attribute plus match kind used when the call is written as an XPath
 * predicate. Positional and hierarchical methods have no node attribute.
 */
public enum UiMethod {

    // ── text ──────────────────────────────────────────────────────────────
    TEXT("text", ArgumentType.STRING, "text", "text", MatchKind.EQUALS),
    TEXT_CONTAINS("textContains", ArgumentType.STRING, "textContains", "text", MatchKind.CONTAINS),
    TEXT_STARTS_WITH("textStartsWith", ArgumentType.STRING, "textStartsWith", "text", MatchKind.STARTS_WITH),
    TEXT_MATCHES("textMatches", ArgumentType.STRING, "textMatches", "text", MatchKind.MATCHES),

    // ── content description ───────────────────────────────────────────────
    DESCRIPTION("description", ArgumentType.STRING, "content-desc", "content-desc", MatchKind.EQUALS),
    DESCRIPTION_CONTAINS("descriptionContains", ArgumentType.STRING, "content-descContains", "content-desc", MatchKind.CONTAINS),
    DESCRIPTION_STARTS_WITH("descriptionStartsWith", ArgumentType.STRING, "content-descStartsWith", "content-desc", MatchKind.STARTS_WITH),
    DESCRIPTION_MATCHES("descriptionMatches", ArgumentType.STRING, "content-descMatches", "content-desc", MatchKind.MATCHES),

    // ── resource id / package / class ─────────────────────────────────────
    RESOURCE_ID("resourceId", ArgumentType.STRING, "resource-id", "resource-id", MatchKind.EQUALS),
    RESOURCE_ID_MATCHES("resourceIdMatches", ArgumentType.STRING, "resource-idMatches", "resource-id", MatchKind.MATCHES),
    PACKAGE_NAME("packageName", ArgumentType.STRING, "package", "package", MatchKind.EQUALS),
    PACKAGE_NAME_MATCHES("packageNameMatches", ArgumentType.STRING, "packageMatches", "package", MatchKind.MATCHES),
    CLASS_NAME("className", ArgumentType.STRING, "class", "class", MatchKind.EQUALS),
    CLASS_NAME_MATCHES("classNameMatches", ArgumentType.STRING, "classMatches", "class", MatchKind.MATCHES),

    // ── boolean properties ────────────────────────────────────────────────
    CHECKABLE("checkable", ArgumentType.BOOLEAN, "checkable", "checkable", MatchKind.EQUALS),
    CHECKED("checked", ArgumentType.BOOLEAN, "checked", "checked", MatchKind.EQUALS),
    CLICKABLE("clickable", ArgumentType.BOOLEAN, "clickable", "clickable", MatchKind.EQUALS),
    ENABLED("enabled", ArgumentType.BOOLEAN, "enabled", "enabled", MatchKind.EQUALS),
    FOCUSABLE("focusable", ArgumentType.BOOLEAN, "focusable", "focusable", MatchKind.EQUALS),
    FOCUSED("focused", ArgumentType.BOOLEAN, "focused", "focused", MatchKind.EQUALS),
    LONG_CLICKABLE("longClickable", ArgumentType.BOOLEAN, "long-clickable", "long-clickable", MatchKind.EQUALS),
    SCROLLABLE("scrollable", ArgumentType.BOOLEAN, "scrollable", "scrollable", MatchKind.EQUALS),
    SELECTED("selected", ArgumentType.BOOLEAN, "selected", "selected", MatchKind.EQUALS),
    PASSWORD("password", ArgumentType.BOOLEAN, "password", "password", MatchKind.EQUALS),

    // ── positional ────────────────────────────────────────────────────────
    INDEX("index", ArgumentType.INTEGER, "index", null, MatchKind.POSITION),
    INSTANCE("instance", ArgumentType.INTEGER, "instance", null, MatchKind.INSTANCE),

    // ── hierarchy ─────────────────────────────────────────────────────────
    CHILD_SELECTOR("childSelector", ArgumentType.SELECTOR, "childSelector", null, MatchKind.CHILD),
    FROM_PARENT("fromParent", ArgumentType.SELECTOR, "fromParent", null, MatchKind.PARENT);

    /** How a call constrains the node set. */
    public enum MatchKind {
        EQUALS, CONTAINS, STARTS_WITH, MATCHES, POSITION, INSTANCE, CHILD, PARENT
    }

    private static final Map<String, UiMethod> BY_METHOD_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(UiMethod::getMethodName, Function.identity()));

    private static final Map<String, UiMethod> BY_ATTRIBUTE_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(UiMethod::getAttributeKey, Function.identity()));

    private final String methodName;
    private final ArgumentType argumentType;
    private final String attributeKey;
    private final String nodeAttribute;
    private final MatchKind matchKind;

    UiMethod(String methodName, ArgumentType argumentType, String attributeKey,
             String nodeAttribute, MatchKind matchKind) {
        this.methodName = methodName;
        this.argumentType = argumentType;
        this.attributeKey = attributeKey;
        this.nodeAttribute = nodeAttribute;
        this.matchKind = matchKind;
    }

    public String       getMethodName()    { return methodName; }
    public ArgumentType getArgumentType()  { return argumentType; }
    public String       getAttributeKey()  { return attributeKey; }
    public MatchKind    getMatchKind()     { return matchKind; }

    /** Node attribute compared by this method, or {@code null} for positional/hierarchical calls. */
    public String getNodeAttribute() { return nodeAttribute; }

    public boolean isHierarchical() {
        return matchKind == MatchKind.CHILD || matchKind == MatchKind.PARENT;
    }

    public boolean isPositional() {
        return matchKind == MatchKind.POSITION || matchKind == MatchKind.INSTANCE;
    }

    public static Optional<UiMethod> fromMethodName(String name) {
        return Optional.ofNullable(BY_METHOD_NAME.get(name));
    }

    public static Optional<UiMethod> fromAttributeKey(String key) {
        return Optional.ofNullable(BY_ATTRIBUTE_KEY.get(key));
    }

    /**
     * Finds the method that compares {@code nodeAttribute} with {@code kind},
     * e.g. ({@code "text"}, CONTAINS) → {@link #TEXT_CONTAINS}.
     */
    public static Optional<UiMethod> forPredicate(String nodeAttribute, MatchKind kind) {
        return Arrays.stream(values())
                .filter(m -> m.matchKind == kind && nodeAttribute.equals(m.nodeAttribute))
                .findFirst();
    }
}
