package org.proofloop.anchor;

import java.util.List;
import java.util.Set;

/**
 * 词表中的一条锚点模式：表达式类型 + 标识符 + 可选的接收者 + 上下文角色
 * <p>
 * 由 Gson 从词表 JSON 反序列化，加载后只读。
 */
public class AnchorPattern {

    static final Set<String> SUPPORTED_KINDS =
            Set.of("MethodCallExpr", "FieldAccessExpr", "NameExpr", "ObjectCreationExpr");

    private String id;
    private String category;
    private String kind;
    private List<String> names;
    private List<String> scopes;     // 为空表示不限；"*" 表示必须有接收者
    private ContextRole role;

    AnchorPattern() {
    }

    public AnchorPattern(String id, String category, String kind, List<String> names,
                         List<String> scopes, ContextRole role) {
        this.id = id;
        this.category = category;
        this.kind = kind;
        this.names = List.copyOf(names);
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
        this.role = role;
    }

    public String getId() {
        return id;
    }

    public String getCategory() {
        return category;
    }

    public String getKind() {
        return kind;
    }

    public List<String> getNames() {
        return names == null ? List.of() : names;
    }

    public List<String> getScopes() {
        return scopes == null ? List.of() : scopes;
    }

    public ContextRole getRole() {
        return role == null ? ContextRole.ANY : role;
    }

    /**
     * @param scope 接收者源码，没有接收者时为 null
     */
    boolean matches(String nodeKind, String identifier, String scope, boolean discarded, boolean condition) {
        if (!kind.equals(nodeKind) || !getNames().contains(identifier)) {
            return false;
        }
        List<String> s = getScopes();
        if (!s.isEmpty()) {
            if (scope == null) return false;
            if (!s.contains("*") && !s.contains(scope)) return false;
        }
        switch (getRole()) {
            case DISCARDED_RESULT:
                return discarded;
            case CONDITION:
                return condition;
            default:
                return true;
        }
    }

    /**
     * 反序列化后检查字段完整性
     */
    String problem() {
        if (id == null || id.isBlank()) return "pattern without id";
        if (category == null || category.isBlank()) return id + ": missing category";
        if (kind == null || !SUPPORTED_KINDS.contains(kind)) return id + ": unsupported kind " + kind;
        if (getNames().isEmpty()) return id + ": no names";
        return null;
    }

    @Override
    public String toString() {
        return id + "[" + category + "]";
    }
}
