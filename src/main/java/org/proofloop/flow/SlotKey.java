package org.proofloop.flow;

/**
 * 变量/存储槽的符号身份。不同访问路径指向同一个槽时得到相等的 key，
 * 例如 {@code this.balance} 与 {@code balance}。
 *
 * @param owner 局部变量为 "fn:&lt;函数编号&gt;"，状态变量为声明它的合约名
 * @param path  访问路径，元素访问统一写作 {@code name[*]}
 */
public record SlotKey(SlotKind kind, String owner, String path) {

    static SlotKey local(int functionId, String name) {
        return new SlotKey(SlotKind.LOCAL, "fn:" + functionId, name);
    }

    static SlotKey state(String contract, String name) {
        return new SlotKey(SlotKind.STATE, contract, name);
    }

    static SlotKey unresolved(String name) {
        return new SlotKey(SlotKind.UNRESOLVED, "", name);
    }

    SlotKey member(String suffix) {
        SlotKind k = kind == SlotKind.UNRESOLVED ? SlotKind.UNRESOLVED : SlotKind.MEMBER;
        return new SlotKey(k, owner, path + suffix);
    }

    /**
     * mapping/数组元素：元素不可区分，写入只能弱更新，不能杀死其它定值
     */
    public boolean isElement() {
        return path.endsWith("[*]");
    }

    @Override
    public String toString() {
        return kind + ":" + (owner.isEmpty() ? "" : owner + "/") + path;
    }
}
