package com.docprinter.doc;

/**
 * Identity of a {@link Group} that {@link IfBreak} nodes can refer to.
 * Two ids are equal only if they are the same instance; the name is for debugging.
 */
public final class GroupId {
    private final String name;

    private GroupId(String name) {
        this.name = name;
    }

    public static GroupId create(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Group id name must not be empty");
        }
        return new GroupId(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "GroupId(" + name + ")";
    }
}
