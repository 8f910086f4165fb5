package me.bechberger.cdecl.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Tag keyword that C requires in front of a type name that is not typedefed
 */
public enum DeclarationType {
    STRUCT("struct"), ENUM("enum"), UNION("union");

    private final String keyword;

    DeclarationType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Returns the tag for the passed keyword or {@code null} if there is none
     */
    public static @Nullable DeclarationType fromKeyword(String keyword) {
        for (DeclarationType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
