package me.bechberger.cdecl.config;

/**
 * How function arguments are laid out
 */
public enum Layout {
    /** All arguments on one line */
    HORIZONTAL,
    /** One argument per line, aligned after the opening parenthesis */
    VERTICAL,
    /** Horizontal if the declaration fits into the line length, vertical otherwise */
    AUTO
}
