package me.bechberger.cdecl.writer;

import me.bechberger.cdecl.config.Config;

/**
 * Something that can be written to a {@link SourceWriter}
 */
@FunctionalInterface
public interface Source {
    void write(SourceWriter out, Config config);
}
