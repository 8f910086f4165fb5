package me.bechberger.cdecl.writer;

import me.bechberger.cdecl.config.Config;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Sequential text sink that keeps track of the current line length and indentation
 * <p>
 * Indentation is written lazily with the first text of each line, so pushing or popping
 * an indentation level only affects lines that are not yet started.
 * <p>
 * Not thread safe.
 */
public class SourceWriter {

    private final StringBuilder out = new StringBuilder();
    private final int tabWidth;
    private final Deque<Integer> spaces = new ArrayDeque<>();
    private boolean lineStarted = false;
    private int lineLength = 0;
    private int lineNumber = 1;

    public SourceWriter(int tabWidth) {
        if (tabWidth < 0) {
            throw new IllegalArgumentException("Negative tab width " + tabWidth);
        }
        this.tabWidth = tabWidth;
        this.spaces.push(0);
    }

    public SourceWriter(Config config) {
        this(config.tabWidth());
    }

    /**
     * Creates an empty writer that continues with the line state of the parent
     */
    private SourceWriter(SourceWriter parent) {
        this.tabWidth = parent.tabWidth;
        this.spaces.addAll(parent.spaces);
        this.lineStarted = parent.lineStarted;
        this.lineLength = parent.lineLength;
        this.lineNumber = parent.lineNumber;
    }

    /**
     * Write the text, line breaks in the text start new (indented) lines
     */
    public SourceWriter write(String text) {
        var lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i != 0) {
                newLine();
            }
            writeInLine(lines[i]);
        }
        return this;
    }

    private void writeInLine(String text) {
        if (text.isEmpty()) {
            return;
        }
        if (!lineStarted) {
            out.append(" ".repeat(spaces()));
            lineLength = spaces();
            lineStarted = true;
        }
        out.append(text);
        lineLength += text.length();
    }

    public SourceWriter newLine() {
        out.append('\n');
        lineStarted = false;
        lineLength = 0;
        lineNumber++;
        return this;
    }

    /**
     * Column at which the next written character would end up, used to align continuation lines
     */
    public int lineLengthForAlign() {
        return lineStarted ? lineLength : spaces();
    }

    /**
     * Indent following lines by one more tab
     */
    public SourceWriter pushTab() {
        spaces.push(spaces() + tabWidth);
        return this;
    }

    /**
     * Indent following lines by exactly the given number of spaces
     */
    public SourceWriter pushSetSpaces(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative indentation " + count);
        }
        spaces.push(count);
        return this;
    }

    /**
     * Restore the indentation that was active before the last push
     *
     * @throws IllegalStateException if there is nothing pushed
     */
    public SourceWriter popTab() {
        if (spaces.size() == 1) {
            throw new IllegalStateException("Cannot pop the base indentation");
        }
        spaces.pop();
        return this;
    }

    public int spaces() {
        return spaces.peek();
    }

    public void writeHorizontalSourceList(List<? extends Source> items, ListType listType, Config config) {
        for (int i = 0; i < items.size(); i++) {
            items.get(i).write(this, config);
            if (listType instanceof ListType.Join join && i != items.size() - 1) {
                write(join.separator());
            }
        }
    }

    /**
     * Runs the writer function on a scratch writer and only keeps the result if it stays on the current
     * line and does not exceed the maximum line length
     *
     * @return true if the output has been kept
     */
    public boolean tryWrite(Consumer<SourceWriter> writerFunction, int maxLineLength) {
        if (lineLength > maxLineLength) {
            return false;
        }
        var scratch = new SourceWriter(this);
        writerFunction.accept(scratch);
        if (scratch.lineNumber != lineNumber || scratch.lineLength > maxLineLength) {
            return false;
        }
        out.append(scratch.out);
        lineStarted = scratch.lineStarted;
        lineLength = scratch.lineLength;
        return true;
    }

    public int lineLength() {
        return lineLength;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String output() {
        return out.toString();
    }

    @Override
    public String toString() {
        return output();
    }
}
