package org.csu.vhdlfmt.formatter;

/**
 * 缩进作用域，配合 try-with-resources 使用，关闭时恢复原来的缩进级别
 *
 * <pre>
 * try (IndentScope ignored = sink.indent()) {
 *     ...
 * }
 * </pre>
 */
public final class IndentScope implements AutoCloseable {

    private final Runnable release;
    private boolean closed = false;

    IndentScope(Runnable release) {
        this.release = release;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            release.run();
        }
    }
}
