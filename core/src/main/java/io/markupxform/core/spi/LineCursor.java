package io.markupxform.core.spi;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Cursor over the lines of a raw block. Parsers read lines with {@link #next()}, may
 * look ahead with {@link #peek()} and give the last line back with {@link #pushBack()}.
 *
 * <p>Not thread-safe; one cursor serves one parse call.
 */
public final class LineCursor {

    private final List<String> lines;
    private int position;

    public LineCursor(List<String> lines) {
        this.lines = List.copyOf(Objects.requireNonNull(lines, "lines must not be null"));
    }

    public boolean hasNext() {
        return position < lines.size();
    }

    /**
     * Returns the next line and advances.
     *
     * @throws NoSuchElementException if the cursor is exhausted
     */
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more lines (read " + position + ")");
        }
        return lines.get(position++);
    }

    /** Returns the next line without advancing, or {@code null} when exhausted. */
    public String peek() {
        return hasNext() ? lines.get(position) : null;
    }

    /**
     * Steps back one line so that the next call to {@link #next()} returns it again.
     *
     * @throws IllegalStateException if nothing has been read yet
     */
    public void pushBack() {
        if (position == 0) {
            throw new IllegalStateException("Nothing to push back");
        }
        position--;
    }
}
