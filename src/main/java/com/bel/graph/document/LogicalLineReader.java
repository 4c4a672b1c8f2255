package com.bel.graph.document;

import com.bel.graph.parser.ControlParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;

/**
 * Turns physical lines into logical BEL lines.
 *
 * <p>A line ending in a backslash continues on the next line. A {@code SET} line with an
 * unterminated quoted string also continues, up to the first following line that ends in a
 * quote. Any other line with a stray quote stands alone and is left for the lexer to reject.
 * Blank lines and {@code #} comments are skipped. Each logical line carries the number of
 * its first physical line.</p>
 */
public class LogicalLineReader {

    @FunctionalInterface
    private interface PhysicalLines {
        String readLine() throws IOException;
    }

    private final PhysicalLines source;
    private long physicalLineNumber;

    public LogicalLineReader(BufferedReader reader) {
        Objects.requireNonNull(reader, "reader is required");
        this.source = reader::readLine;
    }

    public LogicalLineReader(Iterable<String> lines) {
        Iterator<String> iterator = Objects.requireNonNull(lines, "lines is required").iterator();
        this.source = () -> iterator.hasNext() ? iterator.next() : null;
    }

    /**
     * Number of physical lines consumed so far.
     */
    public long getPhysicalLineNumber() {
        return physicalLineNumber;
    }

    /**
     * @return the next logical line, or {@code null} at end of input
     */
    public LogicalLine next() throws IOException {
        String raw;
        while ((raw = source.readLine()) != null) {
            physicalLineNumber++;
            String stripped = raw.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            long start = physicalLineNumber;
            StringBuilder text = new StringBuilder();
            String current = stripped;
            boolean setLine = isSetLine(stripped);
            boolean inQuote = false;
            while (true) {
                boolean continued = current.endsWith("\\") && !endsWithEscapedBackslash(current);
                if (continued) {
                    text.append(current, 0, current.length() - 1);
                } else {
                    text.append(current);
                }
                boolean openQuote = setLine
                        && (inQuote ? !current.endsWith("\"") : hasOpenQuote(text));
                if (!continued && !openQuote) {
                    break;
                }
                String following = source.readLine();
                if (following == null) {
                    break;
                }
                physicalLineNumber++;
                if (openQuote && !continued) {
                    text.append(' ');
                }
                inQuote = inQuote || openQuote;
                current = following.strip();
            }
            return new LogicalLine(start, text.toString().strip());
        }
        return null;
    }

    private static boolean isSetLine(String line) {
        return line.startsWith(ControlParser.SET)
                && line.length() > ControlParser.SET.length()
                && Character.isWhitespace(line.charAt(ControlParser.SET.length()));
    }

    private static boolean endsWithEscapedBackslash(String line) {
        int count = 0;
        for (int i = line.length() - 1; i >= 0 && line.charAt(i) == '\\'; i--) {
            count++;
        }
        return count % 2 == 0;
    }

    static boolean hasOpenQuote(CharSequence text) {
        boolean open = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && open) {
                i++;
            } else if (c == '"') {
                open = !open;
            }
        }
        return open;
    }
}
