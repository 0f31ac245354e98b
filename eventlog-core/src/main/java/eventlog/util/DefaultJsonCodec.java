package eventlog.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat {@code {"key":"value"}} metadata objects.
 *
 * <p>Nested objects, arrays, numbers and booleans are rejected. {@code null} values are
 * dropped on parse since metadata maps never hold nulls.
 */
public final class DefaultJsonCodec implements JsonCodec {
    static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

    DefaultJsonCodec() {
    }

    @Override
    public String toJson(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder(metadata.size() * 16);
        sb.append('{');
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("metadata cannot contain null keys");
            }
            if (sb.length() > 1) {
                sb.append(',');
            }
            appendString(sb, entry.getKey());
            sb.append(':');
            if (entry.getValue() == null) {
                sb.append("null");
            } else {
                appendString(sb, entry.getValue());
            }
        }
        return sb.append('}').toString();
    }

    @Override
    public Map<String, String> parseObject(String json) {
        if (json == null || json.isBlank() || "null".equals(json.trim())) {
            return Collections.emptyMap();
        }
        return new Reader(json).readObject();
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    /** Single-pass cursor over the input. */
    private static final class Reader {
        private final String in;
        private int pos;

        Reader(String in) {
            this.in = in;
        }

        Map<String, String> readObject() {
            expect('{');
            Map<String, String> result = new LinkedHashMap<>();
            if (peek() == '}') {
                pos++;
                return finish(result);
            }
            while (true) {
                expect('"');
                String key = readString();
                expect(':');
                if (in.startsWith("null", skipWhitespace())) {
                    pos += 4;
                } else {
                    expect('"');
                    result.put(key, readString());
                }
                char next = peek();
                pos++;
                if (next == '}') {
                    return finish(result);
                }
                if (next != ',') {
                    throw new IllegalArgumentException("Expected ',' or '}' at offset " + (pos - 1));
                }
            }
        }

        private Map<String, String> finish(Map<String, String> result) {
            if (skipWhitespace() != in.length()) {
                throw new IllegalArgumentException("Trailing characters after JSON object");
            }
            return result;
        }

        private String readString() {
            StringBuilder sb = new StringBuilder();
            while (pos < in.length()) {
                char c = in.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= in.length()) {
                    throw new IllegalArgumentException("Invalid escape sequence");
                }
                char escaped = in.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> sb.append(escaped);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> sb.append(readUnicode());
                    default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
                }
            }
            throw new IllegalArgumentException("Unterminated string");
        }

        private char readUnicode() {
            if (pos + 4 > in.length()) {
                throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
                char c = (char) Integer.parseInt(in.substring(pos, pos + 4), 16);
                pos += 4;
                return c;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid unicode escape", e);
            }
        }

        private void expect(char c) {
            if (peek() != c) {
                throw new IllegalArgumentException("Expected '" + c + "' at offset " + pos);
            }
            pos++;
        }

        private char peek() {
            skipWhitespace();
            if (pos >= in.length()) {
                throw new IllegalArgumentException("Unexpected end of JSON object");
            }
            return in.charAt(pos);
        }

        private int skipWhitespace() {
            while (pos < in.length() && Character.isWhitespace(in.charAt(pos))) {
                pos++;
            }
            return pos;
        }
    }
}
