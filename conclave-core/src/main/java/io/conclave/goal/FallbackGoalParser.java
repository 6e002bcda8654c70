package io.conclave.goal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Line-oriented parser for goal text that the YAML parser rejects.
 *
 * <p>Supported syntax, and nothing else:
 * <ul>
 *   <li>top-level {@code key: value} scalars, optionally single- or double-quoted;</li>
 *   <li>one level of nesting: a top-level {@code key:} followed by more-indented
 *       {@code key: value} lines, all at the same indentation;</li>
 *   <li>flat lists: a top-level {@code key:} followed by {@code - item} lines;</li>
 *   <li>block scalars {@code |} (literal) and {@code >} (folded) at either level and as list
 *       items.</li>
 * </ul>
 *
 * <p>A value is split from its key at the first {@code ": "}, so {@code primary: Build: fast API}
 * yields {@code "Build: fast API"}. Deeper nesting, flow collections ({@code [..]},
 * {@code {..}}), list items outside a top-level list, mixed list and map children, duplicate
 * keys and tabs in indentation are rejected with {@link GoalParseException}.
 *
 * <p>The result holds {@code String}, {@code List<String>} and {@code Map<String, String>}
 * values in file order.
 */
public final class FallbackGoalParser {

    /**
     * Parses cleaned goal text.
     *
     * @param text goal text without comment lines
     * @return top-level keys to values
     * @throws GoalParseException if the text uses unsupported syntax
     */
    public Map<String, Object> parse(String text) throws GoalParseException {
        return new Cursor(text.split("\n", -1)).parseDocument();
    }

    private static final class Cursor {
        private final String[] lines;
        private int index;

        Cursor(String[] lines) {
            this.lines = lines;
        }

        Map<String, Object> parseDocument() throws GoalParseException {
            Map<String, Object> result = new LinkedHashMap<>();
            while (skipBlank()) {
                String line = lines[index];
                int indent = indentOf(line);
                if (indent != 0) {
                    throw error("unexpected indentation");
                }
                String content = line.strip();
                if (content.startsWith("- ") || content.equals("-")) {
                    throw error("list item outside a top-level list");
                }
                Entry entry = splitEntry(content);
                index++;
                Object value;
                if (entry.value.isEmpty()) {
                    value = parseChildren();
                } else if (isBlockIndicator(entry.value)) {
                    value = readBlock(0, entry.value.charAt(0) == '|');
                } else {
                    value = scalar(entry.value);
                }
                putUnique(result, entry.key, value);
            }
            return result;
        }

        private Object parseChildren() throws GoalParseException {
            if (!skipBlank() || indentOf(lines[index]) == 0) {
                return "";
            }
            int childIndent = indentOf(lines[index]);
            String first = lines[index].strip();
            if (first.startsWith("- ") || first.equals("-")) {
                return parseList(childIndent);
            }
            return parseMap(childIndent);
        }

        private List<String> parseList(int childIndent) throws GoalParseException {
            List<String> items = new ArrayList<>();
            while (skipBlank() && indentOf(lines[index]) > 0) {
                checkIndent(childIndent);
                String content = lines[index].strip();
                if (!content.startsWith("- ") && !content.equals("-")) {
                    throw error("mixed list and map entries");
                }
                String item = content.substring(1).strip();
                if (item.startsWith("- ") || item.equals("-")) {
                    throw error("nested lists are not supported");
                }
                if (!isQuoted(item) && (item.contains(": ") || item.endsWith(":"))) {
                    throw error("maps inside lists are not supported");
                }
                index++;
                items.add(isBlockIndicator(item) ? readBlock(childIndent, item.charAt(0) == '|') : scalar(item));
            }
            return items;
        }

        private Map<String, String> parseMap(int childIndent) throws GoalParseException {
            Map<String, String> map = new LinkedHashMap<>();
            while (skipBlank() && indentOf(lines[index]) > 0) {
                checkIndent(childIndent);
                String content = lines[index].strip();
                if (content.startsWith("- ") || content.equals("-")) {
                    throw error("mixed list and map entries");
                }
                Entry entry = splitEntry(content);
                index++;
                String value;
                if (isBlockIndicator(entry.value)) {
                    value = readBlock(childIndent, entry.value.charAt(0) == '|');
                } else if (entry.value.isEmpty()) {
                    if (skipBlank() && indentOf(lines[index]) > childIndent) {
                        throw error("nesting deeper than one level is not supported");
                    }
                    value = "";
                } else {
                    value = scalar(entry.value);
                }
                putUnique(map, entry.key, value);
            }
            return map;
        }

        private void checkIndent(int expected) throws GoalParseException {
            int indent = indentOf(lines[index]);
            if (indent > expected) {
                throw error("nesting deeper than one level is not supported");
            }
            if (indent < expected) {
                throw error("inconsistent indentation");
            }
        }

        private String readBlock(int ownerIndent, boolean literal) throws GoalParseException {
            List<String> body = new ArrayList<>();
            int blockIndent = -1;
            while (index < lines.length) {
                String line = lines[index];
                if (line.isBlank()) {
                    body.add("");
                    index++;
                    continue;
                }
                int indent = indentOf(line);
                if (indent <= ownerIndent) {
                    break;
                }
                if (blockIndent < 0) {
                    blockIndent = indent;
                } else if (indent < blockIndent) {
                    throw error("block scalar line is less indented than its first line");
                }
                body.add(line.substring(blockIndent).stripTrailing());
                index++;
            }
            while (!body.isEmpty() && body.get(body.size() - 1).isEmpty()) {
                body.remove(body.size() - 1);
            }
            if (body.isEmpty()) {
                return "";
            }
            if (literal) {
                return String.join("\n", body) + "\n";
            }
            StringBuilder folded = new StringBuilder();
            for (int i = 0; i < body.size(); i++) {
                String part = body.get(i);
                if (part.isEmpty()) {
                    folded.append('\n');
                } else {
                    if (folded.length() > 0 && folded.charAt(folded.length() - 1) != '\n') {
                        folded.append(' ');
                    }
                    folded.append(part);
                }
            }
            return folded.append('\n').toString();
        }

        /** Advances past blank lines; returns whether a content line remains. */
        private boolean skipBlank() throws GoalParseException {
            while (index < lines.length && lines[index].isBlank()) {
                index++;
            }
            if (index >= lines.length) {
                return false;
            }
            String line = lines[index];
            for (int i = 0; i < line.length() && Character.isWhitespace(line.charAt(i)); i++) {
                if (line.charAt(i) == '\t') {
                    throw error("tabs are not allowed in indentation");
                }
            }
            return true;
        }

        private Entry splitEntry(String content) throws GoalParseException {
            int colon = content.indexOf(": ");
            String key;
            String value;
            if (colon >= 0) {
                key = content.substring(0, colon).strip();
                value = stripComment(content.substring(colon + 2).strip());
            } else if (content.endsWith(":")) {
                key = content.substring(0, content.length() - 1).strip();
                value = "";
            } else {
                throw error("expected 'key: value'");
            }
            if (key.isEmpty()) {
                throw error("empty key");
            }
            if (isQuoted(key)) {
                key = unquote(key);
            }
            if (value.startsWith("[") || value.startsWith("{")) {
                throw error("flow collections are not supported");
            }
            if ((value.startsWith("|") || value.startsWith(">")) && !isBlockIndicator(value)) {
                throw error("only '|' and '>' block scalars are supported");
            }
            return new Entry(key, value);
        }

        private String scalar(String raw) throws GoalParseException {
            if (raw.startsWith("\"") || raw.startsWith("'")) {
                if (!isQuoted(raw)) {
                    throw error("unterminated quoted value");
                }
                return unquote(raw);
            }
            return raw;
        }

        private <V> void putUnique(Map<String, V> map, String key, V value) throws GoalParseException {
            if (map.containsKey(key)) {
                throw error("duplicate key '" + key + "'");
            }
            map.put(key, value);
        }

        private GoalParseException error(String message) {
            return new GoalParseException(message, Math.min(index, lines.length - 1) + 1);
        }
    }

    private record Entry(String key, String value) {
    }

    private static boolean isBlockIndicator(String value) {
        return value.equals("|") || value.equals(">");
    }

    private static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static boolean isQuoted(String value) {
        return value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\""))
                || (value.startsWith("'") && value.endsWith("'")));
    }

    private static String unquote(String value) {
        String inner = value.substring(1, value.length() - 1);
        if (value.charAt(0) == '\'') {
            return inner.replace("''", "'");
        }
        return inner.replace("\\\"", "\"").replace("\\\\", "\\");
    }

    private static String stripComment(String value) {
        if (value.startsWith("\"") || value.startsWith("'")) {
            return value;
        }
        int hash = value.indexOf(" #");
        return hash >= 0 ? value.substring(0, hash).stripTrailing() : value;
    }
}
