package NTM;

import NTM.Model.MachineDefinition;
import NTM.Model.MalformedDefinitionException;
import NTM.Model.Move;
import NTM.Model.Transition;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Reads machine definitions from CSV text.
 * Seven header lines (name, states, input alphabet, tape alphabet, start, accept, reject)
 * followed by one {@code from,read,to,write,move} rule per line.
 */
public class MachineFormat {
    static final int HEADER_LINES = 7;
    private static final int RULE_FIELDS = 5;

    public static MachineDefinition parse(InputStream is) throws IOException, MalformedDefinitionException {
        return parse(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    public static MachineDefinition parse(Reader reader) throws IOException, MalformedDefinitionException {
        final BufferedReader in = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        final List<List<String>> header = new ArrayList<>(HEADER_LINES);
        final List<Transition> transitions = new ArrayList<>();

        int lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            final List<String> row = splitRow(line, lineNumber);
            if (header.size() < HEADER_LINES) {
                header.add(row);
            } else if (!isBlank(row)) {
                transitions.add(parseRule(row, lineNumber));
            }
        }
        if (header.size() < HEADER_LINES) {
            throw new MalformedDefinitionException(
                "Expected " + HEADER_LINES + " header lines, found " + header.size());
        }

        final String name = firstField(header.get(0), "machine name", 1);
        final List<String> states = items(header.get(1));
        final List<Character> sigma = symbols(items(header.get(2)), 3);
        final List<Character> gamma = symbols(items(header.get(3)), 4);
        final String start = firstField(header.get(4), "start state", 5);
        final String accept = firstField(header.get(5), "accept state", 6);
        final String reject = firstField(header.get(6), "reject state", 7);
        if (states.isEmpty()) {
            throw new MalformedDefinitionException("Line 2: no states");
        }

        try {
            return new MachineDefinition(name, states, sigma, gamma, start, accept, reject, transitions);
        } catch (IllegalArgumentException e) {
            throw new MalformedDefinitionException(name + ": " + e.getMessage(), e);
        }
    }

    public static MachineDefinition getMachineFile(String filePath) {
        try (InputStream is = new FileInputStream(filePath)) {
            return parse(is);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    /**
     * Load a definition from the class path, e.g. {@code machines/check_a_plus.csv}.
     */
    public static MachineDefinition getMachineResource(String resourcePath) {
        try (InputStream is = MachineFormat.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new FileNotFoundException("No such resource: " + resourcePath);
            }
            return parse(is);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    private static Transition parseRule(List<String> row, int lineNumber) throws MalformedDefinitionException {
        if (row.size() != RULE_FIELDS) {
            throw new MalformedDefinitionException(
                "Line " + lineNumber + ": expected " + RULE_FIELDS + " fields in rule, found " + row.size());
        }
        final String from = row.get(0).trim();
        final char read = symbol(row.get(1).trim(), lineNumber);
        final String to = row.get(2).trim();
        final char write = symbol(row.get(3).trim(), lineNumber);
        final Move move = Move.fromToken(row.get(4).trim());
        if (from.isEmpty() || to.isEmpty()) {
            throw new MalformedDefinitionException("Line " + lineNumber + ": empty state in rule");
        }
        return new Transition(from, read, to, write, move);
    }

    private static String firstField(List<String> row, String what, int lineNumber) throws MalformedDefinitionException {
        final String value = row.isEmpty() ? "" : row.get(0).trim();
        if (value.isEmpty()) {
            throw new MalformedDefinitionException("Line " + lineNumber + ": missing " + what);
        }
        return value;
    }

    // every field, and every comma-separated part of a quoted field, is one item
    private static List<String> items(List<String> row) {
        final List<String> result = new ArrayList<>();
        for (String field : row) {
            for (String part : field.split(",")) {
                final String item = part.trim();
                if (!item.isEmpty()) {
                    result.add(item);
                }
            }
        }
        return result;
    }

    private static List<Character> symbols(List<String> items, int lineNumber) throws MalformedDefinitionException {
        final List<Character> result = new ArrayList<>(items.size());
        for (String item : items) {
            result.add(symbol(item, lineNumber));
        }
        return result;
    }

    private static char symbol(String token, int lineNumber) throws MalformedDefinitionException {
        if (token.length() != 1) {
            throw new MalformedDefinitionException(
                "Line " + lineNumber + ": symbols must be single characters, got '" + token + "'");
        }
        return token.charAt(0);
    }

    private static boolean isBlank(List<String> row) {
        for (String field : row) {
            if (!field.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Split one CSV line. Double quotes delimit a field that may contain commas; "" inside a
     * quoted field is a literal quote.
     */
    static List<String> splitRow(String line, int lineNumber) throws MalformedDefinitionException {
        final List<String> fields = new ArrayList<>();
        if (line.isEmpty()) {
            return fields;
        }
        final StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        if (quoted) {
            throw new MalformedDefinitionException("Line " + lineNumber + ": unterminated quote");
        }
        fields.add(field.toString());
        return fields;
    }
}
