package com.relayjobs;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Static check for wait loops that can never finish because they match themselves.
 *
 * <p>A command such as {@code while pgrep -f "train.py"; do sleep 5; done} runs inside a shell whose
 * own command line contains {@code train.py}, so {@code pgrep -f} keeps finding the waiting shell.
 * The guard finds {@code pgrep}/{@code pkill} calls that use full command-line matching and tests
 * whether their pattern matches the command line the job will run under. A pattern written not to
 * match its own text (e.g. {@code [t]rain.py}) is not flagged.
 */
public final class WaitPatternGuard {

    public enum Mode {
        OFF, WARN, REJECT;

        public static Mode parse(String value) {
            if (value == null || value.isBlank()) return REJECT;
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "off" -> OFF;
                case "warn" -> WARN;
                case "reject" -> REJECT;
                default -> throw new IllegalArgumentException("wait pattern guard mode must be off, warn or reject: " + value);
            };
        }

        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static final class Finding {
        public final String tool;
        public final String pattern;

        Finding(String tool, String pattern) {
            this.tool = tool;
            this.pattern = pattern;
        }

        public String describe() {
            return tool + " -f \"" + pattern + "\" matches the job's own command line";
        }

        @Override
        public String toString() {
            return describe();
        }
    }

    private static final Set<String> TOOLS = Set.of("pgrep", "pkill");
    private static final Set<String> SEPARATORS = Set.of(";", "|", "&", "(", ")", "`", "\n");
    // short options of pgrep/pkill that take a value
    private static final String SHORT_WITH_VALUE = "dgGPstuUF";
    private static final Set<String> LONG_WITH_VALUE = Set.of(
        "--delimiter", "--pgroup", "--group", "--parent", "--session", "--terminal",
        "--euid", "--uid", "--pidfile", "--signal", "--ns", "--nslist", "--env", "--cgroup");

    private static final int MAX_DEPTH = 4;

    private WaitPatternGuard() {}

    public static List<Finding> scan(String command, String invocationLine) {
        List<Finding> out = new ArrayList<>();
        scan(command, invocationLine, 0, out);
        return out;
    }

    private static void scan(String command, String invocationLine, int depth, List<Finding> out) {
        List<String> tokens = tokenize(command);
        Set<Integer> patterns = new HashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            String tool = baseName(tokens.get(i));
            if (!TOOLS.contains(tool)) continue;
            boolean full = false;
            String pattern = null;
            int j = i + 1;
            while (j < tokens.size()) {
                String tok = tokens.get(j);
                if (SEPARATORS.contains(tok)) break;
                if (tok.equals("--")) {
                    if (j + 1 < tokens.size() && !SEPARATORS.contains(tokens.get(j + 1))) {
                        pattern = tokens.get(j + 1);
                        patterns.add(j + 1);
                    }
                    break;
                }
                if (tok.startsWith("--")) {
                    String name = tok.contains("=") ? tok.substring(0, tok.indexOf('=')) : tok;
                    if (name.equals("--full")) full = true;
                    if (LONG_WITH_VALUE.contains(name) && !tok.contains("=")) j++;
                    j++;
                    continue;
                }
                if (tok.startsWith("-") && tok.length() > 1) {
                    for (int k = 1; k < tok.length(); k++) {
                        char ch = tok.charAt(k);
                        if (ch == 'f') full = true;
                        if (SHORT_WITH_VALUE.indexOf(ch) >= 0) {
                            if (k == tok.length() - 1) j++;
                            break;
                        }
                    }
                    j++;
                    continue;
                }
                pattern = tok;
                patterns.add(j);
                break;
            }
            if (full && pattern != null && !pattern.isEmpty() && matchesSelf(pattern, invocationLine)) {
                out.add(new Finding(tool, pattern));
            }
        }
        if (depth >= MAX_DEPTH) return;
        // quoted words may hold a whole script (bash -c '...') or a substitution ("$(pgrep ...)")
        for (int i = 0; i < tokens.size(); i++) {
            String tok = tokens.get(i);
            if (patterns.contains(i) || SEPARATORS.contains(tok) || !isNested(tok)) continue;
            scan(tok, invocationLine, depth + 1, out);
        }
    }

    private static boolean isNested(String word) {
        return word.contains("$(") || word.contains("`") || word.chars().anyMatch(Character::isWhitespace);
    }

    static boolean matchesSelf(String pattern, String invocationLine) {
        try {
            return Pattern.compile(pattern).matcher(invocationLine).find();
        } catch (PatternSyntaxException e) {
            return invocationLine.contains(pattern);
        }
    }

    static List<String> tokenize(String command) {
        List<String> tokens = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inWord = false;
        int i = 0;
        while (i < command.length()) {
            char c = command.charAt(i);
            if (c == '\'') {
                int end = command.indexOf('\'', i + 1);
                if (end < 0) end = command.length();
                cur.append(command, i + 1, end);
                inWord = true;
                i = end + 1;
                continue;
            }
            if (c == '"') {
                i++;
                while (i < command.length() && command.charAt(i) != '"') {
                    char d = command.charAt(i);
                    if (d == '\\' && i + 1 < command.length()) {
                        char next = command.charAt(i + 1);
                        if (next == '"' || next == '\\' || next == '$' || next == '`') {
                            cur.append(next);
                            i += 2;
                            continue;
                        }
                    }
                    cur.append(d);
                    i++;
                }
                inWord = true;
                i++;
                continue;
            }
            if (c == '\\' && i + 1 < command.length()) {
                cur.append(command.charAt(i + 1));
                inWord = true;
                i += 2;
                continue;
            }
            if (Character.isWhitespace(c) && c != '\n') {
                if (inWord) tokens.add(cur.toString());
                cur.setLength(0);
                inWord = false;
                i++;
                continue;
            }
            if (SEPARATORS.contains(String.valueOf(c))) {
                if (inWord) tokens.add(cur.toString());
                cur.setLength(0);
                inWord = false;
                tokens.add(String.valueOf(c));
                i++;
                continue;
            }
            cur.append(c);
            inWord = true;
            i++;
        }
        if (inWord) tokens.add(cur.toString());
        return tokens;
    }

    private static String baseName(String token) {
        int slash = token.lastIndexOf('/');
        return slash >= 0 ? token.substring(slash + 1) : token;
    }
}
