package org.chessarena.agent;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class AgentReplyParser {
    private static final Pattern MOVE = Pattern.compile("MOVE\\**\\s*:\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern THOUGHT = Pattern.compile("THOUGHT\\**\\s*:\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRASH = Pattern.compile("TRASH\\**\\s*:\\s*([^\\n]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern MOVE_NUMBER = Pattern.compile("^\\d+\\.+\\s*");
    private static final String WRAPPING = "*_`\"'[]()";
    private static final String TRAILING = ".,;:";

    public AgentReply parse(String content) {
        if (content == null) {
            return new AgentReply(null, null, null, null);
        }
        return new AgentReply(
                cleanMove(field(MOVE, content)),
                cleanText(field(THOUGHT, content)),
                cleanText(field(TRASH, content)),
                content);
    }

    private String field(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    /** Reduces the MOVE field to its first token, without markup or a leading move number. */
    String cleanMove(String value) {
        if (value == null) {
            return null;
        }
        String token = stripWrapping(value.trim());
        token = MOVE_NUMBER.matcher(token).replaceFirst("");
        int space = token.indexOf(' ');
        if (space > 0) {
            token = token.substring(0, space);
        }
        token = stripWrapping(token);
        while (!token.isEmpty() && TRAILING.indexOf(token.charAt(token.length() - 1)) >= 0) {
            token = token.substring(0, token.length() - 1);
        }
        return token.isEmpty() ? null : token;
    }

    private String cleanText(String value) {
        if (value == null) {
            return null;
        }
        String text = stripWrapping(value.trim());
        return text.isEmpty() ? null : text;
    }

    private String stripWrapping(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && WRAPPING.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && WRAPPING.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end).trim();
    }
}
