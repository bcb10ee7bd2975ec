package com.flatlock.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.flatlock.exception.LockfileParseException;
import com.flatlock.model.LockfileFormat;
import com.flatlock.parser.YarnLockToken.TokenType;

/**
 * Tokenizer for yarn v1 lockfiles.
 *
 * Indentation is only significant directly after a newline and must be a multiple
 * of two spaces. Quoted strings use JSON escapes.
 */
public class YarnLockTokenizer {
    private static final Logger log = LoggerFactory.getLogger(YarnLockTokenizer.class);

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;
    private boolean lineStart = true;

    public YarnLockTokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenize the entire lockfile.
     */
    public List<YarnLockToken> tokenize() {
        List<YarnLockToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            YarnLockToken token = nextToken();
            if (token != null) {
                tokens.add(token);
            }
        }

        tokens.add(new YarnLockToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized yarn lockfile into {} tokens over {} lines", tokens.size(), line);
        return tokens;
    }

    private YarnLockToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;
        boolean atLineStart = lineStart;
        lineStart = false;

        if (c == '\n' || c == '\r') {
            pos++;
            if (c == '\r' && pos < source.length() && source.charAt(pos) == '\n') {
                pos++;
            }
            line++;
            column = 1;
            lineStart = true;
            return new YarnLockToken(TokenType.NEWLINE, "\n", startLine, startCol);
        }

        if (c == '#') {
            int end = source.indexOf('\n', pos);
            if (end < 0) {
                end = source.length();
            }
            String comment = source.substring(pos + 1, end).stripTrailing();
            advanceTo(end);
            return new YarnLockToken(TokenType.COMMENT, comment, startLine, startCol);
        }

        if (c == ' ') {
            int end = pos;
            while (end < source.length() && source.charAt(end) == ' ') {
                end++;
            }
            int spaces = end - pos;
            advanceTo(end);
            if (!atLineStart) {
                return null;
            }
            if (spaces % 2 != 0) {
                throw new LockfileParseException(LockfileFormat.YARN_CLASSIC,
                        "Invalid number of spaces (" + spaces + ")", startLine);
            }
            return new YarnLockToken(TokenType.INDENT, String.valueOf(spaces / 2), startLine, startCol);
        }

        if (c == '\t') {
            advanceTo(pos + 1);
            return null;
        }

        if (c == '"') {
            return readQuotedString(startLine, startCol);
        }

        if (c == ':') {
            advanceTo(pos + 1);
            return new YarnLockToken(TokenType.COLON, ":", startLine, startCol);
        }

        if (c == ',') {
            advanceTo(pos + 1);
            return new YarnLockToken(TokenType.COMMA, ",", startLine, startCol);
        }

        if (Character.isLetterOrDigit(c) || c == '/' || c == '.' || c == '-') {
            return readBareWord(startLine, startCol);
        }

        throw new LockfileParseException(LockfileFormat.YARN_CLASSIC,
                "Unexpected character '" + c + "' at column " + startCol, startLine);
    }

    private YarnLockToken readBareWord(int startLine, int startCol) {
        int end = pos;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (c == ':' || c == ' ' || c == '\n' || c == '\r' || c == ',') {
                break;
            }
            end++;
        }
        String word = source.substring(pos, end);
        advanceTo(end);

        if (word.equals("true") || word.equals("false")) {
            return new YarnLockToken(TokenType.BOOLEAN, word, startLine, startCol);
        }
        if (word.chars().allMatch(Character::isDigit)) {
            return new YarnLockToken(TokenType.NUMBER, word, startLine, startCol);
        }
        return new YarnLockToken(TokenType.STRING, word, startLine, startCol);
    }

    private YarnLockToken readQuotedString(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        int i = pos + 1;

        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"') {
                advanceTo(i + 1);
                return new YarnLockToken(TokenType.STRING, sb.toString(), startLine, startCol);
            }
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == '\\') {
                if (i + 1 >= source.length()) {
                    break;
                }
                char escaped = source.charAt(i + 1);
                switch (escaped) {
                    case '"', '\\', '/' -> sb.append(escaped);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (i + 6 > source.length()) {
                            throw invalidString(startLine);
                        }
                        try {
                            sb.append((char) Integer.parseInt(source.substring(i + 2, i + 6), 16));
                        } catch (NumberFormatException e) {
                            throw invalidString(startLine);
                        }
                        i += 4;
                    }
                    default -> throw invalidString(startLine);
                }
                i += 2;
                continue;
            }
            sb.append(c);
            i++;
        }

        throw new LockfileParseException(LockfileFormat.YARN_CLASSIC, "Unterminated string", startLine);
    }

    private LockfileParseException invalidString(int startLine) {
        return new LockfileParseException(LockfileFormat.YARN_CLASSIC, "Invalid escape in string", startLine);
    }

    private void advanceTo(int end) {
        column += end - pos;
        pos = end;
    }
}
