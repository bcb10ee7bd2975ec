package com.flatlock.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flatlock.exception.LockfileParseException;
import com.flatlock.model.LockfileFormat;
import com.flatlock.parser.YarnLockToken.TokenType;

/**
 * Parser for yarn v1 lockfiles.
 * Converts tokens into a Jackson object tree so every lockfile format is read through
 * the same {@link JsonNode} API.
 *
 * <pre>
 * # yarn lockfile v1
 *
 * "@babel/code-frame@^7.0.0", "@babel/code-frame@^7.10.4":
 *   version "7.12.13"
 *   dependencies:
 *     "@babel/highlight" "^7.12.13"
 * </pre>
 *
 * A comma separated key list is stored once under the joined key
 * ({@code "@babel/code-frame@^7.0.0, @babel/code-frame@^7.10.4"}).
 */
public class YarnLockParser {
    private static final Logger log = LoggerFactory.getLogger(YarnLockParser.class);

    private static final int SUPPORTED_VERSION = 1;
    private static final Pattern VERSION_COMMENT = Pattern.compile("^\\s*yarn lockfile v(\\d+)");
    private static final Pattern MERGE_MARKER = Pattern.compile("(?m)^<<<<<<<");

    private final List<YarnLockToken> tokens;
    private int pos = 0;

    public YarnLockParser(List<YarnLockToken> tokens) {
        this.tokens = tokens;
    }

    /**
     * Tokenize and parse a whole lockfile.
     *
     * @throws LockfileParseException on any syntax error or an unresolved merge conflict
     */
    public static ObjectNode parse(String content) {
        if (MERGE_MARKER.matcher(content).find()) {
            throw new LockfileParseException(LockfileFormat.YARN_CLASSIC,
                    "Lockfile contains unresolved merge conflict markers");
        }
        List<YarnLockToken> tokens = new YarnLockTokenizer(content).tokenize();
        ObjectNode root = new YarnLockParser(tokens).parse();
        log.debug("Parsed yarn lockfile with {} entries", root.size());
        return root;
    }

    public ObjectNode parse() {
        ObjectNode root = parseObject(0);
        if (!isAtEnd()) {
            throw unexpected("Unexpected " + peek().getType() + " token");
        }
        return root;
    }

    private ObjectNode parseObject(int indent) {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();

        while (true) {
            YarnLockToken token = peek();

            if (token.getType() == TokenType.NEWLINE) {
                YarnLockToken next = advanceAndPeek();
                if (indent == 0) {
                    continue;
                }
                if (next.getType() != TokenType.INDENT) {
                    break;
                }
                if (next.getDepth() == indent) {
                    advance();
                } else {
                    break;
                }
            } else if (token.getType() == TokenType.INDENT) {
                if (token.getDepth() == indent) {
                    advance();
                } else {
                    break;
                }
            } else if (token.getType() == TokenType.EOF) {
                break;
            } else if (token.getType() == TokenType.COMMENT) {
                checkVersionComment(token);
                advance();
            } else if (token.getType() == TokenType.STRING) {
                if (parseProperty(obj, indent)) {
                    break;
                }
            } else {
                throw unexpected("Unexpected " + token.getType() + " token");
            }
        }

        return obj;
    }

    /**
     * Parses one {@code key value} pair or {@code key:} block into {@code obj}.
     *
     * @return true when a nested block ended on a shallower line and the caller must stop
     */
    private boolean parseProperty(ObjectNode obj, int indent) {
        List<String> keys = new ArrayList<>();
        keys.add(requireKey(advance()));

        while (check(TokenType.COMMA)) {
            advance();
            YarnLockToken keyToken = peek();
            if (keyToken.getType() != TokenType.STRING) {
                throw unexpected("Expected string after comma");
            }
            keys.add(requireKey(advance()));
        }
        String key = String.join(", ", keys);

        boolean wasColon = check(TokenType.COLON);
        if (wasColon) {
            advance();
        }

        if (peek().isValue()) {
            obj.set(key, toValueNode(advance()));
            return false;
        }
        if (wasColon) {
            obj.set(key, parseObject(indent + 1));
            return indent > 0 && !check(TokenType.INDENT);
        }
        throw unexpected("Invalid value type for key '" + key + "'");
    }

    private JsonNode toValueNode(YarnLockToken token) {
        return switch (token.getType()) {
            case BOOLEAN -> JsonNodeFactory.instance.booleanNode(Boolean.parseBoolean(token.getValue()));
            case NUMBER -> numberNode(token.getValue());
            default -> JsonNodeFactory.instance.textNode(token.getValue());
        };
    }

    private JsonNode numberNode(String digits) {
        try {
            return JsonNodeFactory.instance.numberNode(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return JsonNodeFactory.instance.textNode(digits);
        }
    }

    private void checkVersionComment(YarnLockToken token) {
        Matcher matcher = VERSION_COMMENT.matcher(token.getValue());
        if (matcher.find() && Integer.parseInt(matcher.group(1)) > SUPPORTED_VERSION) {
            throw new LockfileParseException(LockfileFormat.YARN_CLASSIC,
                    "Unsupported lockfile version v" + matcher.group(1), token.getLine());
        }
    }

    private String requireKey(YarnLockToken token) {
        if (token.getValue() == null || token.getValue().isEmpty()) {
            throw new LockfileParseException(LockfileFormat.YARN_CLASSIC, "Expected a key", token.getLine());
        }
        return token.getValue();
    }

    private LockfileParseException unexpected(String message) {
        YarnLockToken token = peek();
        return new LockfileParseException(LockfileFormat.YARN_CLASSIC,
                message + " at column " + token.getColumn(), token.getLine());
    }

    // Helper methods

    private YarnLockToken peek() {
        return tokens.get(pos);
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private YarnLockToken advance() {
        YarnLockToken token = tokens.get(pos);
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private YarnLockToken advanceAndPeek() {
        advance();
        return peek();
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }
}
