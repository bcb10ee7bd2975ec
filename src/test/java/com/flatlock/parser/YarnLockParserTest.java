package com.flatlock.parser;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flatlock.exception.LockfileParseException;
import com.flatlock.model.LockfileFormat;
import com.flatlock.parser.YarnLockToken.TokenType;

/**
 * Unit tests for YarnLockTokenizer and YarnLockParser.
 */
class YarnLockParserTest {

    @Test
    void testTokenizeEntryHeader() {
        List<YarnLockToken> tokens = new YarnLockTokenizer("lodash@^4.17.21:\n  version \"4.17.21\"\n").tokenize();

        assertThat(tokens).extracting(YarnLockToken::getType).containsExactly(
                TokenType.STRING, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.STRING, TokenType.STRING, TokenType.NEWLINE,
                TokenType.EOF);
        assertThat(tokens.get(0).getValue()).isEqualTo("lodash@^4.17.21");
        assertThat(tokens.get(3).getDepth()).isEqualTo(1);
        assertThat(tokens.get(5).getValue()).isEqualTo("4.17.21");
        assertThat(tokens.get(5).getLine()).isEqualTo(2);
    }

    @Test
    void testTokenizeBareValues() {
        List<YarnLockToken> tokens = new YarnLockTokenizer("a true\nb 42\nc 1.2.3\n").tokenize();

        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.BOOLEAN);
        assertThat(tokens.get(4).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(7).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(7).getValue()).isEqualTo("1.2.3");
    }

    @Test
    void testParseEntries() {
        String content = """
                # THIS IS AN AUTOGENERATED FILE. DO NOT EDIT THIS FILE DIRECTLY.
                # yarn lockfile v1


                "@babel/code-frame@^7.0.0", "@babel/code-frame@^7.10.4":
                  version "7.12.13"
                  resolved "https://registry.yarnpkg.com/@babel/code-frame/-/code-frame-7.12.13.tgz#dcfc826b"
                  integrity sha512-abc==
                  dependencies:
                    "@babel/highlight" "^7.12.13"

                lodash@^4.17.21:
                  version "4.17.21"
                """;

        ObjectNode root = YarnLockParser.parse(content);

        assertThat(root.size()).isEqualTo(2);
        JsonNode codeFrame = root.get("@babel/code-frame@^7.0.0, @babel/code-frame@^7.10.4");
        assertThat(codeFrame).isNotNull();
        assertThat(codeFrame.get("version").asText()).isEqualTo("7.12.13");
        assertThat(codeFrame.get("resolved").asText()).endsWith("#dcfc826b");
        assertThat(codeFrame.get("integrity").asText()).isEqualTo("sha512-abc==");
        assertThat(codeFrame.get("dependencies").get("@babel/highlight").asText()).isEqualTo("^7.12.13");
        assertThat(root.get("lodash@^4.17.21").get("version").asText()).isEqualTo("4.17.21");
    }

    @Test
    void testParseNestedBlockFollowedByField() {
        String content = """
                express@^4.18.2:
                  dependencies:
                    debug "2.6.9"
                    ms "2.0.0"
                  version "4.18.2"
                """;

        ObjectNode root = YarnLockParser.parse(content);

        JsonNode express = root.get("express@^4.18.2");
        assertThat(express.get("dependencies").size()).isEqualTo(2);
        assertThat(express.get("version").asText()).isEqualTo("4.18.2");
    }

    @Test
    void testParseTypedValues() {
        ObjectNode root = YarnLockParser.parse("fsevents@^2.3.2:\n  optional true\n  count 3\n");

        JsonNode entry = root.get("fsevents@^2.3.2");
        assertThat(entry.get("optional").isBoolean()).isTrue();
        assertThat(entry.get("optional").asBoolean()).isTrue();
        assertThat(entry.get("count").isNumber()).isTrue();
        assertThat(entry.get("count").asLong()).isEqualTo(3L);
    }

    @Test
    void testRepeatedKeyReplacesEarlierValue() {
        String content = """
                a@^1.0.0:
                  version "1.0.0"

                a@^1.0.0:
                  version "1.0.1"
                """;

        ObjectNode root = YarnLockParser.parse(content);

        assertThat(root.size()).isEqualTo(1);
        assertThat(root.get("a@^1.0.0").get("version").asText()).isEqualTo("1.0.1");
    }

    @Test
    void testOddIndentationFails() {
        assertThatThrownBy(() -> YarnLockParser.parse("foo@1.0.0:\n   version \"1.0.0\"\n"))
                .isInstanceOf(LockfileParseException.class)
                .hasMessageContaining("Invalid number of spaces")
                .satisfies(e -> {
                    LockfileParseException parseException = (LockfileParseException) e;
                    assertThat(parseException.getFormat()).isEqualTo(LockfileFormat.YARN_CLASSIC);
                    assertThat(parseException.getLine()).isEqualTo(2);
                });
    }

    @Test
    void testMergeConflictMarkersFail() {
        String content = """
                <<<<<<< HEAD
                lodash@^4.17.21:
                  version "4.17.21"
                =======
                lodash@^4.17.20:
                  version "4.17.20"
                >>>>>>> feature
                """;

        assertThatThrownBy(() -> YarnLockParser.parse(content))
                .isInstanceOf(LockfileParseException.class)
                .hasMessageContaining("merge conflict");
    }

    @Test
    void testUnsupportedVersionCommentFails() {
        assertThatThrownBy(() -> YarnLockParser.parse("# yarn lockfile v2\n\nfoo@1.0.0:\n  version \"1.0.0\"\n"))
                .isInstanceOf(LockfileParseException.class)
                .hasMessageContaining("v2");
    }

    @Test
    void testUnterminatedStringFails() {
        assertThatThrownBy(() -> YarnLockParser.parse("\"lodash@^4.17.21:\n  version \"4.17.21\"\n"))
                .isInstanceOf(LockfileParseException.class)
                .hasMessageContaining("Unterminated string");
    }

    @Test
    void testUnexpectedCharacterFails() {
        assertThatThrownBy(() -> YarnLockParser.parse("{\"lockfileVersion\": 3}"))
                .isInstanceOf(LockfileParseException.class);
    }

    @Test
    void testEscapesInQuotedStrings() {
        ObjectNode root = YarnLockParser.parse("\"a\\\"b@1.0.0\":\n  version \"1.0.0\\u0041\"\n");

        assertThat(root.get("a\"b@1.0.0").get("version").asText()).isEqualTo("1.0.0A");
    }
}
