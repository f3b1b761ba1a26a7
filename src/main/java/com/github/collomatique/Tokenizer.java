package com.github.collomatique;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.collomatique.parser.ParsingException;
import com.github.collomatique.parser.Span;

public class Tokenizer {

    List<Pattern> patterns = new ArrayList<>();

    {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && !tokenType.keyword) {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }
        patterns.sort(Comparator.comparingInt((Pattern p) -> ((StaticPattern) p).pattern.length()).reversed());

        patterns.add(0, new CommentPattern());
        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());
        patterns.add(new StringPattern());
    }

    public Tokens tokenize(String programString) {
        List<Token> tokens = new ArrayList<>();

        int index = 0;
        while (index < programString.length()) {
            if (Character.isWhitespace(programString.charAt(index))) {
                index++;
                continue;
            }

            boolean gotMatch = false;
            for (var pattern : patterns) {
                var result = pattern.match(programString, index);
                if (result.isPresent()) {
                    tokens.add(result.get());
                    index = result.get().end();
                    gotMatch = true;
                    break;
                }
            }
            if (!gotMatch) {
                throw new ParsingException(ParsingException.Kind.UNEXPECTED_CHARACTER, new Span(index, index + 1),
                        "unexpected character '" + programString.charAt(index) + "'");
            }
        }

        tokens.add(new Token(TokenType.EOF, "", index, index));

        return new Tokens(tokens);
    }

    interface Pattern {
        Optional<Token> match(String programString, int index);
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(String programString, int index) {
            if (programString.startsWith(pattern, index)) {
                return Optional.of(new Token(tokenType, pattern, index, index + pattern.length()));
            } else {
                return Optional.empty();
            }
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (Character.isDigit(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && Character.isDigit(programString.charAt(index))) {
                    index++;
                }
                return Optional.of(new Token(TokenType.NUMBER, programString.substring(start, index), start, index));
            } else {
                return Optional.empty();
            }
        }
    }

    // keywords are identifiers with a reserved image
    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (isIdentifierStart(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && isIdentifierPart(programString.charAt(index))) {
                    index++;
                }
                var image = programString.substring(start, index);
                var type = TokenType.KEYWORDS.getOrDefault(image, TokenType.IDENTIFIER);
                return Optional.of(new Token(type, image, start, index));
            } else {
                return Optional.empty();
            }
        }

        static boolean isIdentifierStart(char c) {
            return c == '_' || (c < 128 && Character.isLetter(c));
        }

        static boolean isIdentifierPart(char c) {
            return isIdentifierStart(c) || Character.isDigit(c);
        }
    }

    static class StringPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (programString.charAt(index) == '"') {
                int start = index;
                index++;
                var sb = new StringBuilder();
                while (index < programString.length()) {
                    char cur = programString.charAt(index);
                    if (cur == '"') {
                        break;
                    }
                    if (cur == '\\' && index + 1 < programString.length()) {
                        index++;
                        char escaped = programString.charAt(index);
                        sb.append(switch (escaped) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            default -> escaped;
                        });
                    } else {
                        sb.append(cur);
                    }
                    index++;
                }
                if (index == programString.length()) {
                    throw new ParsingException(ParsingException.Kind.UNTERMINATED_STRING, new Span(start, index),
                            "unterminated string literal");
                }
                index += 1;
                return Optional.of(new Token(TokenType.STRING, sb.toString(), start, index));
            } else {
                return Optional.empty();
            }
        }
    }

    // "#" comment, "##" docstring line
    static class CommentPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (programString.charAt(index) == '#') {
                int start = index;
                var type = programString.startsWith("##", index) ? TokenType.DOCSTRING : TokenType.COMMENT;
                index += type == TokenType.DOCSTRING ? 2 : 1;
                int contentStart = index;
                while (index < programString.length() && programString.charAt(index) != '\n') {
                    index++;
                }
                return Optional.of(new Token(type, programString.substring(contentStart, index), start, index));
            } else {
                return Optional.empty();
            }
        }
    }

    public record Token(TokenType type, String image, int start, int end) {
        public Span span() {
            return new Span(start, end);
        }
    }

    public enum TokenType {
        LET("let", true),
        PUB("pub", true),
        REIFY("reify", true),
        AS("as", true),
        TYPE("type", true),
        ENUM("enum", true),
        IF("if", true),
        ELSE("else", true),
        MATCH("match", true),
        WHERE("where", true),
        FORALL("forall", true),
        SUM("sum", true),
        FOLD("fold", true),
        WITH("with", true),
        IN("in", true),
        FOR("for", true),
        AND("and", true),
        OR("or", true),
        NOT("not", true),
        TRUE("true", true),
        FALSE("false", true),

        NUMBER,
        STRING,

        CONSTRAINT_EQ("==="), CONSTRAINT_LE("<=="), CONSTRAINT_GE(">=="),
        EQUALS_EQUALS("=="), NOT_EQUALS("!="),
        LE("<="), GE(">="), LT("<"), GT(">"),
        PLUS("+"), MINUS("-"),
        STAR("*"), SLASH_SLASH("//"), PERCENT("%"),

        COMMENT,
        DOCSTRING,

        LBRACE("{"),
        RBRACE("}"),
        LPAREN("("),
        RPAREN(")"),
        LBRACKET("["),
        RBRACKET("]"),

        ARROW("->"),
        DOUBLE_COLON("::"),
        DOT_DOT(".."),
        COLON(":"),
        SEMICOLON(";"),
        EQUALS("="),
        PIPE("|"),
        DOLLAR("$"),
        AT("@"),
        IDENTIFIER,
        DOT("."),
        COMMA(","),
        EOF;

        static final Map<String, TokenType> KEYWORDS = new HashMap<>();

        static {
            for (var type : values()) {
                if (type.keyword) {
                    KEYWORDS.put(type.constantPattern, type);
                }
            }
        }

        final String constantPattern;
        final boolean keyword;

        private TokenType() {
            this(null, false);
        }
        private TokenType(String constantPattern) {
            this(constantPattern, false);
        }
        private TokenType(String constantPattern, boolean keyword) {
            this.constantPattern = constantPattern;
            this.keyword = keyword;
        }

        /** Source text of the token kind, or its name for variable tokens. */
        public String describe() {
            return constantPattern != null ? "'" + constantPattern + "'" : name().toLowerCase();
        }
    }

    public static class Tokens {
        final List<Token> tokens;
        int index;

        Tokens(List<Token> tokens) {
            this.tokens = tokens;
        }

        private void skipTrivia() {
            while (tokens.get(index).type() == TokenType.COMMENT || tokens.get(index).type() == TokenType.DOCSTRING) {
                index++;
            }
        }

        public Token next() {
            skipTrivia();
            return tokens.get(index++);
        }

        /** Does not move past comments, so {@link #docstrings()} still sees them. */
        public Token peek() {
            return peekAt(0);
        }

        /** The {@code n}-th token after the next one, {@code peekAt(0)} being {@link #peek()}. */
        public Token peekAt(int n) {
            int i = index;
            for (int seen = 0; ; i++) {
                var type = tokens.get(i).type();
                if (type == TokenType.COMMENT || type == TokenType.DOCSTRING) {
                    continue;
                }
                if (seen == n || type == TokenType.EOF) {
                    return tokens.get(i);
                }
                seen++;
            }
        }

        /** Consumes the comments in front of the next token, returning the docstring lines among them. */
        public List<Token> docstrings() {
            List<Token> result = new ArrayList<>();
            while (tokens.get(index).type() == TokenType.COMMENT || tokens.get(index).type() == TokenType.DOCSTRING) {
                if (tokens.get(index).type() == TokenType.DOCSTRING) {
                    result.add(tokens.get(index));
                }
                index++;
            }
            return result;
        }

        public Token previous() {
            for (int i = index - 1; i >= 0; i--) {
                var type = tokens.get(i).type();
                if (type != TokenType.COMMENT && type != TokenType.DOCSTRING) {
                    return tokens.get(i);
                }
            }
            return tokens.get(0);
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public Token peek(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw unexpected(token, type.describe());
            }
            return token;
        }

        public Token next(TokenType type) {
            var token = peek(type);
            skipTrivia();
            index++;
            return token;
        }

        public Token next(TokenType type, ParsingException.Kind kind, String what) {
            var token = peek();
            if (token.type() != type) {
                throw new ParsingException(kind, token.span(), "expected " + what + " but got " + describe(token));
            }
            skipTrivia();
            index++;
            return token;
        }

        public static ParsingException unexpected(Token token, String expected) {
            return new ParsingException(ParsingException.Kind.UNEXPECTED_TOKEN, token.span(),
                    "expected " + expected + " but got " + describe(token));
        }

        private static String describe(Token token) {
            return token.type() == TokenType.EOF ? "end of input" : "'" + token.image() + "'";
        }
    }

}
