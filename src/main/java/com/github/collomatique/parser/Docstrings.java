package com.github.collomatique.parser;

import java.util.ArrayList;
import java.util.List;

import com.github.collomatique.Tokenizer;
import com.github.collomatique.Tokenizer.Token;
import com.github.collomatique.Tokenizer.TokenType;
import com.github.collomatique.parser.CompilationUnit.DocError;
import com.github.collomatique.parser.CompilationUnit.DocExpression;
import com.github.collomatique.parser.CompilationUnit.DocLine;
import com.github.collomatique.parser.CompilationUnit.DocPart;
import com.github.collomatique.parser.CompilationUnit.DocText;
import com.github.collomatique.parser.ParsingException.Kind;

/**
 * Splits {@code ##} lines into text and backtick-quoted expressions. A broken expression only
 * spoils its own line part, the statement it documents still parses.
 */
final class Docstrings {

    private Docstrings() {}

    static List<DocLine> parse(List<Token> docTokens) {
        List<DocLine> lines = new ArrayList<>();
        for (var token : docTokens) {
            lines.add(parseLine(token));
        }
        return lines;
    }

    static DocLine parseLine(Token token) {
        String content = token.image();
        // content starts right after the "##"
        int base = token.start() + 2;
        List<DocPart> parts = new ArrayList<>();

        int index = 0;
        while (index < content.length()) {
            int open = content.indexOf('`', index);
            if (open < 0) {
                parts.add(new DocText(content.substring(index)));
                break;
            }
            if (open > index) {
                parts.add(new DocText(content.substring(index, open)));
            }
            int close = content.indexOf('`', open + 1);
            if (close < 0) {
                parts.add(new DocError(new ParsingException(Kind.UNMATCHED_BACKTICK,
                        new Span(base + open, base + content.length()), "unterminated expression in docstring")));
                break;
            }
            parts.add(parseEmbedded(content.substring(open + 1, close), base + open + 1));
            index = close + 1;
        }

        return new DocLine(parts, token.span());
    }

    private static DocPart parseEmbedded(String text, int offset) {
        if (text.isBlank()) {
            return new DocError(new ParsingException(Kind.DOCSTRING_EXPRESSION,
                    new Span(offset, offset + text.length()), "empty expression in docstring"));
        }
        try {
            // padding keeps the spans of the embedded expression absolute
            var tokens = new Tokenizer().tokenize(" ".repeat(offset) + text);
            var expression = new Parser().parseExpression(tokens);
            tokens.next(TokenType.EOF);
            return new DocExpression(expression);
        } catch (ParsingException e) {
            return new DocError(new ParsingException(Kind.DOCSTRING_EXPRESSION, e.span(),
                    "invalid expression in docstring: " + e.getMessage()));
        }
    }
}
