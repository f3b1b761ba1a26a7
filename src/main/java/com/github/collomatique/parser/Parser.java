package com.github.collomatique.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.collomatique.Tokenizer;
import com.github.collomatique.Tokenizer.Token;
import com.github.collomatique.Tokenizer.TokenType;
import com.github.collomatique.Tokenizer.Tokens;
import com.github.collomatique.parser.CompilationUnit.AsExpression;
import com.github.collomatique.parser.CompilationUnit.BinaryExpression;
import com.github.collomatique.parser.CompilationUnit.Binding;
import com.github.collomatique.parser.CompilationUnit.BoolExpression;
import com.github.collomatique.parser.CompilationUnit.CallExpression;
import com.github.collomatique.parser.CompilationUnit.CardinalityExpression;
import com.github.collomatique.parser.CompilationUnit.ComprehensionExpression;
import com.github.collomatique.parser.CompilationUnit.DocLine;
import com.github.collomatique.parser.CompilationUnit.EnumStatement;
import com.github.collomatique.parser.CompilationUnit.Expression;
import com.github.collomatique.parser.CompilationUnit.FieldDecl;
import com.github.collomatique.parser.CompilationUnit.FieldExpression;
import com.github.collomatique.parser.CompilationUnit.FieldInit;
import com.github.collomatique.parser.CompilationUnit.FoldExpression;
import com.github.collomatique.parser.CompilationUnit.ForallExpression;
import com.github.collomatique.parser.CompilationUnit.GlobalListExpression;
import com.github.collomatique.parser.CompilationUnit.IdentExpression;
import com.github.collomatique.parser.CompilationUnit.IfExpression;
import com.github.collomatique.parser.CompilationUnit.IntExpression;
import com.github.collomatique.parser.CompilationUnit.LetExpression;
import com.github.collomatique.parser.CompilationUnit.LetStatement;
import com.github.collomatique.parser.CompilationUnit.ListExpression;
import com.github.collomatique.parser.CompilationUnit.ListTypeName;
import com.github.collomatique.parser.CompilationUnit.MatchBranch;
import com.github.collomatique.parser.CompilationUnit.MatchExpression;
import com.github.collomatique.parser.CompilationUnit.Param;
import com.github.collomatique.parser.CompilationUnit.RangeExpression;
import com.github.collomatique.parser.CompilationUnit.ReifyStatement;
import com.github.collomatique.parser.CompilationUnit.SimpleTypeName;
import com.github.collomatique.parser.CompilationUnit.Statement;
import com.github.collomatique.parser.CompilationUnit.StringExpression;
import com.github.collomatique.parser.CompilationUnit.StructExpression;
import com.github.collomatique.parser.CompilationUnit.StructShape;
import com.github.collomatique.parser.CompilationUnit.StructTypeName;
import com.github.collomatique.parser.CompilationUnit.SumExpression;
import com.github.collomatique.parser.CompilationUnit.TupleExpression;
import com.github.collomatique.parser.CompilationUnit.TupleShape;
import com.github.collomatique.parser.CompilationUnit.TupleTypeName;
import com.github.collomatique.parser.CompilationUnit.TypeName;
import com.github.collomatique.parser.CompilationUnit.TypeStatement;
import com.github.collomatique.parser.CompilationUnit.UnaryExpression;
import com.github.collomatique.parser.CompilationUnit.UnitShape;
import com.github.collomatique.parser.CompilationUnit.VarCallExpression;
import com.github.collomatique.parser.CompilationUnit.VariantDecl;
import com.github.collomatique.parser.CompilationUnit.VariantExpression;
import com.github.collomatique.parser.CompilationUnit.VariantShape;
import com.github.collomatique.parser.CompilationUnit.VariantStructExpression;
import com.github.collomatique.parser.CompilationUnit.VariantTypeName;
import com.github.collomatique.parser.ParsingException.Kind;

public class Parser {

    public static CompilationUnit parse(String source) {
        return new Parser().parseCompilationUnit(new Tokenizer().tokenize(source));
    }

    public CompilationUnit parseCompilationUnit(Tokens tokens) {
        List<Statement> statements = new ArrayList<>();

        while (tokens.peek().type() != TokenType.EOF) {
            statements.add(parseStatement(tokens));
        }

        return new CompilationUnit(statements);
    }

    Statement parseStatement(Tokens tokens) {
        var docstring = Docstrings.parse(tokens.docstrings());
        var token = tokens.peek();

        return switch (token.type()) {
            case PUB, LET -> parseLetStatement(tokens, docstring);
            case REIFY -> parseReifyStatement(tokens, docstring);
            case TYPE -> parseTypeStatement(tokens);
            case ENUM -> parseEnumStatement(tokens);
            default -> throw Tokens.unexpected(token, "'let', 'pub', 'reify', 'type' or 'enum'");
        };
    }

    // <> pub? let name "(" (param ("," param)*)? ")" "->" type "=" expression ";"
    private LetStatement parseLetStatement(Tokens tokens, List<DocLine> docstring) {
        var start = tokens.peek().span();
        boolean pub = false;
        if (tokens.matches(TokenType.PUB)) {
            tokens.next();
            pub = true;
        }
        tokens.next(TokenType.LET);
        var name = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "function name"));

        List<Param> params = new ArrayList<>();
        tokens.next(TokenType.LPAREN);
        while (!tokens.matches(TokenType.RPAREN)) {
            var paramName = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "parameter name"));
            tokens.next(TokenType.COLON, Kind.MISSING_TYPE, "':' and parameter type");
            params.add(new Param(paramName, parseType(tokens)));
            if (!tokens.matches(TokenType.RPAREN)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RPAREN);

        tokens.next(TokenType.ARROW, Kind.MISSING_TYPE, "'->' and return type");
        var returnType = parseType(tokens);
        tokens.next(TokenType.EQUALS, Kind.MISSING_BODY, "'=' and function body");
        if (tokens.matches(TokenType.SEMICOLON)) {
            throw new ParsingException(Kind.MISSING_BODY, tokens.peek().span(), "function " + name.value() + " has no body");
        }
        var body = parseExpression(tokens);
        var end = tokens.next(TokenType.SEMICOLON).span();
        return new LetStatement(pub, name, params, returnType, body, docstring, start.merge(end));
    }

    // <> reify name as "$" name ";"  |  reify name as "$" "[" name "]" ";"
    private ReifyStatement parseReifyStatement(Tokens tokens, List<DocLine> docstring) {
        var start = tokens.next(TokenType.REIFY).span();
        var function = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "function name"));
        tokens.next(TokenType.AS);
        tokens.next(TokenType.DOLLAR);
        boolean list = false;
        if (tokens.matches(TokenType.LBRACKET)) {
            tokens.next();
            list = true;
        }
        var varName = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "variable name"));
        if (list) {
            tokens.next(TokenType.RBRACKET);
        }
        var end = tokens.next(TokenType.SEMICOLON).span();
        return new ReifyStatement(function, varName, list, docstring, start.merge(end));
    }

    // <> type Name "=" type ";"
    private TypeStatement parseTypeStatement(Tokens tokens) {
        var start = tokens.next(TokenType.TYPE).span();
        var name = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "type name"));
        tokens.next(TokenType.EQUALS);
        var underlying = parseType(tokens);
        var end = tokens.next(TokenType.SEMICOLON).span();
        return new TypeStatement(name, underlying, start.merge(end));
    }

    // <> enum Name "=" variant ("|" variant)* ";"
    private EnumStatement parseEnumStatement(Tokens tokens) {
        var start = tokens.next(TokenType.ENUM).span();
        var name = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "enum name"));
        tokens.next(TokenType.EQUALS);
        List<VariantDecl> variants = new ArrayList<>();
        do {
            if (!variants.isEmpty()) {
                tokens.next(TokenType.PIPE);
            }
            var variantName = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "variant name"));
            VariantShape shape;
            if (tokens.matches(TokenType.LPAREN)) {
                tokens.next();
                List<TypeName> elements = new ArrayList<>();
                while (!tokens.matches(TokenType.RPAREN)) {
                    elements.add(parseType(tokens));
                    if (!tokens.matches(TokenType.RPAREN)) {
                        tokens.next(TokenType.COMMA);
                    }
                }
                tokens.next(TokenType.RPAREN);
                shape = elements.isEmpty() ? new UnitShape() : new TupleShape(elements);
            } else if (tokens.matches(TokenType.LBRACE)) {
                shape = new StructShape(parseFieldDecls(tokens));
            } else {
                shape = new UnitShape();
            }
            variants.add(new VariantDecl(variantName, shape));
        } while (tokens.matches(TokenType.PIPE));
        var end = tokens.next(TokenType.SEMICOLON).span();
        return new EnumStatement(name, variants, start.merge(end));
    }

    private List<FieldDecl> parseFieldDecls(Tokens tokens) {
        tokens.next(TokenType.LBRACE);
        List<FieldDecl> fields = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            var fieldName = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "field name"));
            tokens.next(TokenType.COLON, Kind.MISSING_TYPE, "':' and field type");
            fields.add(new FieldDecl(fieldName, parseType(tokens)));
            if (!tokens.matches(TokenType.RBRACE)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RBRACE);
        return fields;
    }

    TypeName parseType(Tokens tokens) {
        var token = tokens.peek();
        return switch (token.type()) {
            case IDENTIFIER -> {
                tokens.next();
                if (tokens.matches(TokenType.DOUBLE_COLON)) {
                    tokens.next();
                    var variant = tokens.next(TokenType.IDENTIFIER, Kind.MISSING_TYPE, "variant name");
                    yield new VariantTypeName(token.image(), variant.image(), token.span().merge(variant.span()));
                }
                yield new SimpleTypeName(token.image(), token.span());
            }
            case LBRACKET -> {
                tokens.next();
                var element = parseType(tokens);
                var end = tokens.next(TokenType.RBRACKET).span();
                yield new ListTypeName(element, token.span().merge(end));
            }
            case LPAREN -> {
                tokens.next();
                List<TypeName> elements = new ArrayList<>();
                elements.add(parseType(tokens));
                while (tokens.matches(TokenType.COMMA)) {
                    tokens.next();
                    elements.add(parseType(tokens));
                }
                var end = tokens.next(TokenType.RPAREN).span();
                yield elements.size() == 1 ? elements.get(0) : new TupleTypeName(elements, token.span().merge(end));
            }
            case LBRACE -> {
                var fields = parseFieldDecls(tokens);
                yield new StructTypeName(fields, token.span().merge(tokens.previous().span()));
            }
            default -> throw new ParsingException(Kind.MISSING_TYPE, token.span(), "expected a type but got '" + token.image() + "'");
        };
    }

    Expression parseExpression(Tokens tokens) {
        return parseOr(tokens);
    }

    private Expression parseOr(Tokens tokens) {
        var expr = parseAnd(tokens);

        while (tokens.matches(TokenType.OR)) {
            var operator = tokens.next().type();
            var right = parseAnd(tokens);
            expr = new BinaryExpression(expr, operator, right, expr.span().merge(right.span()));
        }
        return expr;
    }

    private Expression parseAnd(Tokens tokens) {
        var expr = parseNot(tokens);

        while (tokens.matches(TokenType.AND)) {
            var operator = tokens.next().type();
            var right = parseNot(tokens);
            expr = new BinaryExpression(expr, operator, right, expr.span().merge(right.span()));
        }
        return expr;
    }

    private Expression parseNot(Tokens tokens) {
        if (tokens.matches(TokenType.NOT)) {
            var token = tokens.next();
            var operand = parseNot(tokens);
            return new UnaryExpression(TokenType.NOT, operand, token.span().merge(operand.span()));
        }
        return parseComparison(tokens);
    }

    private Expression parseComparison(Tokens tokens) {
        var expr = parsePlus(tokens);

        while (tokens.matches(TokenType.EQUALS_EQUALS, TokenType.NOT_EQUALS, TokenType.LT, TokenType.GT,
                TokenType.LE, TokenType.GE, TokenType.CONSTRAINT_EQ, TokenType.CONSTRAINT_LE,
                TokenType.CONSTRAINT_GE, TokenType.IN)) {
            var operator = tokens.next().type();
            var right = parsePlus(tokens);
            expr = new BinaryExpression(expr, operator, right, expr.span().merge(right.span()));
        }
        return expr;
    }

    private Expression parsePlus(Tokens tokens) {
        var expr = parseTimes(tokens);

        while (tokens.matches(TokenType.PLUS, TokenType.MINUS)) {
            var operator = tokens.next().type();
            var right = parseTimes(tokens);
            expr = new BinaryExpression(expr, operator, right, expr.span().merge(right.span()));
        }
        return expr;
    }

    private Expression parseTimes(Tokens tokens) {
        var expr = parseUnary(tokens);

        while (tokens.matches(TokenType.STAR, TokenType.SLASH_SLASH, TokenType.PERCENT)) {
            var operator = tokens.next().type();
            var right = parseUnary(tokens);
            expr = new BinaryExpression(expr, operator, right, expr.span().merge(right.span()));
        }
        return expr;
    }

    private Expression parseUnary(Tokens tokens) {
        if (tokens.matches(TokenType.MINUS)) {
            var token = tokens.next();
            var operand = parseUnary(tokens);
            return new UnaryExpression(TokenType.MINUS, operand, token.span().merge(operand.span()));
        }
        return parsePostfix(tokens);
    }

    private Expression parsePostfix(Tokens tokens) {
        var expression = parseAtom(tokens);

        while (tokens.matches(TokenType.DOT, TokenType.AS)) {
            var postfixToken = tokens.next();
            expression = switch (postfixToken.type()) {
                case DOT -> {
                    var field = tokens.peek();
                    if (field.type() != TokenType.IDENTIFIER && field.type() != TokenType.NUMBER) {
                        throw new ParsingException(Kind.MISSING_NAME, field.span(), "expected a field name or tuple index");
                    }
                    tokens.next();
                    yield new FieldExpression(expression, spanned(field), expression.span().merge(field.span()));
                }
                case AS -> {
                    var type = parseType(tokens);
                    yield new AsExpression(expression, type, expression.span().merge(type.span()));
                }
                default -> throw Tokens.unexpected(postfixToken, "'.' or 'as'");
            };
        }

        return expression;
    }

    private Expression parseAtom(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case TRUE, FALSE -> {
                tokens.next();
                yield new BoolExpression(token.type() == TokenType.TRUE, token.span());
            }
            case NUMBER -> {
                tokens.next();
                yield new IntExpression(parseInt(token), token.span());
            }
            case STRING -> {
                tokens.next();
                yield new StringExpression(token.image(), token.span());
            }
            case IDENTIFIER -> parseNameExpression(tokens);
            case DOLLAR -> parseVarCall(tokens);
            case AT -> {
                tokens.next();
                tokens.next(TokenType.LBRACKET);
                var typeName = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_TYPE, "object type name"));
                var end = tokens.next(TokenType.RBRACKET).span();
                yield new GlobalListExpression(typeName, token.span().merge(end));
            }
            case LBRACKET -> parseListExpression(tokens);
            case PIPE -> {
                tokens.next();
                var collection = parseExpression(tokens);
                var end = tokens.next(TokenType.PIPE).span();
                yield new CardinalityExpression(collection, token.span().merge(end));
            }
            case LPAREN -> {
                tokens.next();
                var first = parseExpression(tokens);
                if (tokens.matches(TokenType.RPAREN)) {
                    tokens.next();
                    yield first;
                }
                List<Expression> elements = new ArrayList<>();
                elements.add(first);
                while (tokens.matches(TokenType.COMMA)) {
                    tokens.next();
                    elements.add(parseExpression(tokens));
                }
                var end = tokens.next(TokenType.RPAREN).span();
                yield new TupleExpression(elements, token.span().merge(end));
            }
            case LBRACE -> {
                var fields = parseFieldInits(tokens);
                yield new StructExpression(fields, token.span().merge(tokens.previous().span()));
            }
            case IF -> parseIfExpression(tokens);
            case LET -> parseLetExpression(tokens);
            case MATCH -> parseMatchExpression(tokens);
            case FORALL, SUM -> parseQuantifier(tokens);
            case FOLD -> parseFoldExpression(tokens);
            default -> throw new ParsingException(Kind.MISSING_EXPRESSION, token.span(),
                    "expected an expression but got " + (token.type() == TokenType.EOF ? "end of input" : "'" + token.image() + "'"));
        };
    }

    private static int parseInt(Token token) {
        try {
            return Integer.parseInt(token.image());
        } catch (NumberFormatException e) {
            throw new ParsingException(Kind.MALFORMED_INTEGER, token.span(), "integer literal " + token.image() + " is out of range");
        }
    }

    private Expression parseNameExpression(Tokens tokens) {
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        var name = spanned(nameToken);

        if (tokens.matches(TokenType.DOUBLE_COLON)) {
            tokens.next();
            var variant = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "variant name"));
            if (tokens.matches(TokenType.LPAREN)) {
                var arguments = parseArguments(tokens);
                return new VariantExpression(name, variant, Optional.of(arguments), nameToken.span().merge(tokens.previous().span()));
            }
            if (startsStructLiteral(tokens)) {
                var fields = parseFieldInits(tokens);
                return new VariantStructExpression(name, variant, fields, nameToken.span().merge(tokens.previous().span()));
            }
            return new VariantExpression(name, variant, Optional.empty(), nameToken.span().merge(variant.span()));
        }
        if (tokens.matches(TokenType.LPAREN)) {
            var arguments = parseArguments(tokens);
            return new CallExpression(name, arguments, nameToken.span().merge(tokens.previous().span()));
        }
        return new IdentExpression(nameToken.image(), nameToken.span());
    }

    // "{" "}" or "{" name ":" ..., anything else after a variant is a body block
    private static boolean startsStructLiteral(Tokens tokens) {
        if (!tokens.matches(TokenType.LBRACE)) {
            return false;
        }
        var second = tokens.peekAt(1);
        return second.type() == TokenType.RBRACE
                || (second.type() == TokenType.IDENTIFIER && tokens.peekAt(2).type() == TokenType.COLON);
    }

    private Expression parseVarCall(Tokens tokens) {
        var start = tokens.next(TokenType.DOLLAR).span();
        boolean list = false;
        if (tokens.matches(TokenType.LBRACKET)) {
            tokens.next();
            list = true;
        }
        var name = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "variable name"));
        if (list) {
            tokens.next(TokenType.RBRACKET);
        }
        var arguments = parseArguments(tokens);
        return new VarCallExpression(name, list, arguments, start.merge(tokens.previous().span()));
    }

    private List<Expression> parseArguments(Tokens tokens) {
        tokens.next(TokenType.LPAREN);
        List<Expression> arguments = new ArrayList<>();
        while (!tokens.matches(TokenType.RPAREN)) {
            arguments.add(parseExpression(tokens));
            if (!tokens.matches(TokenType.RPAREN)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RPAREN);
        return arguments;
    }

    private List<FieldInit> parseFieldInits(Tokens tokens) {
        tokens.next(TokenType.LBRACE);
        List<FieldInit> fields = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            var fieldName = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "field name"));
            tokens.next(TokenType.COLON);
            fields.add(new FieldInit(fieldName, parseExpression(tokens)));
            if (!tokens.matches(TokenType.RBRACE)) {
                tokens.next(TokenType.COMMA);
            }
        }
        tokens.next(TokenType.RBRACE);
        return fields;
    }

    // "[" "]" | "[" e ".." e "]" | "[" e "for" x "in" e ("," x "in" e)* ("where" e)? "]" | "[" e ("," e)* "]"
    private Expression parseListExpression(Tokens tokens) {
        var start = tokens.next(TokenType.LBRACKET).span();
        if (tokens.matches(TokenType.RBRACKET)) {
            var end = tokens.next().span();
            return new ListExpression(List.of(), start.merge(end));
        }
        var first = parseExpression(tokens);
        if (tokens.matches(TokenType.DOT_DOT)) {
            tokens.next();
            var last = parseExpression(tokens);
            var end = tokens.next(TokenType.RBRACKET).span();
            return new RangeExpression(first, last, start.merge(end));
        }
        if (tokens.matches(TokenType.FOR)) {
            tokens.next();
            List<Binding> bindings = new ArrayList<>();
            do {
                if (!bindings.isEmpty()) {
                    tokens.next(TokenType.COMMA);
                }
                var name = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "loop variable"));
                tokens.next(TokenType.IN);
                bindings.add(new Binding(name, parseExpression(tokens)));
            } while (tokens.matches(TokenType.COMMA));
            var filter = parseWhere(tokens);
            var end = tokens.next(TokenType.RBRACKET).span();
            return new ComprehensionExpression(first, bindings, filter, start.merge(end));
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (tokens.matches(TokenType.COMMA)) {
            tokens.next();
            elements.add(parseExpression(tokens));
        }
        var end = tokens.next(TokenType.RBRACKET).span();
        return new ListExpression(elements, start.merge(end));
    }

    private Optional<Expression> parseWhere(Tokens tokens) {
        if (tokens.matches(TokenType.WHERE)) {
            tokens.next();
            return Optional.of(parseExpression(tokens));
        }
        return Optional.empty();
    }

    private Expression parseBlock(Tokens tokens) {
        tokens.next(TokenType.LBRACE, Kind.MISSING_BODY, "'{'");
        if (tokens.matches(TokenType.RBRACE)) {
            throw new ParsingException(Kind.MISSING_BODY, tokens.peek().span(), "empty block");
        }
        var body = parseExpression(tokens);
        tokens.next(TokenType.RBRACE);
        return body;
    }

    // <> if cond { e } else { e }  |  if cond { e } else if ...
    private Expression parseIfExpression(Tokens tokens) {
        var start = tokens.next(TokenType.IF).span();
        var condition = parseExpression(tokens);
        var thenBranch = parseBlock(tokens);
        tokens.next(TokenType.ELSE, Kind.MISSING_BODY, "'else' branch");
        var elseBranch = tokens.matches(TokenType.IF) ? parseIfExpression(tokens) : parseBlock(tokens);
        return new IfExpression(condition, thenBranch, elseBranch, start.merge(tokens.previous().span()));
    }

    // <> let x = e { body }
    private Expression parseLetExpression(Tokens tokens) {
        var start = tokens.next(TokenType.LET).span();
        var name = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "binding name"));
        tokens.next(TokenType.EQUALS);
        var value = parseExpression(tokens);
        var body = parseBlock(tokens);
        return new LetExpression(name, value, body, start.merge(tokens.previous().span()));
    }

    // <> match e { x (as type)? (where e)? { body } ... }
    private Expression parseMatchExpression(Tokens tokens) {
        var start = tokens.next(TokenType.MATCH).span();
        var scrutinee = parseExpression(tokens);
        tokens.next(TokenType.LBRACE);
        List<MatchBranch> branches = new ArrayList<>();
        while (!tokens.matches(TokenType.RBRACE)) {
            var name = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "branch binding"));
            Optional<TypeName> type = Optional.empty();
            if (tokens.matches(TokenType.AS)) {
                tokens.next();
                type = Optional.of(parseType(tokens));
            }
            var filter = parseWhere(tokens);
            var body = parseBlock(tokens);
            branches.add(new MatchBranch(name, type, filter, body, name.span().merge(tokens.previous().span())));
        }
        if (branches.isEmpty()) {
            throw new ParsingException(Kind.MISSING_BODY, tokens.peek().span(), "match without branches");
        }
        var end = tokens.next(TokenType.RBRACE).span();
        return new MatchExpression(scrutinee, branches, start.merge(end));
    }

    // <> (forall|sum) x in e (where e)? { body }
    private Expression parseQuantifier(Tokens tokens) {
        var keyword = tokens.next();
        var var = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "loop variable"));
        tokens.next(TokenType.IN);
        var collection = parseExpression(tokens);
        var filter = parseWhere(tokens);
        var body = parseBlock(tokens);
        var span = keyword.span().merge(tokens.previous().span());
        if (keyword.type() == TokenType.FORALL) {
            return new ForallExpression(var, collection, filter, body, span);
        }
        return new SumExpression(var, collection, filter, body, span);
    }

    // <> fold x in e with acc = e (where e)? { body }
    private Expression parseFoldExpression(Tokens tokens) {
        var start = tokens.next(TokenType.FOLD).span();
        var var = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "loop variable"));
        tokens.next(TokenType.IN);
        var collection = parseExpression(tokens);
        tokens.next(TokenType.WITH);
        var accumulator = spanned(tokens.next(TokenType.IDENTIFIER, Kind.MISSING_NAME, "accumulator name"));
        tokens.next(TokenType.EQUALS);
        var init = parseExpression(tokens);
        var filter = parseWhere(tokens);
        var body = parseBlock(tokens);
        return new FoldExpression(var, collection, accumulator, init, filter, body, start.merge(tokens.previous().span()));
    }

    private static Spanned<String> spanned(Token token) {
        return new Spanned<>(token.image(), token.span());
    }
}
