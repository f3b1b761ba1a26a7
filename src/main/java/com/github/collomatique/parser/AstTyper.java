package com.github.collomatique.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import com.github.collomatique.Tokenizer.TokenType;
import com.github.collomatique.eval.TypeSchema;
import com.github.collomatique.parser.CompilationUnit.AsExpression;
import com.github.collomatique.parser.CompilationUnit.BinaryExpression;
import com.github.collomatique.parser.CompilationUnit.Binding;
import com.github.collomatique.parser.CompilationUnit.BoolExpression;
import com.github.collomatique.parser.CompilationUnit.CallExpression;
import com.github.collomatique.parser.CompilationUnit.CardinalityExpression;
import com.github.collomatique.parser.CompilationUnit.ComprehensionExpression;
import com.github.collomatique.parser.CompilationUnit.DocError;
import com.github.collomatique.parser.CompilationUnit.DocExpression;
import com.github.collomatique.parser.CompilationUnit.DocLine;
import com.github.collomatique.parser.CompilationUnit.DocPart;
import com.github.collomatique.parser.CompilationUnit.DocText;
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
import com.github.collomatique.parser.CompilationUnit.VarCallExpression;
import com.github.collomatique.parser.CompilationUnit.VariantDecl;
import com.github.collomatique.parser.CompilationUnit.VariantExpression;
import com.github.collomatique.parser.CompilationUnit.VariantStructExpression;
import com.github.collomatique.parser.CompilationUnit.VariantTypeName;
import com.github.collomatique.parser.SemanticError.Kind;
import com.github.collomatique.parser.TCompilationUnit.Conversion;
import com.github.collomatique.parser.TCompilationUnit.TBinaryExpression;
import com.github.collomatique.parser.TCompilationUnit.TBinding;
import com.github.collomatique.parser.TCompilationUnit.TBoolExpression;
import com.github.collomatique.parser.TCompilationUnit.TCallExpression;
import com.github.collomatique.parser.TCompilationUnit.TCardinalityExpression;
import com.github.collomatique.parser.TCompilationUnit.TCoerceExpression;
import com.github.collomatique.parser.TCompilationUnit.TComprehensionExpression;
import com.github.collomatique.parser.TCompilationUnit.TConvertExpression;
import com.github.collomatique.parser.TCompilationUnit.TCustomExpression;
import com.github.collomatique.parser.TCompilationUnit.TDocExpression;
import com.github.collomatique.parser.TCompilationUnit.TDocLine;
import com.github.collomatique.parser.TCompilationUnit.TDocPart;
import com.github.collomatique.parser.TCompilationUnit.TDocText;
import com.github.collomatique.parser.TCompilationUnit.TExpression;
import com.github.collomatique.parser.TCompilationUnit.TFieldExpression;
import com.github.collomatique.parser.TCompilationUnit.TFoldExpression;
import com.github.collomatique.parser.TCompilationUnit.TForallExpression;
import com.github.collomatique.parser.TCompilationUnit.TFunction;
import com.github.collomatique.parser.TCompilationUnit.TGlobalListExpression;
import com.github.collomatique.parser.TCompilationUnit.TIfExpression;
import com.github.collomatique.parser.TCompilationUnit.TIntExpression;
import com.github.collomatique.parser.TCompilationUnit.TLetExpression;
import com.github.collomatique.parser.TCompilationUnit.TListExpression;
import com.github.collomatique.parser.TCompilationUnit.TLocalExpression;
import com.github.collomatique.parser.TCompilationUnit.TMatchBranch;
import com.github.collomatique.parser.TCompilationUnit.TMatchExpression;
import com.github.collomatique.parser.TCompilationUnit.TParam;
import com.github.collomatique.parser.TCompilationUnit.TRangeExpression;
import com.github.collomatique.parser.TCompilationUnit.TReification;
import com.github.collomatique.parser.TCompilationUnit.TStringExpression;
import com.github.collomatique.parser.TCompilationUnit.TStructExpression;
import com.github.collomatique.parser.TCompilationUnit.TSumExpression;
import com.github.collomatique.parser.TCompilationUnit.TTupleExpression;
import com.github.collomatique.parser.TCompilationUnit.TTupleIndexExpression;
import com.github.collomatique.parser.TCompilationUnit.TUnaryExpression;
import com.github.collomatique.parser.TCompilationUnit.TUnwrapExpression;
import com.github.collomatique.parser.TCompilationUnit.TVarCallExpression;
import com.github.collomatique.parser.TCompilationUnit.TVariantExpression;

import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Resolves names and types of a parsed script. Errors are collected for the whole script and
 * thrown together as a {@link SemanticException}; warnings never stop the check.
 */
public class AstTyper {

    private static final Pattern SNAKE_CASE = Pattern.compile("_*[a-z][a-z0-9_]*");
    private static final Pattern PASCAL_CASE = Pattern.compile("[A-Z][A-Za-z0-9]*");

    private final Map<String, List<Type>> externVars;
    private final TypeRegistry types;
    private final FunctionRegistry functionRegistry = new FunctionRegistry();
    private final Map<String, ReifiedVar> reifiedVars = new LinkedHashMap<>();
    private final Set<String> usedFunctions = new HashSet<>();

    private final List<SemanticError> errors = new ArrayList<>();
    private final List<SemanticWarning> warnings = new ArrayList<>();

    public AstTyper(TypeSchema schema, Map<String, List<Type>> externVars) {
        this.types = new TypeRegistry(schema);
        this.externVars = externVars;
    }

    public List<SemanticWarning> warnings() {
        return List.copyOf(warnings);
    }

    public TCompilationUnit typeCompilationUnit(CompilationUnit cu) {
        collectTypes(cu.statements());
        collectFunctions(cu.statements());

        Map<String, TFunction> functions = new LinkedHashMap<>();
        List<TReification> reifications = new ArrayList<>();
        for (var statement : cu.statements()) {
            if (statement instanceof LetStatement ls) {
                var function = functionRegistry.lookup(ls.name().value());
                // duplicates were reported while collecting
                if (function.isPresent() && function.get().declaration() == ls) {
                    functions.put(ls.name().value(), typeFunction(function.get()));
                }
            } else if (statement instanceof ReifyStatement rs) {
                typeReification(rs).ifPresent(reifications::add);
            }
        }

        for (var function : functionRegistry.map.values()) {
            if (!function.pub() && !usedFunctions.contains(function.name())) {
                warn(SemanticWarning.Kind.UNUSED_FUNCTION, function.declaration().name().span(),
                        "function " + function.name() + " is neither public, called nor reified");
            }
        }

        if (!errors.isEmpty()) {
            throw new SemanticException(errors, warnings);
        }
        return new TCompilationUnit(functions, reifications, types);
    }

    // types

    private void collectTypes(List<Statement> statements) {
        Map<String, Statement> declared = new LinkedHashMap<>();
        for (var statement : statements) {
            Spanned<String> name;
            if (statement instanceof TypeStatement ts) {
                name = ts.name();
            } else if (statement instanceof EnumStatement es) {
                name = es.name();
            } else {
                continue;
            }
            if (types.isDefined(name.value())) {
                error(Kind.TYPE_ALREADY_DEFINED, name.span(), "type " + name.value() + " is already defined");
                continue;
            }
            checkPascalCase(name, "type");
            if (statement instanceof TypeStatement) {
                types.declareCustom(name.value());
            } else {
                types.declareEnum(name.value());
            }
            declared.put(name.value(), statement);
        }

        for (var statement : declared.values()) {
            if (statement instanceof TypeStatement ts) {
                types.defineCustom(ts.name().value(), resolveType(ts.underlying()));
            } else if (statement instanceof EnumStatement es) {
                for (var variant : es.variants()) {
                    defineVariant(es.name().value(), variant);
                }
            }
        }
        for (var statement : declared.values()) {
            if (statement instanceof TypeStatement ts) {
                checkVariantTypes(types.underlying(ts.name().value()), ts.underlying().span());
            }
        }
    }

    private void defineVariant(String enumName, VariantDecl variant) {
        var name = variant.name();
        if (types.hasVariant(enumName, name.value())) {
            error(Kind.TYPE_ALREADY_DEFINED, name.span(), "variant " + enumName + "::" + name.value() + " is already defined");
            return;
        }
        checkPascalCase(name, "variant");
        Optional<Type> payload = Optional.empty();
        if (variant.shape() instanceof TupleShape ts) {
            var elements = ts.elements().stream().map(this::resolveType).toList();
            payload = Optional.of(elements.size() == 1 ? elements.get(0) : new Type.TupleType(elements));
        } else if (variant.shape() instanceof StructShape ss) {
            payload = Optional.of(resolveStruct(ss.fields()));
        }
        types.defineVariant(enumName, name.value(), payload);
    }

    Type resolveType(TypeName typeName) {
        if (typeName instanceof SimpleTypeName stn) {
            var type = types.lookup(stn.name());
            if (type.isEmpty()) {
                error(Kind.UNKNOWN_TYPE, stn.span(), "unknown type " + stn.name());
                return new Type.Unknown();
            }
            return type.get();
        } else if (typeName instanceof VariantTypeName vtn) {
            if (!types.isEnum(vtn.enumName())) {
                error(Kind.UNKNOWN_TYPE, vtn.span(), "unknown enum " + vtn.enumName());
                return new Type.Unknown();
            }
            // variants of enums declared later in the script are defined in a second pass
            return new Type.VariantType(vtn.enumName(), vtn.variant());
        } else if (typeName instanceof ListTypeName ltn) {
            return Type.listOf(resolveType(ltn.element()));
        } else if (typeName instanceof TupleTypeName ttn) {
            return new Type.TupleType(ttn.elements().stream().map(this::resolveType).toList());
        } else if (typeName instanceof StructTypeName sttn) {
            return resolveStruct(sttn.fields());
        }
        throw new IllegalStateException("unsupported type name " + typeName);
    }

    private Type resolveStruct(List<FieldDecl> fieldDecls) {
        var fields = new TreeMap<String, Type>();
        for (var field : fieldDecls) {
            if (fields.containsKey(field.name().value())) {
                error(Kind.TYPE_ALREADY_DEFINED, field.name().span(), "field " + field.name().value() + " is declared twice");
            }
            fields.put(field.name().value(), resolveType(field.type()));
        }
        return new Type.StructType(fields);
    }

    private void checkVariantTypes(Type type, Span span) {
        if (type instanceof Type.VariantType vt && !types.hasVariant(vt.enumName(), vt.variant())) {
            error(Kind.UNKNOWN_VARIANT, span, "unknown variant " + vt);
        } else if (type instanceof Type.ListType lt) {
            checkVariantTypes(lt.element(), span);
        } else if (type instanceof Type.TupleType tt) {
            tt.elements().forEach(e -> checkVariantTypes(e, span));
        } else if (type instanceof Type.StructType st) {
            st.fields().values().forEach(e -> checkVariantTypes(e, span));
        }
    }

    // functions

    private void collectFunctions(List<Statement> statements) {
        for (var statement : statements) {
            if (statement instanceof LetStatement ls) {
                functionRegistry.registerFunction(ls);
            }
        }
    }

    private TFunction typeFunction(FunctionRegistry.Function function) {
        var ls = function.declaration();
        var functionScope = Scope.root();
        for (var param : function.params()) {
            functionScope.put(param.name(), param.type(), spanOfParam(ls, param.name()));
        }

        var docstring = typeDocstring(ls.docstring(), functionScope);
        var body = typeExpression(ls.body(), functionScope);
        if (!Type.canCoerce(body.type(), function.returnType())) {
            error(Kind.BODY_TYPE_MISMATCH, ls.body().span(), "function " + function.name() + " returns "
                    + function.returnType() + " but its body has type " + body.type());
        } else {
            body = coerced(body, function.returnType());
        }
        reportUnused(functionScope);

        return new TFunction(function.name(), function.pub(), function.params(), function.returnType(),
                body, docstring, ls.span());
    }

    private static Span spanOfParam(LetStatement ls, String name) {
        return ls.params().stream()
                .filter(p -> p.name().value().equals(name))
                .findFirst()
                .map(p -> p.name().span())
                .orElse(ls.span());
    }

    private Optional<TReification> typeReification(ReifyStatement rs) {
        var functionName = rs.function().value();
        var varName = rs.varName();
        var function = functionRegistry.lookup(functionName);
        if (function.isEmpty()) {
            error(Kind.UNKNOWN_FUNCTION, rs.function().span(), "cannot reify unknown function " + functionName);
            return Optional.empty();
        }
        usedFunctions.add(functionName);

        var expected = rs.list() ? Type.listOf(Type.CONSTRAINT) : Type.CONSTRAINT;
        if (!function.get().returnType().equals(expected)) {
            error(Kind.REIFY_TARGET_MISMATCH, rs.function().span(), "function " + functionName + " returns "
                    + function.get().returnType() + " but " + (rs.list() ? "$[" + varName.value() + "]" : "$" + varName.value())
                    + " needs " + expected);
            return Optional.empty();
        }
        if (reifiedVars.containsKey(varName.value()) || externVars.containsKey(varName.value())) {
            error(Kind.VARIABLE_ALREADY_DEFINED, varName.span(), "variable " + varName.value() + " is already defined");
            return Optional.empty();
        }
        checkPascalCase(varName, "reified variable");

        var paramTypes = function.get().params().stream().map(TParam::type).toList();
        reifiedVars.put(varName.value(), new ReifiedVar(varName.value(), rs.list(), paramTypes));

        var docScope = Scope.root();
        function.get().params().forEach(p -> docScope.put(p.name(), p.type(), rs.span()));
        var docstring = typeDocstring(rs.docstring(), docScope);
        return Optional.of(new TReification(functionName, varName.value(), rs.list(), paramTypes, docstring, rs.span()));
    }

    private List<TDocLine> typeDocstring(List<DocLine> lines, Scope scope) {
        List<TDocLine> result = new ArrayList<>();
        for (var line : lines) {
            List<TDocPart> parts = new ArrayList<>();
            for (DocPart part : line.parts()) {
                if (part instanceof DocText dt) {
                    parts.add(new TDocText(dt.text()));
                } else if (part instanceof DocExpression de) {
                    parts.add(new TDocExpression(typeExpression(de.expression(), scope)));
                } else if (part instanceof DocError err) {
                    error(Kind.DOCSTRING_EXPRESSION, err.error().span(), err.error().getMessage());
                }
            }
            result.add(new TDocLine(parts));
        }
        return result;
    }

    // expressions

    TExpression typeExpression(Expression expression, Scope scope) {
        if (expression instanceof IntExpression ie) {
            return new TIntExpression(ie.value(), ie.span());
        } else if (expression instanceof BoolExpression be) {
            return new TBoolExpression(be.value(), be.span());
        } else if (expression instanceof StringExpression se) {
            return new TStringExpression(se.value(), se.span());
        } else if (expression instanceof IdentExpression ie) {
            var local = scope.lookup(ie.name());
            if (local.isEmpty()) {
                return invalid(Kind.UNKNOWN_IDENTIFIER, ie.span(), "unknown identifier " + ie.name());
            }
            local.get().used = true;
            return new TLocalExpression(ie.name(), local.get().type, ie.span());
        } else if (expression instanceof CallExpression ce) {
            return typeCall(ce, scope);
        } else if (expression instanceof VariantExpression ve) {
            return typeVariant(ve, scope);
        } else if (expression instanceof VariantStructExpression vse) {
            return typeVariantStruct(vse, scope);
        } else if (expression instanceof VarCallExpression vce) {
            return typeVarCall(vce, scope);
        } else if (expression instanceof GlobalListExpression gle) {
            var typeName = gle.typeName();
            if (!types.schema().hasType(typeName.value())) {
                return invalid(Kind.UNKNOWN_TYPE, typeName.span(), "unknown object type " + typeName.value());
            }
            return new TGlobalListExpression(typeName.value(), Type.listOf(new Type.ObjectType(typeName.value())), gle.span());
        } else if (expression instanceof ListExpression le) {
            return typeList(le, scope);
        } else if (expression instanceof RangeExpression re) {
            var start = expect(typeExpression(re.start(), scope), Type.INT, "range start");
            var end = expect(typeExpression(re.end(), scope), Type.INT, "range end");
            return new TRangeExpression(start, end, re.span());
        } else if (expression instanceof ComprehensionExpression ce) {
            return typeComprehension(ce, scope);
        } else if (expression instanceof CardinalityExpression ce) {
            var collection = typeExpression(ce.collection(), scope);
            if (!Type.isList(collection.type()) && !(collection.type() instanceof Type.Unknown)) {
                error(Kind.TYPE_MISMATCH, ce.collection().span(), "cardinality needs a list but found " + collection.type());
            }
            return new TCardinalityExpression(collection, ce.span());
        } else if (expression instanceof TupleExpression te) {
            var elements = te.elements().stream().map(e -> typeExpression(e, scope)).toList();
            return new TTupleExpression(elements, new Type.TupleType(elements.stream().map(TExpression::type).toList()), te.span());
        } else if (expression instanceof StructExpression se) {
            return typeStruct(se.fields(), se.span(), scope);
        } else if (expression instanceof FieldExpression fe) {
            return typeField(typeExpression(fe.target(), scope), fe.field(), fe.span());
        } else if (expression instanceof AsExpression ae) {
            var value = typeExpression(ae.expression(), scope);
            var target = resolveType(ae.type());
            checkVariantTypes(target, ae.type().span());
            return expect(value, target, "type annotation");
        } else if (expression instanceof UnaryExpression ue) {
            return typeUnary(ue, scope);
        } else if (expression instanceof BinaryExpression be) {
            return typeBinary(be, scope);
        } else if (expression instanceof IfExpression ie) {
            var condition = expect(typeExpression(ie.condition(), scope), Type.BOOL, "if condition");
            var thenBranch = typeExpression(ie.thenBranch(), scope);
            var elseBranch = typeExpression(ie.elseBranch(), scope);
            var type = unifyOrReport(thenBranch.type(), elseBranch.type(), ie.span(), "if branches");
            return new TIfExpression(condition, coerced(thenBranch, type), coerced(elseBranch, type), type, ie.span());
        } else if (expression instanceof LetExpression le) {
            var value = typeExpression(le.value(), scope);
            var letScope = scope.newScope();
            bind(letScope, le.name(), value.type());
            var body = typeExpression(le.body(), letScope);
            reportUnused(letScope);
            return new TLetExpression(le.name().value(), value, body, body.type(), le.span());
        } else if (expression instanceof MatchExpression me) {
            return typeMatch(me, scope);
        } else if (expression instanceof ForallExpression fe) {
            return typeForall(fe, scope);
        } else if (expression instanceof SumExpression se) {
            return typeSum(se, scope);
        } else if (expression instanceof FoldExpression fe) {
            return typeFold(fe, scope);
        }
        throw new IllegalStateException("unsupported expression " + expression);
    }

    private TExpression typeCall(CallExpression ce, Scope scope) {
        var name = ce.name().value();
        var arguments = ce.arguments().stream().map(a -> typeExpression(a, scope)).toList();

        var function = functionRegistry.lookup(name);
        if (function.isPresent()) {
            usedFunctions.add(name);
            var params = function.get().params();
            if (params.size() != arguments.size()) {
                return invalid(Kind.ARGUMENT_COUNT_MISMATCH, ce.span(), "function " + name + " takes "
                        + params.size() + " argument(s) but got " + arguments.size());
            }
            List<TExpression> coercedArguments = new ArrayList<>();
            for (int i = 0; i < params.size(); i++) {
                coercedArguments.add(expect(arguments.get(i), params.get(i).type(),
                        "argument " + params.get(i).name() + " of " + name));
            }
            return new TCallExpression(name, coercedArguments, function.get().returnType(), ce.span());
        }

        var primitive = Type.Primitive.byName(name);
        if (primitive.isPresent()) {
            if (arguments.size() != 1) {
                return invalid(Kind.ARGUMENT_COUNT_MISMATCH, ce.span(), "conversion " + name + " takes one argument");
            }
            return typeConversion(primitive.get(), arguments.get(0), ce.span());
        }

        if (types.isCustom(name)) {
            var underlying = types.underlying(name);
            TExpression value;
            if (arguments.size() == 1) {
                value = expect(arguments.get(0), underlying, "construction of " + name);
            } else if (underlying instanceof Type.TupleType tt && tt.elements().size() == arguments.size()) {
                var elements = arguments;
                var tuple = new TTupleExpression(elements, new Type.TupleType(elements.stream().map(TExpression::type).toList()), ce.span());
                value = expect(tuple, underlying, "construction of " + name);
            } else {
                return invalid(Kind.ARGUMENT_COUNT_MISMATCH, ce.span(), "type " + name + " is built from one " + underlying);
            }
            return new TCustomExpression(name, value, new Type.CustomType(name), ce.span());
        }

        return invalid(Kind.UNKNOWN_FUNCTION, ce.name().span(), "unknown function " + name);
    }

    private TExpression typeConversion(Type.Primitive target, TExpression argument, Span span) {
        var inner = unwrappedType(argument.type());
        if (inner.isPresent() && Type.canCoerce(inner.get(), target)) {
            return coerced(new TUnwrapExpression(argument, inner.get(), span), target);
        }
        if (target == Type.Primitive.STRING && !Type.canCoerce(argument.type(), Type.STRING)) {
            return new TConvertExpression(Conversion.TO_STRING, argument, Type.STRING, span);
        }
        if (target == Type.Primitive.LIN_EXPR && argument.type() == Type.INT) {
            return new TConvertExpression(Conversion.TO_LIN_EXPR, argument, Type.LIN_EXPR, span);
        }
        return expect(argument, target, "conversion to " + target);
    }

    /** Payload type of a custom value or single-payload variant. */
    private Optional<Type> unwrappedType(Type type) {
        if (type instanceof Type.CustomType ct && types.isCustom(ct.name())) {
            return Optional.of(types.underlying(ct.name()));
        }
        if (type instanceof Type.VariantType vt && types.hasVariant(vt.enumName(), vt.variant())) {
            return types.payload(vt.enumName(), vt.variant());
        }
        return Optional.empty();
    }

    private TExpression typeVariant(VariantExpression ve, Scope scope) {
        var enumName = ve.enumName().value();
        var variant = ve.variant().value();
        if (!types.isEnum(enumName)) {
            return invalid(Kind.UNKNOWN_TYPE, ve.enumName().span(), "unknown enum " + enumName);
        }
        if (!types.hasVariant(enumName, variant)) {
            return invalid(Kind.UNKNOWN_VARIANT, ve.variant().span(), "unknown variant " + enumName + "::" + variant);
        }
        var type = new Type.VariantType(enumName, variant);
        var payload = types.payload(enumName, variant);
        var arguments = ve.arguments().orElse(List.of()).stream().map(a -> typeExpression(a, scope)).toList();

        if (payload.isEmpty()) {
            if (!arguments.isEmpty()) {
                return invalid(Kind.ARGUMENT_COUNT_MISMATCH, ve.span(), type + " takes no payload");
            }
            return new TVariantExpression(enumName, variant, Optional.empty(), type, ve.span());
        }
        if (payload.get() instanceof Type.StructType) {
            return invalid(Kind.TYPE_MISMATCH, ve.span(), type + " is built with named fields");
        }
        if (arguments.size() == 1) {
            var value = expect(arguments.get(0), payload.get(), "payload of " + type);
            return new TVariantExpression(enumName, variant, Optional.of(value), type, ve.span());
        }
        if (payload.get() instanceof Type.TupleType tt && tt.elements().size() == arguments.size()) {
            var tuple = new TTupleExpression(arguments, new Type.TupleType(arguments.stream().map(TExpression::type).toList()), ve.span());
            return new TVariantExpression(enumName, variant, Optional.of(expect(tuple, tt, "payload of " + type)), type, ve.span());
        }
        return invalid(Kind.ARGUMENT_COUNT_MISMATCH, ve.span(), type + " takes a payload of type " + payload.get());
    }

    private TExpression typeVariantStruct(VariantStructExpression vse, Scope scope) {
        var enumName = vse.enumName().value();
        var variant = vse.variant().value();
        if (!types.isEnum(enumName)) {
            return invalid(Kind.UNKNOWN_TYPE, vse.enumName().span(), "unknown enum " + enumName);
        }
        if (!types.hasVariant(enumName, variant)) {
            return invalid(Kind.UNKNOWN_VARIANT, vse.variant().span(), "unknown variant " + enumName + "::" + variant);
        }
        var type = new Type.VariantType(enumName, variant);
        var payload = types.payload(enumName, variant);
        if (payload.isEmpty() || !(payload.get() instanceof Type.StructType st)) {
            return invalid(Kind.TYPE_MISMATCH, vse.span(), type + " has no named fields");
        }
        var struct = typeStruct(vse.fields(), vse.span(), scope);
        for (var field : st.fields().keySet()) {
            if (!((Type.StructType) struct.type()).fields().containsKey(field)) {
                error(Kind.TYPE_MISMATCH, vse.span(), "missing field " + field + " of " + type);
            }
        }
        for (var field : vse.fields()) {
            if (!st.fields().containsKey(field.name().value())) {
                error(Kind.UNKNOWN_FIELD, field.name().span(), type + " has no field " + field.name().value());
            }
        }
        if (!Type.canCoerce(struct.type(), st)) {
            error(Kind.TYPE_MISMATCH, vse.span(), "expected " + st + " but found " + struct.type() + " in payload of " + type);
            return new TVariantExpression(enumName, variant, Optional.of(struct), type, vse.span());
        }
        return new TVariantExpression(enumName, variant, Optional.of(coerced(struct, st)), type, vse.span());
    }

    private TExpression typeVarCall(VarCallExpression vce, Scope scope) {
        var name = vce.name().value();
        var arguments = vce.arguments().stream().map(a -> typeExpression(a, scope)).toList();

        List<Type> paramTypes;
        boolean script;
        var reified = reifiedVars.get(name);
        if (reified != null && reified.list() == vce.list()) {
            paramTypes = reified.paramTypes();
            script = true;
        } else if (!vce.list() && reified == null && externVars.containsKey(name)) {
            paramTypes = externVars.get(name);
            script = false;
        } else if (reified != null) {
            return invalid(Kind.UNKNOWN_VARIABLE, vce.name().span(), reified.list()
                    ? "variable list " + name + " must be used as $[" + name + "]"
                    : "variable " + name + " is not a list, use $" + name);
        } else {
            return invalid(Kind.UNKNOWN_VARIABLE, vce.name().span(), "unknown variable " + name);
        }

        if (paramTypes.size() != arguments.size()) {
            return invalid(Kind.ARGUMENT_COUNT_MISMATCH, vce.span(), "variable " + name + " takes "
                    + paramTypes.size() + " argument(s) but got " + arguments.size());
        }
        List<TExpression> coercedArguments = new ArrayList<>();
        for (int i = 0; i < paramTypes.size(); i++) {
            coercedArguments.add(expect(arguments.get(i), paramTypes.get(i), "argument " + i + " of $" + name));
        }
        var type = vce.list() ? Type.listOf(Type.LIN_EXPR) : Type.LIN_EXPR;
        return new TVarCallExpression(name, vce.list(), script, coercedArguments, type, vce.span());
    }

    private TExpression typeList(ListExpression le, Scope scope) {
        if (le.elements().isEmpty()) {
            return new TListExpression(List.of(), new Type.EmptyList(), le.span());
        }
        var elements = le.elements().stream().map(e -> typeExpression(e, scope)).toList();
        Type elementType = elements.get(0).type();
        for (var element : elements.subList(1, elements.size())) {
            var unified = Type.unify(elementType, element.type());
            if (unified.isEmpty()) {
                error(Kind.TYPE_MISMATCH, element.span(), "list elements of type " + elementType + " and " + element.type() + " cannot be mixed");
                return new TListExpression(elements, Type.listOf(new Type.Unknown()), le.span());
            }
            elementType = unified.get();
        }
        var finalType = elementType;
        return new TListExpression(elements.stream().map(e -> coerced(e, finalType)).toList(), Type.listOf(elementType), le.span());
    }

    private TExpression typeComprehension(ComprehensionExpression ce, Scope scope) {
        var comprehensionScope = scope.newScope();
        List<TBinding> bindings = new ArrayList<>();
        for (Binding binding : ce.bindings()) {
            var collection = typeExpression(binding.collection(), comprehensionScope);
            var elementType = elementType(collection, "comprehension");
            bind(comprehensionScope, binding.name(), elementType);
            bindings.add(new TBinding(binding.name().value(), collection));
        }
        var filter = ce.filter().map(f -> expect(typeExpression(f, comprehensionScope), Type.BOOL, "where clause"));
        var body = typeExpression(ce.body(), comprehensionScope);
        reportUnused(comprehensionScope);
        return new TComprehensionExpression(body, bindings, filter, Type.listOf(body.type()), ce.span());
    }

    private Type elementType(TExpression collection, String context) {
        if (collection.type() instanceof Type.ListType lt) {
            return lt.element();
        }
        if (!(collection.type() instanceof Type.Unknown)) {
            error(Kind.TYPE_MISMATCH, collection.span(), context + " needs a typed list but found " + collection.type());
        }
        return new Type.Unknown();
    }

    private TStructExpression typeStruct(List<FieldInit> fieldInits, Span span, Scope scope) {
        var fields = new TreeMap<String, TExpression>();
        var fieldTypes = new TreeMap<String, Type>();
        for (var field : fieldInits) {
            var name = field.name().value();
            if (fields.containsKey(name)) {
                error(Kind.TYPE_MISMATCH, field.name().span(), "field " + name + " is given twice");
            }
            var value = typeExpression(field.value(), scope);
            fields.put(name, value);
            fieldTypes.put(name, value.type());
        }
        return new TStructExpression(fields, new Type.StructType(fieldTypes), span);
    }

    private TExpression typeField(TExpression target, Spanned<String> field, Span span) {
        var type = target.type();
        if (type instanceof Type.Unknown) {
            return target;
        }
        // look through custom types and variant payloads
        if (type instanceof Type.CustomType || type instanceof Type.VariantType) {
            var inner = unwrappedType(type);
            if (inner.isPresent() && types.hasFields(inner.get())) {
                return typeField(new TUnwrapExpression(target, inner.get(), target.span()), field, span);
            }
        }
        if (!types.hasFields(type)) {
            return invalid(Kind.FIELD_ACCESS_ON_NON_OBJECT, field.span(), "value of type " + type + " has no fields");
        }
        var fieldType = types.fieldType(type, field.value());
        if (fieldType.isEmpty()) {
            return invalid(Kind.UNKNOWN_FIELD, field.span(), type + " has no field " + field.value());
        }
        if (type instanceof Type.TupleType) {
            return new TTupleIndexExpression(target, Integer.parseInt(field.value()), fieldType.get(), span);
        }
        return new TFieldExpression(target, field.value(), fieldType.get(), span);
    }

    private TExpression typeUnary(UnaryExpression ue, Scope scope) {
        var operand = typeExpression(ue.operand(), scope);
        if (ue.operator() == TokenType.NOT) {
            return new TUnaryExpression(TokenType.NOT, expect(operand, Type.BOOL, "not"), Type.BOOL, ue.span());
        }
        if (!Type.isNumeric(operand.type()) && !(operand.type() instanceof Type.Unknown)) {
            return invalid(Kind.TYPE_MISMATCH, ue.span(), "cannot negate a value of type " + operand.type());
        }
        return new TUnaryExpression(TokenType.MINUS, operand, operand.type(), ue.span());
    }

    private TExpression typeBinary(BinaryExpression be, Scope scope) {
        var left = typeExpression(be.left(), scope);
        var right = typeExpression(be.right(), scope);
        var operator = be.operator();
        var lt = left.type();
        var rt = right.type();
        if (lt instanceof Type.Unknown || rt instanceof Type.Unknown) {
            return new TBinaryExpression(left, operator, right, new Type.Unknown(), be.span());
        }

        switch (operator) {
            case PLUS, MINUS -> {
                if (lt == Type.INT && rt == Type.INT) {
                    return new TBinaryExpression(left, operator, right, Type.INT, be.span());
                }
                if (Type.isNumeric(lt) && Type.isNumeric(rt)) {
                    return new TBinaryExpression(coerced(left, Type.LIN_EXPR), operator, coerced(right, Type.LIN_EXPR), Type.LIN_EXPR, be.span());
                }
                if (operator == TokenType.PLUS && lt == Type.STRING && rt == Type.STRING) {
                    return new TBinaryExpression(left, operator, right, Type.STRING, be.span());
                }
                if (Type.isList(lt) && Type.isList(rt)) {
                    var type = unifyOrReport(lt, rt, be.span(), "list " + (operator == TokenType.PLUS ? "union" : "difference"));
                    return new TBinaryExpression(coerced(left, type), operator, coerced(right, type), type, be.span());
                }
            }
            case STAR -> {
                if (lt == Type.INT && rt == Type.INT) {
                    return new TBinaryExpression(left, operator, right, Type.INT, be.span());
                }
                if (lt == Type.LIN_EXPR && rt == Type.LIN_EXPR) {
                    return invalid(Kind.NON_LINEAR_PRODUCT, be.span(), "product of two linear expressions is not linear");
                }
                if (Type.isNumeric(lt) && Type.isNumeric(rt)) {
                    return new TBinaryExpression(coerced(left, Type.LIN_EXPR), operator, coerced(right, Type.LIN_EXPR), Type.LIN_EXPR, be.span());
                }
            }
            case SLASH_SLASH, PERCENT -> {
                if (lt == Type.INT && rt == Type.INT) {
                    return new TBinaryExpression(left, operator, right, Type.INT, be.span());
                }
            }
            case EQUALS_EQUALS, NOT_EQUALS -> {
                var type = Type.unify(lt, rt);
                if (type.isPresent()) {
                    return new TBinaryExpression(coerced(left, type.get()), operator, coerced(right, type.get()), Type.BOOL, be.span());
                }
            }
            case LT, LE, GT, GE -> {
                if (lt == Type.INT && rt == Type.INT) {
                    return new TBinaryExpression(left, operator, right, Type.BOOL, be.span());
                }
            }
            case CONSTRAINT_EQ, CONSTRAINT_LE, CONSTRAINT_GE -> {
                if (Type.isNumeric(lt) && Type.isNumeric(rt)) {
                    return new TBinaryExpression(coerced(left, Type.LIN_EXPR), operator, coerced(right, Type.LIN_EXPR), Type.CONSTRAINT, be.span());
                }
            }
            case IN -> {
                if (rt instanceof Type.EmptyList) {
                    return new TBinaryExpression(left, operator, right, Type.BOOL, be.span());
                }
                if (rt instanceof Type.ListType list && Type.canCoerce(lt, list.element())) {
                    return new TBinaryExpression(coerced(left, list.element()), operator, right, Type.BOOL, be.span());
                }
            }
            case AND -> {
                if ((lt == Type.BOOL && rt == Type.BOOL) || (lt == Type.CONSTRAINT && rt == Type.CONSTRAINT)) {
                    return new TBinaryExpression(left, operator, right, lt, be.span());
                }
            }
            case OR -> {
                if (lt == Type.BOOL && rt == Type.BOOL) {
                    return new TBinaryExpression(left, operator, right, Type.BOOL, be.span());
                }
            }
            default -> throw new IllegalStateException("unsupported operator " + operator);
        }
        return invalid(Kind.TYPE_MISMATCH, be.span(), "operator " + operator.describe() + " cannot combine " + lt + " and " + rt);
    }

    private TExpression typeMatch(MatchExpression me, Scope scope) {
        var scrutinee = typeExpression(me.scrutinee(), scope);
        var scrutineeType = scrutinee.type();

        List<TMatchBranch> branches = new ArrayList<>();
        Set<String> coveredVariants = new HashSet<>();
        boolean catchAll = false;
        Type resultType = null;
        for (MatchBranch branch : me.branches()) {
            Optional<Type> test = Optional.empty();
            Type bindingType = scrutineeType;
            if (branch.type().isPresent()) {
                var branchType = resolveType(branch.type().get());
                checkVariantTypes(branchType, branch.type().get().span());
                if (!branchType.equals(scrutineeType)) {
                    if (branchType instanceof Type.VariantType vt && scrutineeType instanceof Type.EnumType et
                            && vt.enumName().equals(et.name())) {
                        test = Optional.of(branchType);
                    } else if (!(branchType instanceof Type.Unknown) && !(scrutineeType instanceof Type.Unknown)) {
                        error(Kind.TYPE_MISMATCH, branch.type().get().span(), "branch type " + branchType
                                + " is not a variant of " + scrutineeType);
                    }
                }
                bindingType = branchType;
            }

            var branchScope = scope.newScope();
            bind(branchScope, branch.name(), bindingType);
            var filter = branch.filter().map(f -> expect(typeExpression(f, branchScope), Type.BOOL, "where clause"));
            var body = typeExpression(branch.body(), branchScope);
            reportUnused(branchScope);

            if (filter.isEmpty()) {
                if (test.isEmpty()) {
                    catchAll = true;
                } else {
                    coveredVariants.add(((Type.VariantType) test.get()).variant());
                }
            }
            if (resultType == null) {
                resultType = body.type();
            } else {
                resultType = unifyOrReport(resultType, body.type(), branch.span(), "match branches");
            }
            var binding = branch.name().value().equals("_") ? Optional.<String>empty() : Optional.of(branch.name().value());
            branches.add(new TMatchBranch(binding, test, filter, body));
        }

        boolean exhaustive = catchAll || (scrutineeType instanceof Type.EnumType et
                && coveredVariants.containsAll(types.variants(et.name()).keySet()));
        if (!exhaustive && !(scrutineeType instanceof Type.Unknown)) {
            error(Kind.NON_EXHAUSTIVE_MATCH, me.span(), "match on " + scrutineeType + " does not cover every value");
        }

        var finalType = resultType;
        var coercedBranches = branches.stream()
                .map(b -> new TMatchBranch(b.binding(), b.test(), b.filter(), coerced(b.body(), finalType)))
                .toList();
        return new TMatchExpression(scrutinee, coercedBranches, finalType, me.span());
    }

    private TExpression typeForall(ForallExpression fe, Scope scope) {
        var collection = typeExpression(fe.collection(), scope);
        var loopScope = scope.newScope();
        bind(loopScope, fe.var(), elementType(collection, "forall"));
        var filter = fe.filter().map(f -> expect(typeExpression(f, loopScope), Type.BOOL, "where clause"));
        var body = typeExpression(fe.body(), loopScope);
        reportUnused(loopScope);
        var type = body.type();
        if (type != Type.BOOL && type != Type.CONSTRAINT && !(type instanceof Type.Unknown)) {
            error(Kind.TYPE_MISMATCH, fe.body().span(), "forall body must be Bool or Constraint but found " + type);
        }
        return new TForallExpression(fe.var().value(), collection, filter, body, type, fe.span());
    }

    private TExpression typeSum(SumExpression se, Scope scope) {
        var collection = typeExpression(se.collection(), scope);
        var loopScope = scope.newScope();
        bind(loopScope, se.var(), elementType(collection, "sum"));
        var filter = se.filter().map(f -> expect(typeExpression(f, loopScope), Type.BOOL, "where clause"));
        var body = typeExpression(se.body(), loopScope);
        reportUnused(loopScope);
        var type = body.type();
        if (!Type.isNumeric(type) && !(type instanceof Type.Unknown)) {
            error(Kind.TYPE_MISMATCH, se.body().span(), "sum body must be Int or LinExpr but found " + type);
        }
        return new TSumExpression(se.var().value(), collection, filter, body, type, se.span());
    }

    private TExpression typeFold(FoldExpression fe, Scope scope) {
        var collection = typeExpression(fe.collection(), scope);
        var init = typeExpression(fe.init(), scope);
        var loopScope = scope.newScope();
        bind(loopScope, fe.var(), elementType(collection, "fold"));
        bind(loopScope, fe.accumulator(), init.type());
        var filter = fe.filter().map(f -> expect(typeExpression(f, loopScope), Type.BOOL, "where clause"));
        var body = expect(typeExpression(fe.body(), loopScope), init.type(), "fold accumulator");
        reportUnused(loopScope);
        return new TFoldExpression(fe.var().value(), collection, fe.accumulator().value(), init, filter, body, init.type(), fe.span());
    }

    // helpers

    private TExpression expect(TExpression expression, Type type, String context) {
        if (!Type.canCoerce(expression.type(), type)) {
            error(Kind.TYPE_MISMATCH, expression.span(), "expected " + type + " but found " + expression.type() + " in " + context);
            return expression;
        }
        return coerced(expression, type);
    }

    private static TExpression coerced(TExpression expression, Type type) {
        if (expression.type().equals(type) || type instanceof Type.Unknown) {
            return expression;
        }
        return new TCoerceExpression(expression, type, expression.span());
    }

    private Type unifyOrReport(Type a, Type b, Span span, String context) {
        var unified = Type.unify(a, b);
        if (unified.isEmpty()) {
            error(Kind.TYPE_MISMATCH, span, context + " have incompatible types " + a + " and " + b);
            return new Type.Unknown();
        }
        return unified.get();
    }

    private TExpression invalid(Kind kind, Span span, String message) {
        error(kind, span, message);
        return new TLocalExpression("<invalid>", new Type.Unknown(), span);
    }

    private void bind(Scope scope, Spanned<String> name, Type type) {
        if (name.value().equals("_")) {
            return;
        }
        if (scope.lookup(name.value()).isPresent()) {
            warn(SemanticWarning.Kind.IDENTIFIER_SHADOWED, name.span(), "identifier " + name.value() + " shadows an outer binding");
        }
        checkSnakeCase(name, "identifier");
        scope.put(name.value(), type, name.span());
    }

    private void reportUnused(Scope scope) {
        for (var local : scope.names.values()) {
            if (!local.used && !local.name.startsWith("_")) {
                warn(SemanticWarning.Kind.UNUSED_IDENTIFIER, local.span, "identifier " + local.name + " is never used");
            }
        }
    }

    private void checkSnakeCase(Spanned<String> name, String what) {
        if (!SNAKE_CASE.matcher(name.value()).matches()) {
            warn(SemanticWarning.Kind.NAMING_CONVENTION, name.span(), what + " " + name.value() + " should be snake_case");
        }
    }

    private void checkPascalCase(Spanned<String> name, String what) {
        if (!PASCAL_CASE.matcher(name.value()).matches()) {
            warn(SemanticWarning.Kind.NAMING_CONVENTION, name.span(), what + " " + name.value() + " should be PascalCase");
        }
    }

    private void error(Kind kind, Span span, String message) {
        errors.add(new SemanticError(kind, span, message));
    }

    private void warn(SemanticWarning.Kind kind, Span span, String message) {
        warnings.add(new SemanticWarning(kind, span, message));
    }

    private record ReifiedVar(String name, boolean list, List<Type> paramTypes) {}

    class FunctionRegistry {
        final Map<String, Function> map = new LinkedHashMap<>();

        void registerFunction(LetStatement ls) {
            var name = ls.name();
            if (map.containsKey(name.value())) {
                error(Kind.FUNCTION_ALREADY_DEFINED, name.span(), "function " + name.value() + " is already defined");
                return;
            }
            checkSnakeCase(name, "function");

            List<TParam> params = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (var param : ls.params()) {
                if (!seen.add(param.name().value())) {
                    error(Kind.PARAMETER_ALREADY_DEFINED, param.name().span(), "parameter " + param.name().value() + " is declared twice");
                    continue;
                }
                checkSnakeCase(param.name(), "parameter");
                var type = resolveType(param.type());
                checkVariantTypes(type, param.type().span());
                params.add(new TParam(param.name().value(), type));
            }
            var returnType = resolveType(ls.returnType());
            checkVariantTypes(returnType, ls.returnType().span());

            map.put(name.value(), new Function(name.value(), ls.pub(), params, returnType, ls));
        }

        Optional<Function> lookup(String name) {
            return Optional.ofNullable(map.get(name));
        }

        record Function(String name, boolean pub, List<TParam> params, Type returnType, LetStatement declaration) {}
    }

    static class Local {
        final String name;
        final Type type;
        final Span span;
        boolean used;

        Local(String name, Type type, Span span) {
            this.name = name;
            this.type = type;
            this.span = span;
        }
    }

    @ToString(of = "names")
    @RequiredArgsConstructor
    static class Scope {
        final Scope parentScope;
        final Map<String, Local> names = new LinkedHashMap<>();

        static Scope root() {
            return new Scope(null);
        }

        Scope newScope() {
            return new Scope(this);
        }

        Optional<Local> lookup(String name) {
            var result = names.get(name);
            if (result == null) {
                return parentScope == null ? Optional.empty() : parentScope.lookup(name);
            }
            return Optional.of(result);
        }

        void put(String name, Type type, Span span) {
            names.put(name, new Local(name, type, span));
        }
    }
}
