package com.github.collomatique.parser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.collomatique.eval.EvalException;
import com.github.collomatique.eval.Evaluator;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ObjectEnv;
import com.github.collomatique.eval.TypeSchema;
import com.github.collomatique.parser.TCompilationUnit.TFunction;
import com.github.collomatique.parser.TCompilationUnit.TReification;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A script that parsed and type-checked against a host schema and set of declared variables.
 * Evaluation of a checked script can only fail on arithmetic or domain lookups.
 */
public class CheckedAst {

    public record Signature(List<Type> params, Type returnType) {}

    private final TCompilationUnit unit;
    @Getter
    @Accessors(fluent = true)
    private final List<SemanticWarning> warnings;
    @Getter
    @Accessors(fluent = true)
    private final TypeSchema schema;
    @Getter
    @Accessors(fluent = true)
    private final Map<String, List<Type>> declaredVars;

    private CheckedAst(TCompilationUnit unit, List<SemanticWarning> warnings, TypeSchema schema, Map<String, List<Type>> declaredVars) {
        this.unit = unit;
        this.warnings = warnings;
        this.schema = schema;
        this.declaredVars = declaredVars;
    }

    public static CheckedAst compile(String source) {
        return compile(source, TypeSchema.empty(), Map.of());
    }

    /**
     * @throws ParsingException on the first syntax error
     * @throws SemanticException with every semantic error of the script
     */
    public static CheckedAst compile(String source, TypeSchema schema, Map<String, List<Type>> declaredVars) {
        var cu = Parser.parse(source);
        var typer = new AstTyper(schema, declaredVars);
        var unit = typer.typeCompilationUnit(cu);
        return new CheckedAst(unit, typer.warnings(), schema, Map.copyOf(declaredVars));
    }

    public TCompilationUnit unit() {
        return unit;
    }

    public Map<String, Signature> publicFunctions() {
        Map<String, Signature> result = new LinkedHashMap<>();
        for (var function : unit.functions().values()) {
            if (function.pub()) {
                result.put(function.name(), new Signature(function.paramTypes(), function.returnType()));
            }
        }
        return result;
    }

    /** Reify statements in declaration order. */
    public List<TReification> reifications() {
        return unit.reifications();
    }

    /** Evaluates a function without domain objects. */
    public ExprValue quickEvalFn(String function, List<ExprValue> args) {
        return evalFn(ObjectEnv.EMPTY, function, args);
    }

    public ExprValue evalFn(ObjectEnv env, String function, List<ExprValue> args) {
        return evalFn(evaluator(env), function, args);
    }

    /** Evaluates a function inside an existing session, sharing its memoized calls and reified variables. */
    public ExprValue evalFn(Evaluator session, String function, List<ExprValue> args) {
        checkCall(function, args);
        return session.call(function, args);
    }

    public List<String> docstring(ObjectEnv env, String function, List<ExprValue> args) {
        checkCall(function, args);
        return evaluator(env).docstring(function, args);
    }

    /** A fresh evaluation session; reuse it to share memoized calls. */
    public Evaluator evaluator(ObjectEnv env) {
        return new Evaluator(unit, env);
    }

    /** Verifies that the objects of {@code env} match the schema this script was checked against. */
    public void checkEnv(ObjectEnv env) {
        for (var typeName : schema.typeNames()) {
            for (var object : env.objectsWithType(typeName)) {
                if (!object.typeName().equals(typeName)) {
                    throw new EvalException(EvalException.Kind.INVALID_OBJECT, Span.NONE,
                            "object " + object + " listed as " + typeName + " reports type " + object.typeName());
                }
                for (var field : schema.fields(typeName).entrySet()) {
                    var value = object.fieldAccess(env, field.getKey());
                    if (value.isEmpty() || !Evaluator.conforms(value.get(), field.getValue())) {
                        throw new EvalException(EvalException.Kind.INVALID_OBJECT, Span.NONE,
                                "field " + field.getKey() + " of " + object + " is not a " + field.getValue());
                    }
                }
            }
        }
    }

    private void checkCall(String function, List<ExprValue> args) {
        TFunction declaration = unit.functions().get(function);
        if (declaration == null) {
            throw new EvalException(EvalException.Kind.UNKNOWN_FUNCTION, Span.NONE, "unknown function " + function);
        }
        if (declaration.params().size() != args.size()) {
            throw new EvalException(EvalException.Kind.ARGUMENT_MISMATCH, declaration.span(), "function " + function
                    + " takes " + declaration.params().size() + " argument(s) but got " + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            var param = declaration.params().get(i);
            if (!Evaluator.conforms(args.get(i), param.type())) {
                throw new EvalException(EvalException.Kind.ARGUMENT_MISMATCH, declaration.span(), "argument "
                        + param.name() + " of " + function + " must be a " + param.type() + " but got " + args.get(i));
            }
        }
    }
}
