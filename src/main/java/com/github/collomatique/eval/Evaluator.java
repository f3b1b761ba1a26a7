package com.github.collomatique.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import com.github.collomatique.Tokenizer.TokenType;
import com.github.collomatique.eval.EvalException.Kind;
import com.github.collomatique.eval.ExprValue.BoolValue;
import com.github.collomatique.eval.ExprValue.ConstraintValue;
import com.github.collomatique.eval.ExprValue.CustomValue;
import com.github.collomatique.eval.ExprValue.EnumValue;
import com.github.collomatique.eval.ExprValue.IntValue;
import com.github.collomatique.eval.ExprValue.LinExprValue;
import com.github.collomatique.eval.ExprValue.ListValue;
import com.github.collomatique.eval.ExprValue.ObjectValue;
import com.github.collomatique.eval.ExprValue.StringValue;
import com.github.collomatique.eval.ExprValue.StructValue;
import com.github.collomatique.eval.ExprValue.TupleValue;
import com.github.collomatique.eval.IlpVar.ExternVar;
import com.github.collomatique.eval.IlpVar.ScriptVar;
import com.github.collomatique.eval.IlpVar.ScriptVarListItem;
import com.github.collomatique.ilp.Constraint;
import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.parser.Span;
import com.github.collomatique.parser.TCompilationUnit;
import com.github.collomatique.parser.TCompilationUnit.Conversion;
import com.github.collomatique.parser.TCompilationUnit.TBinaryExpression;
import com.github.collomatique.parser.TCompilationUnit.TBoolExpression;
import com.github.collomatique.parser.TCompilationUnit.TCallExpression;
import com.github.collomatique.parser.TCompilationUnit.TCardinalityExpression;
import com.github.collomatique.parser.TCompilationUnit.TCoerceExpression;
import com.github.collomatique.parser.TCompilationUnit.TComprehensionExpression;
import com.github.collomatique.parser.TCompilationUnit.TConvertExpression;
import com.github.collomatique.parser.TCompilationUnit.TCustomExpression;
import com.github.collomatique.parser.TCompilationUnit.TDocExpression;
import com.github.collomatique.parser.TCompilationUnit.TDocLine;
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
import com.github.collomatique.parser.Type;

import lombok.extern.slf4j.Slf4j;

/**
 * Tree-walking evaluation of a checked script against one object environment. A session
 * memoizes function calls and remembers the definition of every reified variable it meets.
 */
@Slf4j
public class Evaluator {

    static final int MAX_CALL_DEPTH = 512;

    /** Stack of the thread running an outermost call, sized for {@link #MAX_CALL_DEPTH} nested bodies. */
    static final long EVAL_STACK_SIZE = 256L * 1024 * 1024;

    private final TCompilationUnit unit;
    private final ObjectEnv env;
    private final Map<String, TReification> reificationsByVar = new HashMap<>();
    private final Map<Call, ExprValue> memo = new HashMap<>();
    private final Map<IlpVar, ConstraintValue> reifiedDefinitions = new LinkedHashMap<>();
    private int depth;

    public Evaluator(TCompilationUnit unit, ObjectEnv env) {
        this.unit = unit;
        this.env = env;
        for (var reification : unit.reifications()) {
            reificationsByVar.put(reification.varName(), reification);
        }
    }

    private record Call(String function, List<ExprValue> args) {}

    /** Calls a function with arguments that already conform to its parameter types. */
    public ExprValue call(String function, List<ExprValue> args) {
        var declaration = unit.functions().get(function);
        if (declaration == null) {
            throw new EvalException(Kind.UNKNOWN_FUNCTION, Span.NONE, "unknown function " + function);
        }
        return call(declaration, coerceArguments(declaration, args), declaration.span());
    }

    /** Definitions of the script's reified variables met so far, in order of first use. */
    public Map<IlpVar, ConstraintValue> reifiedDefinitions() {
        return Collections.unmodifiableMap(reifiedDefinitions);
    }

    /** Rendered docstring of a function, embedded expressions evaluated with {@code args}. */
    public List<String> docstring(String function, List<ExprValue> args) {
        var declaration = unit.functions().get(function);
        if (declaration == null) {
            throw new EvalException(Kind.UNKNOWN_FUNCTION, Span.NONE, "unknown function " + function);
        }
        var coerced = coerceArguments(declaration, args);
        var scope = Scope.root();
        for (int i = 0; i < coerced.size(); i++) {
            scope.put(declaration.params().get(i).name(), coerced.get(i));
        }
        return render(declaration.docstring(), scope);
    }

    /** Rendered docstring of a reified variable family. */
    public List<String> reificationDocstring(String varName, List<ExprValue> args) {
        var reification = reificationsByVar.get(varName);
        if (reification == null) {
            throw new EvalException(Kind.UNKNOWN_FUNCTION, Span.NONE, "unknown reified variable " + varName);
        }
        var function = unit.functions().get(reification.function());
        var coerced = coerceArguments(function, args);
        var scope = Scope.root();
        for (int i = 0; i < coerced.size(); i++) {
            scope.put(function.params().get(i).name(), coerced.get(i));
        }
        return render(reification.docstring(), scope);
    }

    private List<String> render(List<TDocLine> lines, Scope scope) {
        List<String> result = new ArrayList<>();
        for (var line : lines) {
            var sb = new StringBuilder();
            for (var part : line.parts()) {
                if (part instanceof TDocText text) {
                    sb.append(text.text());
                } else if (part instanceof TDocExpression expression) {
                    sb.append(eval(expression.expression(), scope));
                }
            }
            result.add(sb.toString().strip());
        }
        return result;
    }

    private List<ExprValue> coerceArguments(TFunction function, List<ExprValue> args) {
        if (args.size() != function.params().size()) {
            throw new EvalException(Kind.ARGUMENT_MISMATCH, function.span(), "function " + function.name()
                    + " takes " + function.params().size() + " argument(s) but got " + args.size());
        }
        List<ExprValue> result = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            result.add(coerce(args.get(i), function.params().get(i).type()));
        }
        return result;
    }

    private ExprValue call(TFunction function, List<ExprValue> args, Span span) {
        var key = new Call(function.name(), args);
        var cached = memo.get(key);
        if (cached != null) {
            return cached;
        }
        if (depth == 0) {
            return onEvalStack(() -> callNested(function, args, span), span);
        }
        return callNested(function, args, span);
    }

    private ExprValue callNested(TFunction function, List<ExprValue> args, Span span) {
        var key = new Call(function.name(), args);
        if (depth >= MAX_CALL_DEPTH) {
            throw new EvalException(Kind.RECURSION_LIMIT, span, "more than " + MAX_CALL_DEPTH + " nested calls");
        }

        // fresh scope: parameters shadow nothing but each other
        var scope = Scope.root();
        for (int i = 0; i < args.size(); i++) {
            scope.put(function.params().get(i).name(), args.get(i));
        }
        depth++;
        ExprValue result;
        try {
            result = eval(function.body(), scope);
        } finally {
            depth--;
        }
        result = withOrigin(result, new Origin(function.name(), args));
        memo.put(key, result);
        return result;
    }

    /**
     * Runs an outermost call on its own thread with a stack large enough for the call depth limit.
     * The caller blocks until it is done, so the session is still used by one thread at a time.
     */
    private static ExprValue onEvalStack(Supplier<ExprValue> body, Span span) {
        var result = new AtomicReference<ExprValue>();
        var failure = new AtomicReference<Throwable>();
        var thread = new Thread(null, () -> {
            try {
                result.set(body.get());
            } catch (StackOverflowError e) {
                failure.set(new EvalException(Kind.RECURSION_LIMIT, span, "expression nested too deeply"));
            } catch (RuntimeException | Error e) {
                failure.set(e);
            }
        }, "collo-ml-eval", EVAL_STACK_SIZE);
        thread.start();

        boolean interrupted = false;
        while (thread.isAlive()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        var thrown = failure.get();
        if (thrown instanceof RuntimeException re) {
            throw re;
        }
        if (thrown instanceof Error error) {
            throw error;
        }
        return result.get();
    }

    private static ExprValue withOrigin(ExprValue value, Origin origin) {
        if (value instanceof ConstraintValue cv) {
            return new ConstraintValue(cv.constraints().stream().map(c -> c.withOriginIfAbsent(origin)).toList());
        }
        if (value instanceof ListValue lv && lv.elementType() == Type.CONSTRAINT) {
            Set<ExprValue> elements = new LinkedHashSet<>();
            for (var element : lv.elements()) {
                elements.add(withOrigin(element, origin));
            }
            return new ListValue(lv.elementType(), elements);
        }
        return value;
    }

    ExprValue eval(TExpression expression, Scope scope) {
        try {
            return evalUnchecked(expression, scope);
        } catch (ArithmeticException e) {
            throw new EvalException(Kind.OVERFLOW, expression.span(), e.getMessage());
        }
    }

    private ExprValue evalUnchecked(TExpression expression, Scope scope) {
        if (expression instanceof TIntExpression ie) {
            return new IntValue(ie.value());
        } else if (expression instanceof TBoolExpression be) {
            return BoolValue.of(be.value());
        } else if (expression instanceof TStringExpression se) {
            return new StringValue(se.value());
        } else if (expression instanceof TLocalExpression le) {
            return scope.get(le.name());
        } else if (expression instanceof TCallExpression ce) {
            List<ExprValue> args = new ArrayList<>();
            for (var argument : ce.arguments()) {
                args.add(eval(argument, scope));
            }
            return call(unit.functions().get(ce.function()), args, ce.span());
        } else if (expression instanceof TVarCallExpression vce) {
            return evalVarCall(vce, scope);
        } else if (expression instanceof TGlobalListExpression gle) {
            Set<ExprValue> objects = new LinkedHashSet<>();
            for (var object : env.objectsWithType(gle.typeName())) {
                objects.add(new ObjectValue(object));
            }
            return new ListValue(new Type.ObjectType(gle.typeName()), objects);
        } else if (expression instanceof TListExpression le) {
            Set<ExprValue> elements = new LinkedHashSet<>();
            for (var element : le.elements()) {
                elements.add(eval(element, scope));
            }
            return new ListValue(elementType(le.type()), elements);
        } else if (expression instanceof TRangeExpression re) {
            int start = asInt(eval(re.start(), scope));
            int end = asInt(eval(re.end(), scope));
            Set<ExprValue> elements = new LinkedHashSet<>();
            for (int i = start; i < end; i++) {
                elements.add(new IntValue(i));
            }
            return new ListValue(Type.INT, elements);
        } else if (expression instanceof TComprehensionExpression ce) {
            Set<ExprValue> elements = new LinkedHashSet<>();
            comprehend(ce, 0, scope, elements);
            return new ListValue(elementType(ce.type()), elements);
        } else if (expression instanceof TCardinalityExpression ce) {
            return new IntValue(asList(eval(ce.collection(), scope)).elements().size());
        } else if (expression instanceof TTupleExpression te) {
            List<ExprValue> elements = new ArrayList<>();
            for (var element : te.elements()) {
                elements.add(eval(element, scope));
            }
            return new TupleValue(elements);
        } else if (expression instanceof TStructExpression se) {
            var fields = new TreeMap<String, ExprValue>();
            se.fields().forEach((name, value) -> fields.put(name, eval(value, scope)));
            return new StructValue(fields);
        } else if (expression instanceof TFieldExpression fe) {
            return evalField(eval(fe.target(), scope), fe);
        } else if (expression instanceof TTupleIndexExpression tie) {
            return ((TupleValue) eval(tie.target(), scope)).elements().get(tie.index());
        } else if (expression instanceof TCoerceExpression ce) {
            return coerce(eval(ce.expression(), scope), ce.type());
        } else if (expression instanceof TConvertExpression ce) {
            var value = eval(ce.expression(), scope);
            if (ce.conversion() == Conversion.TO_STRING) {
                return new StringValue(value.toString());
            }
            return new LinExprValue(LinExpr.constant(asInt(value)));
        } else if (expression instanceof TCustomExpression ce) {
            return new CustomValue(ce.typeName(), eval(ce.value(), scope));
        } else if (expression instanceof TUnwrapExpression ue) {
            var value = eval(ue.value(), scope);
            if (value instanceof CustomValue cv) {
                return cv.inner();
            }
            return ((EnumValue) value).payload().orElseThrow();
        } else if (expression instanceof TVariantExpression ve) {
            return new EnumValue(ve.enumName(), ve.variant(), ve.payload().map(p -> eval(p, scope)));
        } else if (expression instanceof TUnaryExpression ue) {
            var operand = eval(ue.operand(), scope);
            return switch (ue.operator()) {
                case NOT -> BoolValue.of(!asBool(operand));
                case MINUS -> operand instanceof IntValue iv
                        ? new IntValue(Math.negateExact(iv.value()))
                        : new LinExprValue(asLinExpr(operand).negate());
                default -> throw new IllegalStateException("unsupported unary operator " + ue.operator());
            };
        } else if (expression instanceof TBinaryExpression be) {
            return evalBinary(be, scope);
        } else if (expression instanceof TIfExpression ie) {
            return asBool(eval(ie.condition(), scope)) ? eval(ie.thenBranch(), scope) : eval(ie.elseBranch(), scope);
        } else if (expression instanceof TLetExpression le) {
            var letScope = scope.newScope();
            letScope.put(le.name(), eval(le.value(), scope));
            return eval(le.body(), letScope);
        } else if (expression instanceof TMatchExpression me) {
            return evalMatch(me, scope);
        } else if (expression instanceof TForallExpression fe) {
            return evalForall(fe, scope);
        } else if (expression instanceof TSumExpression se) {
            return evalSum(se, scope);
        } else if (expression instanceof TFoldExpression fe) {
            var accumulator = eval(fe.init(), scope);
            for (var element : asList(eval(fe.collection(), scope)).elements()) {
                var loopScope = scope.newScope();
                loopScope.put(fe.var(), element);
                loopScope.put(fe.accumulator(), accumulator);
                if (fe.filter().isPresent() && !asBool(eval(fe.filter().get(), loopScope))) {
                    continue;
                }
                accumulator = eval(fe.body(), loopScope);
            }
            return accumulator;
        }
        throw new IllegalStateException("unsupported expression " + expression);
    }

    private ExprValue evalVarCall(TVarCallExpression vce, Scope scope) {
        List<ExprValue> args = new ArrayList<>();
        for (var argument : vce.arguments()) {
            args.add(eval(argument, scope));
        }
        if (!vce.script()) {
            return new LinExprValue(LinExpr.var(new ExternVar(vce.name(), args)));
        }

        var reification = reificationsByVar.get(vce.name());
        var definition = call(unit.functions().get(reification.function()), args, vce.span());
        if (!vce.list()) {
            var var = new ScriptVar(vce.name(), args);
            define(var, (ConstraintValue) definition);
            return new LinExprValue(LinExpr.var(var));
        }
        Set<ExprValue> items = new LinkedHashSet<>();
        int index = 0;
        for (var element : asList(definition).elements()) {
            var var = new ScriptVarListItem(vce.name(), args, index++);
            define(var, (ConstraintValue) element);
            items.add(new LinExprValue(LinExpr.var(var)));
        }
        return new ListValue(Type.LIN_EXPR, items);
    }

    private void define(IlpVar var, ConstraintValue definition) {
        if (reifiedDefinitions.putIfAbsent(var, definition) == null) {
            log.debug("reified {} as {}", var, definition);
        }
    }

    private void comprehend(TComprehensionExpression ce, int bindingIndex, Scope scope, Set<ExprValue> out) {
        if (bindingIndex == ce.bindings().size()) {
            if (ce.filter().isEmpty() || asBool(eval(ce.filter().get(), scope))) {
                out.add(eval(ce.body(), scope));
            }
            return;
        }
        var binding = ce.bindings().get(bindingIndex);
        for (var element : asList(eval(binding.collection(), scope)).elements()) {
            var inner = scope.newScope();
            inner.put(binding.name(), element);
            comprehend(ce, bindingIndex + 1, inner, out);
        }
    }

    private ExprValue evalField(ExprValue target, TFieldExpression fe) {
        if (target instanceof ObjectValue ov) {
            return ov.object().fieldAccess(env, fe.field())
                    .orElseThrow(() -> new EvalException(Kind.MISSING_FIELD, fe.span(),
                            ov.object().typeName() + " " + ov.object() + " has no value for field " + fe.field()));
        }
        return ((StructValue) target).fields().get(fe.field());
    }

    private ExprValue evalBinary(TBinaryExpression be, Scope scope) {
        var operator = be.operator();
        var left = eval(be.left(), scope);

        // short-circuit boolean connectives
        if (left instanceof BoolValue lb) {
            if (operator == TokenType.AND && !lb.value()) {
                return BoolValue.FALSE;
            }
            if (operator == TokenType.OR && lb.value()) {
                return BoolValue.TRUE;
            }
        }
        var right = eval(be.right(), scope);

        try {
            return switch (operator) {
                case PLUS -> {
                    if (left instanceof IntValue l && right instanceof IntValue r) {
                        yield new IntValue(Math.addExact(l.value(), r.value()));
                    }
                    if (left instanceof StringValue l && right instanceof StringValue r) {
                        yield new StringValue(l.value() + r.value());
                    }
                    if (left instanceof ListValue l && right instanceof ListValue r) {
                        Set<ExprValue> union = new LinkedHashSet<>(l.elements());
                        union.addAll(r.elements());
                        yield new ListValue(elementType(be.type()), union);
                    }
                    yield new LinExprValue(asLinExpr(left).plus(asLinExpr(right)));
                }
                case MINUS -> {
                    if (left instanceof IntValue l && right instanceof IntValue r) {
                        yield new IntValue(Math.subtractExact(l.value(), r.value()));
                    }
                    if (left instanceof ListValue l && right instanceof ListValue r) {
                        Set<ExprValue> difference = new LinkedHashSet<>(l.elements());
                        difference.removeAll(r.elements());
                        yield new ListValue(elementType(be.type()), difference);
                    }
                    yield new LinExprValue(asLinExpr(left).minus(asLinExpr(right)));
                }
                case STAR -> {
                    if (left instanceof IntValue l && right instanceof IntValue r) {
                        yield new IntValue(Math.multiplyExact(l.value(), r.value()));
                    }
                    var l = asLinExpr(left);
                    var r = asLinExpr(right);
                    // the checker guarantees one side is a constant
                    yield new LinExprValue(l.variables().isEmpty() ? r.times(l.getConstant()) : l.times(r.getConstant()));
                }
                case SLASH_SLASH -> {
                    int divisor = checkDivisor(asInt(right), be);
                    int dividend = asInt(left);
                    if (dividend == Integer.MIN_VALUE && divisor == -1) {
                        throw new EvalException(Kind.OVERFLOW, be.span(), "integer overflow in division");
                    }
                    yield new IntValue(dividend / divisor);
                }
                case PERCENT -> new IntValue(asInt(left) % checkDivisor(asInt(right), be));
                case EQUALS_EQUALS -> BoolValue.of(left.equals(right));
                case NOT_EQUALS -> BoolValue.of(!left.equals(right));
                case LT -> BoolValue.of(asInt(left) < asInt(right));
                case LE -> BoolValue.of(asInt(left) <= asInt(right));
                case GT -> BoolValue.of(asInt(left) > asInt(right));
                case GE -> BoolValue.of(asInt(left) >= asInt(right));
                case CONSTRAINT_EQ -> constraint(asLinExpr(left).eq(asLinExpr(right)));
                case CONSTRAINT_LE -> constraint(asLinExpr(left).leq(asLinExpr(right)));
                case CONSTRAINT_GE -> constraint(asLinExpr(left).geq(asLinExpr(right)));
                case IN -> BoolValue.of(asList(right).elements().contains(left));
                case AND -> {
                    if (left instanceof BoolValue) {
                        yield right;
                    }
                    List<ConstraintWithOrigin> constraints = new ArrayList<>(((ConstraintValue) left).constraints());
                    constraints.addAll(((ConstraintValue) right).constraints());
                    yield new ConstraintValue(constraints);
                }
                case OR -> right;
                default -> throw new IllegalStateException("unsupported operator " + operator);
            };
        } catch (ArithmeticException e) {
            throw new EvalException(Kind.OVERFLOW, be.span(), "integer overflow: " + e.getMessage());
        }
    }

    private static int checkDivisor(int divisor, TBinaryExpression be) {
        if (divisor == 0) {
            throw new EvalException(Kind.DIVISION_BY_ZERO, be.span(), "division by zero");
        }
        return divisor;
    }

    private static ConstraintValue constraint(Constraint<IlpVar> constraint) {
        return new ConstraintValue(List.of(ConstraintWithOrigin.anonymous(constraint)));
    }

    private ExprValue evalMatch(TMatchExpression me, Scope scope) {
        var value = eval(me.scrutinee(), scope);
        for (TMatchBranch branch : me.branches()) {
            if (branch.test().isPresent()) {
                var variant = (Type.VariantType) branch.test().get();
                if (!(value instanceof EnumValue ev) || !ev.variant().equals(variant.variant())) {
                    continue;
                }
            }
            var branchScope = scope.newScope();
            branch.binding().ifPresent(name -> branchScope.put(name, value));
            if (branch.filter().isPresent() && !asBool(eval(branch.filter().get(), branchScope))) {
                continue;
            }
            return eval(branch.body(), branchScope);
        }
        throw new IllegalStateException("no branch of exhaustive match accepted " + value);
    }

    private ExprValue evalForall(TForallExpression fe, Scope scope) {
        boolean constraints = fe.type() == Type.CONSTRAINT;
        List<ConstraintWithOrigin> conjunction = new ArrayList<>();
        for (var element : asList(eval(fe.collection(), scope)).elements()) {
            var loopScope = scope.newScope();
            loopScope.put(fe.var(), element);
            if (fe.filter().isPresent() && !asBool(eval(fe.filter().get(), loopScope))) {
                continue;
            }
            var body = eval(fe.body(), loopScope);
            if (constraints) {
                conjunction.addAll(((ConstraintValue) body).constraints());
            } else if (!asBool(body)) {
                return BoolValue.FALSE;
            }
        }
        return constraints ? new ConstraintValue(conjunction) : BoolValue.TRUE;
    }

    private ExprValue evalSum(TSumExpression se, Scope scope) {
        boolean linear = se.type() == Type.LIN_EXPR;
        int intSum = 0;
        LinExpr<IlpVar> linSum = LinExpr.zero();
        for (var element : asList(eval(se.collection(), scope)).elements()) {
            var loopScope = scope.newScope();
            loopScope.put(se.var(), element);
            if (se.filter().isPresent() && !asBool(eval(se.filter().get(), loopScope))) {
                continue;
            }
            var body = eval(se.body(), loopScope);
            if (linear) {
                linSum = linSum.plus(asLinExpr(body));
            } else {
                intSum = Math.addExact(intSum, asInt(body));
            }
        }
        return linear ? new LinExprValue(linSum) : new IntValue(intSum);
    }

    /** Converts a value to the representation of {@code type}; the checker vouched for compatibility. */
    public static ExprValue coerce(ExprValue value, Type type) {
        if (type == Type.LIN_EXPR && value instanceof IntValue iv) {
            return new LinExprValue(LinExpr.constant(iv.value()));
        }
        if (type instanceof Type.ListType lt && value instanceof ListValue lv) {
            Set<ExprValue> elements = new LinkedHashSet<>();
            for (var element : lv.elements()) {
                elements.add(coerce(element, lt.element()));
            }
            return new ListValue(lt.element(), elements);
        }
        if (type instanceof Type.TupleType tt && value instanceof TupleValue tv) {
            List<ExprValue> elements = new ArrayList<>();
            for (int i = 0; i < tv.elements().size(); i++) {
                elements.add(coerce(tv.elements().get(i), tt.elements().get(i)));
            }
            return new TupleValue(elements);
        }
        if (type instanceof Type.StructType st && value instanceof StructValue sv) {
            var fields = new TreeMap<String, ExprValue>();
            sv.fields().forEach((name, field) -> fields.put(name, coerce(field, st.fields().get(name))));
            return new StructValue(fields);
        }
        return value;
    }

    /** Whether a host-provided value has the given type. */
    public static boolean conforms(ExprValue value, Type type) {
        if (type instanceof Type.Primitive primitive) {
            return switch (primitive) {
                case INT -> value instanceof IntValue;
                case BOOL -> value instanceof BoolValue;
                case STRING -> value instanceof StringValue;
                case LIN_EXPR -> value instanceof LinExprValue || value instanceof IntValue;
                case CONSTRAINT -> value instanceof ConstraintValue;
            };
        }
        if (type instanceof Type.ListType lt) {
            return value instanceof ListValue lv && lv.elements().stream().allMatch(e -> conforms(e, lt.element()));
        }
        if (type instanceof Type.EmptyList) {
            return value instanceof ListValue lv && lv.elements().isEmpty();
        }
        if (type instanceof Type.TupleType tt) {
            if (!(value instanceof TupleValue tv) || tv.elements().size() != tt.elements().size()) {
                return false;
            }
            for (int i = 0; i < tt.elements().size(); i++) {
                if (!conforms(tv.elements().get(i), tt.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (type instanceof Type.StructType st) {
            if (!(value instanceof StructValue sv) || !sv.fields().keySet().equals(st.fields().keySet())) {
                return false;
            }
            return st.fields().entrySet().stream().allMatch(e -> conforms(sv.fields().get(e.getKey()), e.getValue()));
        }
        if (type instanceof Type.ObjectType ot) {
            return value instanceof ObjectValue ov && ov.object().typeName().equals(ot.name());
        }
        if (type instanceof Type.CustomType ct) {
            return value instanceof CustomValue cv && cv.typeName().equals(ct.name());
        }
        if (type instanceof Type.EnumType et) {
            return value instanceof EnumValue ev && ev.enumName().equals(et.name());
        }
        if (type instanceof Type.VariantType vt) {
            return value instanceof EnumValue ev && ev.enumName().equals(vt.enumName()) && ev.variant().equals(vt.variant());
        }
        return false;
    }

    private static Type elementType(Type listType) {
        return listType instanceof Type.ListType lt ? lt.element() : new Type.EmptyList();
    }

    private static int asInt(ExprValue value) {
        return ((IntValue) value).value();
    }

    private static boolean asBool(ExprValue value) {
        return ((BoolValue) value).value();
    }

    private static ListValue asList(ExprValue value) {
        return (ListValue) value;
    }

    private static LinExpr<IlpVar> asLinExpr(ExprValue value) {
        if (value instanceof IntValue iv) {
            return LinExpr.constant(iv.value());
        }
        return ((LinExprValue) value).expr();
    }

    static class Scope {
        final Map<String, ExprValue> values = new HashMap<>();
        final Scope parent;

        Scope(Scope parent) {
            this.parent = parent;
        }

        static Scope root() {
            return new Scope(null);
        }

        Scope newScope() {
            return new Scope(this);
        }

        ExprValue get(String name) {
            for (var scope = this; scope != null; scope = scope.parent) {
                var value = scope.values.get(name);
                if (value != null) {
                    return value;
                }
            }
            throw new IllegalStateException("unbound local " + name);
        }

        void put(String name, ExprValue value) {
            values.put(name, value);
        }
    }
}
