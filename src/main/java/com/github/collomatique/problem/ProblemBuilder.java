package com.github.collomatique.problem;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.collomatique.eval.ConstraintWithOrigin;
import com.github.collomatique.eval.Evaluator;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ExprValue.ConstraintValue;
import com.github.collomatique.eval.ExprValue.IntValue;
import com.github.collomatique.eval.ExprValue.LinExprValue;
import com.github.collomatique.eval.ExprValue.ListValue;
import com.github.collomatique.eval.IlpVar;
import com.github.collomatique.eval.IlpVar.ExternVar;
import com.github.collomatique.eval.IlpVar.ScriptVar;
import com.github.collomatique.eval.IlpVar.ScriptVarListItem;
import com.github.collomatique.eval.ObjectEnv;
import com.github.collomatique.eval.TypeSchema;
import com.github.collomatique.ilp.Constraint;
import com.github.collomatique.ilp.LinExpr;
import com.github.collomatique.ilp.ModelException;
import com.github.collomatique.ilp.Problem;
import com.github.collomatique.ilp.repr.ReprKind;
import com.github.collomatique.parser.SemanticWarning;
import com.github.collomatique.parser.Type;
import com.github.collomatique.problem.ColloProblem.ConstraintDesc;
import com.github.collomatique.problem.ColloProblem.DescribedConstraint;
import com.github.collomatique.problem.ProblemVar.Base;
import com.github.collomatique.problem.ProblemVar.Helper;
import com.github.collomatique.problem.ProblemVar.Reified;
import com.github.collomatique.problem.ProblemVar.ReifiedListItem;

import lombok.extern.slf4j.Slf4j;

/**
 * Assembles a {@link ColloProblem} from scripts evaluated against one domain snapshot.
 * <p>
 * Host variables are those of {@link EvalVars}. Reified variables met while evaluating are
 * linearized by {@link Reifier} as soon as the call that produced them is done. Scripts added
 * with {@link #addReifiedVariables} expose public Constraint functions as {@code $Name} to the
 * scripts added after them.
 */
@Slf4j
public class ProblemBuilder<V> {

    private record Global(StoredScript script, String function) {}

    private record PendingDefinition<V>(ProblemVar<V> var, StoredScript script, ConstraintValue value) {}

    private final ObjectEnv env;
    private final ScriptStore store;
    private final EvalVars<V> evalVars;
    private final Set<V> baseVars = new LinkedHashSet<>();
    private final Map<V, Boolean> fixedVars = new LinkedHashMap<>();
    private final Map<String, List<Type>> declaredVars;
    private final Map<String, Global> globals = new LinkedHashMap<>();
    private final Map<StoredScript, Evaluator> sessions = new HashMap<>();
    private final Set<StoredScript> checkedEnv = new HashSet<>();

    private final Map<ProblemVar<V>, List<Constraint<ProblemVar<V>>>> definitions = new LinkedHashMap<>();
    private final List<ProblemVar<V>> helpers = new ArrayList<>();
    private final Deque<PendingDefinition<V>> pending = new ArrayDeque<>();
    private final Set<ProblemVar<V>> queued = new HashSet<>();
    private final List<DescribedConstraint<V>> constraints = new ArrayList<>();
    private LinExpr<ProblemVar<V>> objective = LinExpr.zero();

    /**
     * @throws ModelException with kind {@code SCHEMA_MISMATCH} if a variable family uses a
     *         parameter type the schema cannot provide
     */
    public ProblemBuilder(ObjectEnv env, ScriptStore store, EvalVars<V> evalVars) {
        this.env = env;
        this.store = store;
        this.evalVars = evalVars;
        this.declaredVars = new LinkedHashMap<>(evalVars.fieldSchema());
        declaredVars.forEach((name, params) -> {
            for (var param : params) {
                if (!isHostType(param, store.schema())) {
                    throw new ModelException(ModelException.Kind.SCHEMA_MISMATCH,
                            "parameter type " + param + " of $" + name + " is not provided by the schema");
                }
            }
        });
        for (var var : evalVars.vars(env)) {
            var fixed = evalVars.fix(var);
            if (fixed.isPresent()) {
                fixedVars.put(var, fixed.get());
            } else {
                baseVars.add(var);
            }
        }
        log.info("problem builder over {} free and {} fixed host variables", baseVars.size(), fixedVars.size());
    }

    /** Variables visible to the next script, host families and global reifications. */
    public Map<String, List<Type>> declaredVars() {
        return Collections.unmodifiableMap(declaredVars);
    }

    /**
     * Exposes public Constraint functions of {@code script} to later scripts.
     *
     * @param functions function name to the name of the variable family, without {@code $}
     * @return the warnings of the script
     */
    public List<SemanticWarning> addReifiedVariables(Script script, Map<String, String> functions) {
        var stored = compile(script);
        var signatures = stored.ast().publicFunctions();
        for (var entry : functions.entrySet()) {
            var function = entry.getKey();
            var varName = entry.getValue();
            var signature = signatures.get(function);
            if (signature == null) {
                throw new ModelException(ModelException.Kind.UNKNOWN_FUNCTION,
                        "no public function " + function + " in " + stored.ref());
            }
            if (!signature.returnType().equals(Type.CONSTRAINT)) {
                throw new ModelException(ModelException.Kind.SCHEMA_MISMATCH,
                        "reified function " + function + " returns " + signature.returnType() + " instead of Constraint");
            }
            for (var param : signature.params()) {
                if (!isHostType(param, store.schema())) {
                    throw new ModelException(ModelException.Kind.SCHEMA_MISMATCH,
                            "parameter type " + param + " of " + function + " is not visible to other scripts");
                }
            }
            boolean shadowsLocal = stored.ast().reifications().stream()
                    .anyMatch(r -> r.varName().equals(varName) && !r.function().equals(function));
            if (declaredVars.containsKey(varName) || shadowsLocal) {
                throw new ModelException(ModelException.Kind.REIFICATION_ALREADY_DECLARED,
                        "variable $" + varName + " is already declared");
            }
            declaredVars.put(varName, signature.params());
            globals.put(varName, new Global(stored, function));
            log.debug("{} exposes {} as ${}", stored.ref(), function, varName);
        }
        return stored.ast().warnings();
    }

    /**
     * Adds the constraints returned by each call. Functions must be public and return
     * {@code Constraint} or {@code [Constraint]}.
     *
     * @return the warnings of the script
     */
    public List<SemanticWarning> addConstraints(Script script, List<FnCall> calls) {
        var stored = compile(script);
        var session = session(stored);
        for (var call : calls) {
            checkReturnType(stored, call, Type.CONSTRAINT, Type.listOf(Type.CONSTRAINT));
            var value = stored.ast().evalFn(session, call.name(), call.args());
            for (var constraint : constraintsOf(value).constraints()) {
                var translated = translate(stored, constraint.constraint());
                constraints.add(new DescribedConstraint<>(translated,
                        new ConstraintDesc.FromScript<>(stored.ref(), call, constraint.origin())));
            }
            drainPending();
        }
        return stored.ast().warnings();
    }

    /**
     * Adds {@code coefficient} times the value of the call to the objective. The call must
     * return {@code LinExpr} or {@code Int}.
     *
     * @return the warnings of the script
     */
    public List<SemanticWarning> addObjective(Script script, FnCall call, int coefficient, ObjectiveSense sense) {
        var stored = compile(script);
        var session = session(stored);
        checkReturnType(stored, call, Type.LIN_EXPR, Type.INT);
        var value = stored.ast().evalFn(session, call.name(), call.args());
        LinExpr<IlpVar> expr;
        if (value instanceof LinExprValue l) {
            expr = l.expr();
        } else {
            expr = LinExpr.constant(((IntValue) value).value());
        }
        var translated = translate(stored, expr).times(Math.multiplyExact(coefficient, sense.sign()));
        objective = objective.plus(translated);
        drainPending();
        return stored.ast().warnings();
    }

    public ColloProblem<V> build() {
        return build(ReprKind.DENSE);
    }

    public ColloProblem<V> build(ReprKind reprKind) {
        Problem.Builder<ProblemVar<V>> builder = Problem.builder();
        for (var var : baseVars) {
            builder.addVariable(new Base<>(var));
        }
        fixedVars.forEach((var, value) -> builder.addConstant(new Base<>(var), value));
        builder.addVariables(definitions.keySet());
        builder.addVariables(helpers);
        for (var constraint : constraints) {
            builder.addConstraint(constraint.constraint());
        }
        builder.objective(objective);
        var problem = builder.build(reprKind);
        log.info("built problem: {} variables ({} reified, {} helpers), {} constraints",
                problem.variables().size(), definitions.size(), helpers.size(), problem.constraints().size());
        return new ColloProblem<>(problem, Collections.unmodifiableSet(new LinkedHashSet<>(baseVars)),
                Collections.unmodifiableMap(new LinkedHashMap<>(fixedVars)),
                Collections.unmodifiableMap(new LinkedHashMap<>(definitions)), List.copyOf(constraints));
    }

    private StoredScript compile(Script script) {
        var stored = store.lookupOrCompile(script, declaredVars);
        for (var warning : stored.ast().warnings()) {
            log.warn("{}: {}", script.name(), warning);
        }
        return stored;
    }

    private Evaluator session(StoredScript stored) {
        if (checkedEnv.add(stored)) {
            stored.ast().checkEnv(env);
        }
        return sessions.computeIfAbsent(stored, s -> s.ast().evaluator(env));
    }

    private static void checkReturnType(StoredScript stored, FnCall call, Type... accepted) {
        var signature = stored.ast().publicFunctions().get(call.name());
        if (signature == null) {
            throw new ModelException(ModelException.Kind.UNKNOWN_FUNCTION,
                    "no public function " + call.name() + " in " + stored.ref());
        }
        for (var type : accepted) {
            if (signature.returnType().equals(type)) {
                return;
            }
        }
        throw new ModelException(ModelException.Kind.SCHEMA_MISMATCH,
                "function " + call.name() + " returns " + signature.returnType());
    }

    private static ConstraintValue constraintsOf(ExprValue value) {
        if (value instanceof ConstraintValue c) {
            return c;
        }
        var result = new ArrayList<ConstraintWithOrigin>();
        for (var element : ((ListValue) value).elements()) {
            result.addAll(((ConstraintValue) element).constraints());
        }
        return new ConstraintValue(result);
    }

    private Constraint<ProblemVar<V>> translate(StoredScript script, Constraint<IlpVar> constraint) {
        return new Constraint<>(translate(script, constraint.expr()), constraint.getSign());
    }

    private LinExpr<ProblemVar<V>> translate(StoredScript script, LinExpr<IlpVar> expr) {
        LinExpr<ProblemVar<V>> result = LinExpr.constant(expr.getConstant());
        for (var entry : expr.coefficients().entrySet()) {
            result = result.plus(LinExpr.var(resolve(script, entry.getKey())).times(entry.getValue()));
        }
        return result;
    }

    private ProblemVar<V> resolve(StoredScript script, IlpVar var) {
        if (var instanceof ScriptVar sv) {
            ProblemVar<V> target = new Reified<>(script.ref(), sv.name(), sv.params());
            enqueue(target, script, sessions.get(script).reifiedDefinitions().get(sv));
            return target;
        }
        if (var instanceof ScriptVarListItem item) {
            ProblemVar<V> target = new ReifiedListItem<>(script.ref(), item.name(), item.params(), item.index());
            enqueue(target, script, sessions.get(script).reifiedDefinitions().get(item));
            return target;
        }
        var extern = (ExternVar) var;
        var global = globals.get(extern.name());
        if (global != null) {
            ProblemVar<V> target = new Reified<>(global.script().ref(), extern.name(), extern.params());
            if (!queued.contains(target)) {
                var session = session(global.script());
                var value = global.script().ast().evalFn(session, global.function(), extern.params());
                enqueue(target, global.script(), (ConstraintValue) value);
            }
            return target;
        }
        return new Base<>(hostVar(extern));
    }

    private V hostVar(ExternVar extern) {
        var var = evalVars.fromExtern(extern).orElseThrow(() -> new ModelException(
                ModelException.Kind.UNKNOWN_DOMAIN_VARIABLE, extern + " is not a variable of the domain"));
        if (baseVars.contains(var) || fixedVars.containsKey(var)) {
            return var;
        }
        var fixed = evalVars.fix(var);
        if (fixed.isEmpty()) {
            throw new ModelException(ModelException.Kind.UNKNOWN_DOMAIN_VARIABLE,
                    extern + " is neither free nor fixed in this domain");
        }
        fixedVars.put(var, fixed.get());
        return var;
    }

    private void enqueue(ProblemVar<V> var, StoredScript script, ConstraintValue definition) {
        if (definition == null) {
            throw new IllegalStateException("no definition recorded for " + var);
        }
        if (queued.add(var)) {
            pending.add(new PendingDefinition<>(var, script, definition));
        }
    }

    private void drainPending() {
        while (!pending.isEmpty()) {
            var next = pending.poll();
            List<Constraint<ProblemVar<V>>> definition = new ArrayList<>();
            for (var constraint : next.value().constraints()) {
                definition.add(translate(next.script(), constraint.constraint()));
            }
            var reified = next.var();
            var reification = Reifier.reify(reified, definition, index -> new Helper<>(reified, index));
            definitions.put(reified, reification.inequalities());
            helpers.addAll(reification.helpers());
            for (var constraint : reification.constraints()) {
                constraints.add(new DescribedConstraint<>(constraint, new ConstraintDesc.Reification<>(reified)));
            }
            log.debug("linearized {} into {} constraints", reified, reification.constraints().size());
        }
    }

    private static boolean isHostType(Type type, TypeSchema schema) {
        if (type.equals(Type.INT) || type.equals(Type.BOOL) || type.equals(Type.STRING)) {
            return true;
        }
        if (type instanceof Type.ObjectType o) {
            return schema.hasType(o.name());
        }
        if (type instanceof Type.ListType l) {
            return isHostType(l.element(), schema);
        }
        return false;
    }
}
