package com.github.collomatique.colloscope;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.collomatique.colloscope.ColloscopeVar.GroupInSlot;
import com.github.collomatique.colloscope.ColloscopeVar.StudentInGroup;
import com.github.collomatique.eval.EvalObject;
import com.github.collomatique.eval.ExprValue;
import com.github.collomatique.eval.ExprValue.ObjectValue;
import com.github.collomatique.eval.IlpVar.ExternVar;
import com.github.collomatique.eval.ObjectEnv;
import com.github.collomatique.parser.Type;
import com.github.collomatique.problem.EvalVars;

/**
 * Variables of the colloscope domain. A student can only join groups of the subjects they
 * follow, a group can only take slots of its own subject.
 */
public class ColloscopeVars implements EvalVars<ColloscopeVar> {

    @Override
    public Map<String, List<Type>> fieldSchema() {
        return Map.of(
                "StudentInGroup", List.of(ColloscopeSchema.STUDENT, ColloscopeSchema.GROUP),
                "GroupInSlot", List.of(ColloscopeSchema.GROUP, ColloscopeSchema.SLOT, ColloscopeSchema.WEEK));
    }

    @Override
    public Set<ColloscopeVar> vars(ObjectEnv env) {
        Set<ColloscopeVar> vars = new LinkedHashSet<>();
        var groups = objects(env, "Group", Group.class);
        for (var student : objects(env, "Student", Student.class)) {
            for (var group : groups) {
                if (student.subjectIds().contains(group.subjectId())) {
                    vars.add(new StudentInGroup(student, group));
                }
            }
        }
        var weeks = objects(env, "Week", Week.class);
        for (var group : groups) {
            for (var slot : objects(env, "Slot", Slot.class)) {
                if (!slot.subjectId().equals(group.subjectId())) {
                    continue;
                }
                for (var week : weeks) {
                    vars.add(new GroupInSlot(group, slot, week));
                }
            }
        }
        return vars;
    }

    @Override
    public Optional<ColloscopeVar> fromExtern(ExternVar var) {
        var params = var.params();
        switch (var.name()) {
            case "StudentInGroup":
                if (params.size() == 2 && object(params.get(0)) instanceof Student s && object(params.get(1)) instanceof Group g) {
                    return Optional.of(new StudentInGroup(s, g));
                }
                return Optional.empty();
            case "GroupInSlot":
                if (params.size() == 3 && object(params.get(0)) instanceof Group g
                        && object(params.get(1)) instanceof Slot sl && object(params.get(2)) instanceof Week w) {
                    return Optional.of(new GroupInSlot(g, sl, w));
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    /** Already placed students are pinned, mismatched subjects are zero. */
    @Override
    public Optional<Boolean> fix(ColloscopeVar var) {
        if (var instanceof StudentInGroup sig) {
            var subjectId = sig.group().subjectId();
            if (!sig.student().subjectIds().contains(subjectId)) {
                return Optional.of(false);
            }
            var fixed = sig.student().fixedGroups().get(subjectId);
            return fixed == null ? Optional.empty() : Optional.of(fixed == sig.group().number());
        }
        var gis = (GroupInSlot) var;
        if (!gis.slot().subjectId().equals(gis.group().subjectId())) {
            return Optional.of(false);
        }
        return Optional.empty();
    }

    private static EvalObject object(ExprValue value) {
        return value instanceof ObjectValue o ? o.object() : null;
    }

    private static <T> List<T> objects(ObjectEnv env, String typeName, Class<T> type) {
        return env.objectsWithType(typeName).stream().map(type::cast).toList();
    }
}
