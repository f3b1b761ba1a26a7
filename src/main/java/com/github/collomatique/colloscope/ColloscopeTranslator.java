package com.github.collomatique.colloscope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.collomatique.colloscope.ColloscopeVar.GroupInSlot;
import com.github.collomatique.colloscope.ColloscopeVar.StudentInGroup;
import com.github.collomatique.problem.Solution;
import com.github.collomatique.problem.Translator;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ColloscopeTranslator implements Translator<ColloscopeVar, Colloscope> {

    private final ColloscopeData data;

    @Override
    public Colloscope translate(Solution<ColloscopeVar> solution) {
        if (!solution.isFeasable()) {
            throw new IllegalArgumentException("cannot read a colloscope from an infeasible solution: " + solution.blame());
        }
        Map<Group, List<Student>> members = new LinkedHashMap<>();
        Map<Week, Map<Slot, Group>> schedule = new HashMap<>();
        for (var group : data.groups()) {
            members.put(group, new ArrayList<>());
        }
        for (var var : solution.data()) {
            if (var instanceof StudentInGroup sig) {
                members.get(sig.group()).add(sig.student());
            } else if (var instanceof GroupInSlot gis) {
                var previous = schedule.computeIfAbsent(gis.week(), w -> new HashMap<>()).put(gis.slot(), gis.group());
                if (previous != null) {
                    throw new IllegalStateException("slot " + gis.slot() + " holds " + previous + " and " + gis.group()
                            + " in " + gis.week());
                }
            }
        }
        members.replaceAll((group, students) -> List.copyOf(students));
        schedule.replaceAll((week, slots) -> Map.copyOf(slots));
        return new Colloscope(members, schedule);
    }
}
