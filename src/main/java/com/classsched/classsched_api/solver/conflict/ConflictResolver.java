package com.classsched.classsched_api.solver.conflict;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classsched.classsched_api.exception.DataIntegrityException;
import com.classsched.classsched_api.solver.facts.FactStore;
import com.classsched.classsched_api.solver.facts.Unit;
import com.classsched.classsched_api.solver.facts.UnitKey;
import com.classsched.classsched_api.solver.facts.UnitPair;

/**
 * Precomputes the derived relations the search consumes: the transitive
 * closure of the joint relation and the teacher-sharing adjacency.
 */
public class ConflictResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConflictResolver.class);

    public ResolvedProblem resolve(FactStore facts) {
        List<Unit> units = facts.getUnits();
        Map<UnitKey, Integer> position = new HashMap<>();
        for (int i = 0; i < units.size(); i++) {
            position.put(units.get(i).getKey(), i);
        }

        int[] parent = new int[units.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (UnitPair joint : facts.getJoints()) {
            Integer a = position.get(joint.getFirst());
            Integer b = position.get(joint.getSecond());
            if (a == null || b == null) {
                throw new DataIntegrityException("Joint pair " + joint + " references an undefined unit.");
            }
            union(parent, a, b);
        }

        Map<Integer, List<Unit>> byRoot = new TreeMap<>();
        for (int i = 0; i < units.size(); i++) {
            byRoot.computeIfAbsent(find(parent, i), r -> new ArrayList<>()).add(units.get(i));
        }
        List<List<Unit>> memberLists = new ArrayList<>(byRoot.values());
        memberLists.sort((a, b) -> a.get(0).getKey().compareTo(b.get(0).getKey()));

        List<SchedulingGroup> groups = new ArrayList<>();
        Map<UnitKey, Integer> groupOf = new HashMap<>();
        for (List<Unit> members : memberLists) {
            checkJointMembers(members);
            SchedulingGroup group = new SchedulingGroup(groups.size(), members, facts.getSlotDomain());
            if (group.getFixedCount() > group.getNumClasses()) {
                throw new DataIntegrityException("Joint units " + group + " have " + group.getFixedCount()
                        + " fixed classes in total but only " + group.getNumClasses() + " classes per week.");
            }
            for (Unit unit : members) {
                groupOf.put(unit.getKey(), group.getIndex());
            }
            groups.add(group);
        }

        int[][] neighbours = new int[groups.size()][];
        for (SchedulingGroup group : groups) {
            List<Integer> shared = new ArrayList<>();
            for (SchedulingGroup other : groups) {
                if (other != group && group.sharesTeacherWith(other)) {
                    shared.add(other.getIndex());
                }
            }
            neighbours[group.getIndex()] = shared.stream().mapToInt(Integer::intValue).toArray();
        }

        logger.info("Resolved {} units into {} scheduling groups", units.size(), groups.size());
        return new ResolvedProblem(facts, groups, groupOf, neighbours);
    }

    private void checkJointMembers(List<Unit> members) {
        int numClasses = members.get(0).getNumClasses();
        for (Unit unit : members) {
            if (unit.getNumClasses() != numClasses) {
                throw new DataIntegrityException("Joint units " + members.get(0).getKey() + " and " + unit.getKey()
                        + " need a different number of weekly classes (" + numClasses + " vs "
                        + unit.getNumClasses() + ").");
            }
        }
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) {
            parent[Math.max(ra, rb)] = Math.min(ra, rb);
        }
    }
}
