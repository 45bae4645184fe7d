package com.teamcode.backend.service;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency view of the "depends on" edges of an exercise, keyed by question id.
 */
final class DependencyGraph {

    private final Map<Long, Set<Long>> prerequisitesByQuestion = new HashMap<>();

    void addEdge(Long questionId, Long prerequisiteId) {
        prerequisitesByQuestion.computeIfAbsent(questionId, key -> new HashSet<>()).add(prerequisiteId);
    }

    /**
     * Whether following "depends on" edges from {@code from} reaches {@code target}.
     */
    boolean reaches(Long from, Long target) {
        Set<Long> visited = new HashSet<>();
        Deque<Long> stack = new ArrayDeque<>(List.of(from));
        while (!stack.isEmpty()) {
            Long current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            if (visited.add(current)) {
                Collection<Long> next = prerequisitesByQuestion.getOrDefault(current, Set.of());
                next.forEach(stack::push);
            }
        }
        return false;
    }

    /**
     * Adding {@code questionId -> prerequisiteId} closes a cycle when the prerequisite already
     * depends, directly or not, on the question.
     */
    boolean wouldCreateCycle(Long questionId, Long prerequisiteId) {
        return questionId.equals(prerequisiteId) || reaches(prerequisiteId, questionId);
    }
}
