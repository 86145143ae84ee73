package com.repoatlas.core.impact;

import com.repoatlas.core.model.Cycle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Strongly-connected-component search (Tarjan, iterative so deep graphs cannot overflow
 * the stack) plus extraction of one representative cycle per component.
 */
public final class CycleDetector {

    private CycleDetector() {} // utility class

    /**
     * Finds every cycle component and reports its shortest closed path through the
     * component's smallest member. Results are ordered by their first member.
     *
     * @param adjacency          node to sorted successors; every successor must also be a key
     * @param directCycleMaxLength longest cycle still classified as {@link Cycle.Kind#DIRECT}
     */
    public static List<Cycle> detect(SortedMap<String, ? extends Collection<String>> adjacency, int directCycleMaxLength) {
        var cycles = new ArrayList<Cycle>();
        for (List<String> component : stronglyConnectedComponents(adjacency)) {
            boolean selfLoop = component.size() == 1
                    && successorsOf(adjacency, component.get(0)).contains(component.get(0));
            if (component.size() < 2 && !selfLoop) {
                continue;
            }
            List<String> path = shortestCycleThrough(component.get(0), new HashSet<>(component), adjacency);
            Cycle.Kind kind = path.size() <= directCycleMaxLength ? Cycle.Kind.DIRECT : Cycle.Kind.INDIRECT;
            cycles.add(new Cycle(List.copyOf(path), kind, component.size()));
        }
        return cycles;
    }

    /**
     * Tarjan's algorithm. Each component is returned sorted; components are ordered by
     * their smallest member.
     */
    public static List<List<String>> stronglyConnectedComponents(SortedMap<String, ? extends Collection<String>> adjacency) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        var components = new ArrayList<List<String>>();
        int counter = 0;

        for (String start : adjacency.keySet()) {
            if (index.containsKey(start)) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            index.put(start, counter);
            lowLink.put(start, counter);
            counter++;
            stack.push(start);
            onStack.add(start);
            work.push(new Frame(start, successors(adjacency, start)));

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, successors(adjacency, next)));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(next)));
                    }
                    continue;
                }

                work.pop();
                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    var component = new TreeSet<String>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node));
                    components.add(new ArrayList<>(component));
                }
                if (!work.isEmpty()) {
                    Frame parent = work.peek();
                    lowLink.put(parent.node, Math.min(lowLink.get(parent.node), lowLink.get(frame.node)));
                }
            }
        }
        components.sort((a, b) -> a.get(0).compareTo(b.get(0)));
        return Collections.unmodifiableList(components);
    }

    /** Breadth-first search inside the component for the nearest node that closes back to {@code start}. */
    static List<String> shortestCycleThrough(String start, Set<String> component,
                                             SortedMap<String, ? extends Collection<String>> adjacency) {
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        parent.put(start, null);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            Collection<String> next = successorsOf(adjacency, node);
            if (next.contains(start)) {
                var path = new ArrayList<String>();
                for (String at = node; at != null; at = parent.get(at)) {
                    path.add(at);
                }
                Collections.reverse(path);
                return path;
            }
            for (String successor : new TreeSet<>(next)) {
                if (component.contains(successor) && !parent.containsKey(successor)) {
                    parent.put(successor, node);
                    queue.add(successor);
                }
            }
        }
        return List.of(start);
    }

    private static Iterator<String> successors(SortedMap<String, ? extends Collection<String>> adjacency, String node) {
        return new TreeSet<>(successorsOf(adjacency, node)).iterator();
    }

    private static Collection<String> successorsOf(SortedMap<String, ? extends Collection<String>> adjacency, String node) {
        Collection<String> successors = adjacency.get(node);
        return successors != null ? successors : List.of();
    }

    private record Frame(String node, Iterator<String> successors) {}
}
