package io.mersel.services.xsltanalyzer.infrastructure;

import io.mersel.services.xsltanalyzer.application.models.ExecutionGraph;
import io.mersel.services.xsltanalyzer.application.models.PathEnumerationLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Yürütme grafiğinde başlangıç düğümlerinden sonlanan tüm yolları derinlik öncelikli numaralandırır.
 * <p>
 * Bir yol, ardılı olmayan bir düğümde veya mevcut yolda zaten bulunan bir düğüme
 * ulaşıldığında biter; tekrar eden düğüm yola bir kez eklenir. Ardıllar graf sırasıyla
 * gezilir, sonuç deterministiktir.
 * <p>
 * Numaralandırma yığın tabanlıdır ve yol sayısı veya süre sınırı aşıldığında erken durur.
 */
final class ExecutionPathEnumerator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPathEnumerator.class);

    record Enumeration(List<List<Integer>> paths, boolean truncated) {
    }

    Enumeration enumerate(ExecutionGraph graph, List<Integer> startNodes, PathEnumerationLimits limits) {
        long deadline = deadline(System.nanoTime(), limits.timeoutMs());
        List<List<Integer>> paths = new ArrayList<>();
        boolean truncated = false;

        for (int start : startNodes) {
            if (limitReached(paths, limits, deadline)) {
                truncated = true;
                break;
            }
            if (!walk(graph, start, paths, limits, deadline)) {
                truncated = true;
                break;
            }
        }

        if (truncated) {
            log.warn("Yol numaralandırma sınıra ulaştı, kısmi sonuç raporlanıyor: {} yol (maxPaths={}, timeoutMs={})",
                    paths.size(), limits.maxPaths(), limits.timeoutMs());
        }
        return new Enumeration(paths, truncated);
    }

    /**
     * @return numaralandırma tamamlandıysa {@code true}, sınır nedeniyle kesildiyse {@code false}
     */
    private boolean walk(ExecutionGraph graph, int start, List<List<Integer>> paths,
                         PathEnumerationLimits limits, long deadline) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<Integer> path = new ArrayList<>();
        Set<Integer> onPath = new HashSet<>();

        enter(graph, start, stack, path, onPath, paths);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            List<Integer> successors = graph.node(top.node).successors();

            if (top.next >= successors.size()) {
                stack.pop();
                path.remove(path.size() - 1);
                onPath.remove(top.node);
                continue;
            }

            if (limitReached(paths, limits, deadline)) {
                return false;
            }

            int successor = successors.get(top.next++);
            if (onPath.contains(successor)) {
                List<Integer> closed = new ArrayList<>(path);
                closed.add(successor);
                paths.add(List.copyOf(closed));
            } else {
                enter(graph, successor, stack, path, onPath, paths);
            }
        }
        return true;
    }

    private static void enter(ExecutionGraph graph, int node, Deque<Frame> stack, List<Integer> path,
                              Set<Integer> onPath, List<List<Integer>> paths) {
        path.add(node);
        if (graph.node(node).successors().isEmpty()) {
            paths.add(List.copyOf(path));
            path.remove(path.size() - 1);
            return;
        }
        onPath.add(node);
        stack.push(new Frame(node));
    }

    private static boolean limitReached(List<List<Integer>> paths, PathEnumerationLimits limits, long deadline) {
        return paths.size() >= limits.maxPaths() || System.nanoTime() - deadline > 0;
    }

    /**
     * Süre sınırı en fazla {@code Long.MAX_VALUE / 2} nanosaniye kabul edilir; böylece
     * {@code nanoTime() - deadline} farkı taşmadan karşılaştırılabilir.
     */
    static long deadline(long now, long timeoutMs) {
        long timeoutNanos = Math.min(TimeUnit.MILLISECONDS.toNanos(timeoutMs), Long.MAX_VALUE / 2);
        return now + timeoutNanos;
    }

    private static final class Frame {
        private final int node;
        private int next;

        Frame(int node) {
            this.node = node;
        }
    }
}
