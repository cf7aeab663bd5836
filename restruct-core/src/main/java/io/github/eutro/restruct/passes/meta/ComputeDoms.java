package io.github.eutro.restruct.passes.meta;

import io.github.eutro.restruct.ext.CommonExts;
import io.github.eutro.restruct.ext.MetadataState;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.graph.RegionGraph;
import io.github.eutro.restruct.passes.InPlaceIRPass;

import java.util.*;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/

/**
 * Computes the dominator tree, or post-dominator tree, of a region graph,
 * attaching it as {@link CommonExts#DOM_TREE} or {@link CommonExts#POST_DOM_TREE}.
 */
public class ComputeDoms implements InPlaceIRPass<RegionGraph> {
    /**
     * An instance of this pass computing dominators.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms(false);
    /**
     * An instance of this pass computing post-dominators.
     */
    public static final ComputeDoms POST_INSTANCE = new ComputeDoms(true);

    private final boolean post;

    private ComputeDoms(boolean post) {
        this.post = post;
    }

    @Override
    public void runInPlace(RegionGraph graph) {
        DomTree tree = compute(graph, post);
        graph.attachExt(post ? CommonExts.POST_DOM_TREE : CommonExts.DOM_TREE, tree);
        graph.getExtOrThrow(CommonExts.METADATA_STATE).validate(post ? MetadataState.POST_DOMS : MetadataState.DOMS);
    }

    private static Collection<Node> next(Node node, boolean post) {
        return post ? node.getPredecessors() : node.getSuccessors();
    }

    static DomTree compute(RegionGraph graph, boolean post) {
        List<Node> roots = post ? graph.exitNodes() : Collections.singletonList(graph.getEntry());
        boolean virtualRoot = roots.size() != 1;

        // vertex 1 is the root, virtual or not; 0 is "none"
        List<Node> vertices = new ArrayList<>();
        vertices.add(null);
        if (virtualRoot) vertices.add(null);
        Map<Node, Integer> index = new HashMap<>();
        Deque<Node> workList = new ArrayDeque<>();
        for (Node root : roots) {
            index.put(root, vertices.size());
            vertices.add(root);
            workList.add(root);
        }
        while (!workList.isEmpty()) {
            Node node = workList.pop();
            for (Node n : next(node, post)) {
                if (!index.containsKey(n)) {
                    index.put(n, vertices.size());
                    vertices.add(n);
                    workList.add(n);
                }
            }
        }

        class Runner {
            final int size = vertices.size() - 1;
            int n = 0;
            final int[][] succ = new int[size + 1][];
            final int[] dom = new int[size + 1];
            final int[] parent = new int[size + 1];
            final int[] ancestor = new int[size + 1];
            final int[] child = new int[size + 1];
            final int[] vertex = new int[size + 1];
            final int[] label = new int[size + 1];
            final int[] semi = new int[size + 1];
            final int[] sz = new int[size + 1];
            @SuppressWarnings("unchecked")
            final Set<Integer>[] pred = new Set[size + 1];
            @SuppressWarnings("unchecked")
            final Set<Integer>[] bucket = new Set[size + 1];

            void dfs(int v) {
                semi[v] = ++n;
                vertex[n] = label[v] = v;
                ancestor[v] = child[v] = 0;
                sz[v] = 1;
                for (int w : succ[v]) {
                    if (semi[w] == 0) {
                        parent[w] = v;
                        dfs(w);
                    }
                    pred[w].add(v);
                }
            }

            void compress(int v) {
                if (ancestor[ancestor[v]] != 0) {
                    compress(ancestor[v]);
                    if (semi[label[ancestor[v]]] < semi[label[v]]) {
                        label[v] = label[ancestor[v]];
                    }
                    ancestor[v] = ancestor[ancestor[v]];
                }
            }

            int eval(int v) {
                if (ancestor[v] == 0) return label[v];
                compress(v);
                return semi[label[ancestor[v]]] >= semi[label[v]]
                        ? label[v]
                        : label[ancestor[v]];
            }

            void link(int v, int w) {
                int s = w;
                while (semi[label[w]] < semi[label[child[s]]]) {
                    if (sz[s] + sz[child[child[s]]] >= 2 * sz[child[s]]) {
                        ancestor[child[s]] = s;
                        child[s] = child[child[s]];
                    } else {
                        sz[child[s]] = sz[s];
                        s = ancestor[s] = child[s];
                    }
                }
                label[s] = label[w];
                sz[v] += sz[w];
                if (sz[v] < 2 * sz[w]) {
                    int t = s;
                    s = child[v];
                    child[v] = t;
                }
                while (s != 0) {
                    ancestor[s] = v;
                    s = child[s];
                }
            }

            void run() {
                if (virtualRoot) {
                    succ[1] = new int[roots.size()];
                    for (int j = 0; j < roots.size(); j++) {
                        succ[1][j] = index.get(roots.get(j));
                    }
                }
                for (int i = virtualRoot ? 2 : 1; i <= size; i++) {
                    Collection<Node> targets = next(vertices.get(i), post);
                    succ[i] = new int[targets.size()];
                    int j = 0;
                    for (Node target : targets) {
                        succ[i][j++] = index.get(target);
                    }
                }
                for (int v = 1; v <= size; ++v) {
                    pred[v] = new HashSet<>();
                    bucket[v] = new HashSet<>();
                }
                dfs(1);
                sz[0] = label[0] = semi[0] = 0;
                int u, w;
                for (int i = n; i >= 2; i--) {
                    w = vertex[i];
                    for (int v : pred[w]) {
                        u = eval(v);
                        if (semi[u] < semi[w]) {
                            semi[w] = semi[u];
                        }
                    }
                    bucket[vertex[semi[w]]].add(w);
                    link(parent[w], w);
                    for (int v : bucket[parent[w]]) {
                        u = eval(v);
                        dom[v] = semi[u] < semi[v] ? u : parent[w];
                    }
                    bucket[parent[w]].clear();
                }
                for (int i = 2; i <= n; ++i) {
                    w = vertex[i];
                    if (dom[w] != vertex[semi[w]]) {
                        dom[w] = dom[dom[w]];
                    }
                }
                dom[1] = 0;
            }
        }
        Runner runner = new Runner();
        if (runner.size > 0) runner.run();

        Map<Node, Node> idoms = new HashMap<>();
        Map<Node, List<Node>> children = new HashMap<>();
        List<Node> treeRoots = new ArrayList<>();
        if (!virtualRoot) treeRoots.add(vertices.get(1));
        for (int i = 2; i < vertices.size(); i++) {
            Node node = vertices.get(i);
            int d = runner.dom[i];
            if (d == 1 && virtualRoot) {
                treeRoots.add(node);
            } else {
                Node idom = vertices.get(d);
                idoms.put(node, idom);
                children.computeIfAbsent(idom, k -> new ArrayList<>()).add(node);
            }
        }
        return new DomTree(graph, post, treeRoots, idoms, children);
    }
}
