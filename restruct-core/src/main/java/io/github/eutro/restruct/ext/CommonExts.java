package io.github.eutro.restruct.ext;

import io.github.eutro.restruct.ast.AstTree;
import io.github.eutro.restruct.graph.Node;
import io.github.eutro.restruct.passes.meta.DomTree;

/**
 * Exts used by the restructuring engine itself.
 */
public class CommonExts {
    /**
     * The state of computed analyses of a {@link io.github.eutro.restruct.graph.RegionGraph}.
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * The dominator tree of a region graph, see {@link MetadataState#DOMS}.
     */
    public static final Ext<DomTree> DOM_TREE = Ext.create(DomTree.class, "DOM_TREE");

    /**
     * The post-dominator tree of a region graph, see {@link MetadataState#POST_DOMS}.
     */
    public static final Ext<DomTree> POST_DOM_TREE = Ext.create(DomTree.class, "POST_DOM_TREE");

    /**
     * The AST built from a region graph.
     */
    public static final Ext<AstTree> AST = Ext.create(AstTree.class, "AST");

    /**
     * Attached to nodes created by
     * {@link io.github.eutro.restruct.graph.RegionGraph#insertBulkNodes(java.util.Collection, Node)},
     * the node of the enclosing region they were copied from.
     */
    public static final Ext<Node> COPY_OF = Ext.create(Node.class, "COPY_OF");
}
