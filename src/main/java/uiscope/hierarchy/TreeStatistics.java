package uiscope.hierarchy;

/**
 * Aggregate counts over a built tree, for logs and the {@code tree} command.
 */
public final class TreeStatistics {

    private final int    totalNodes;
    private final int    maxDepth;
    private final int    leafNodes;
    private final int    containerNodes;
    private final int    clickableNodes;
    private final int    textNodes;
    private final int    hiddenNodes;
    private final int    semanticAttachments;
    private final int    adoptedNodes;
    private final double averageChildren;

    private TreeStatistics(int totalNodes, int maxDepth, int leafNodes, int containerNodes,
                           int clickableNodes, int textNodes, int hiddenNodes,
                           int semanticAttachments, int adoptedNodes, double averageChildren) {
        this.totalNodes          = totalNodes;
        this.maxDepth            = maxDepth;
        this.leafNodes           = leafNodes;
        this.containerNodes      = containerNodes;
        this.clickableNodes      = clickableNodes;
        this.textNodes           = textNodes;
        this.hiddenNodes         = hiddenNodes;
        this.semanticAttachments = semanticAttachments;
        this.adoptedNodes        = adoptedNodes;
        this.averageChildren     = averageChildren;
    }

    static TreeStatistics of(HierarchyAnalysisResult result) {
        int total = 0, leaves = 0, containers = 0, clickable = 0, text = 0, hidden = 0;
        int semantic = 0, adopted = 0, children = 0;
        for (HierarchyNode node : result.getNodeMap().values()) {
            total++;
            if (node.isLeaf()) leaves++; else containers++;
            if (node.getElement().isClickable()) clickable++;
            if (node.getElement().hasText()) text++;
            if (node.getElement().isHidden()) hidden++;
            if (node.getAttachment() == AttachmentKind.SEMANTIC) semantic++;
            if (node.getAttachment() == AttachmentKind.ADOPTED) adopted++;
            children += node.getChildren().size();
        }
        double avg = total > 0 ? (double) children / total : 0.0;
        return new TreeStatistics(total, result.getMaxDepth(), leaves, containers,
                clickable, text, hidden, semantic, adopted, avg);
    }

    public int    getTotalNodes()          { return totalNodes; }
    public int    getMaxDepth()            { return maxDepth; }
    public int    getLeafNodes()           { return leafNodes; }
    public int    getContainerNodes()      { return containerNodes; }
    public int    getClickableNodes()      { return clickableNodes; }
    public int    getTextNodes()           { return textNodes; }
    public int    getHiddenNodes()         { return hiddenNodes; }
    public int    getSemanticAttachments() { return semanticAttachments; }
    public int    getAdoptedNodes()        { return adoptedNodes; }
    public double getAverageChildren()     { return averageChildren; }

    @Override
    public String toString() {
        return String.format("nodes=%d depth=%d leaves=%d containers=%d clickable=%d text=%d hidden=%d "
                        + "semantic=%d adopted=%d avgChildren=%.2f",
                totalNodes, maxDepth, leafNodes, containerNodes, clickableNodes, textNodes,
                hiddenNodes, semanticAttachments, adoptedNodes, averageChildren);
    }
}
