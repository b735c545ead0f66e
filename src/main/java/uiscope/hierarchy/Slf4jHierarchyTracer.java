package uiscope.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HierarchyTracer} that writes every trace point to SLF4J at DEBUG.
 * The CLI installs it; set the {@code uiscope} logger to DEBUG to see every attachment.
 */
public class Slf4jHierarchyTracer implements HierarchyTracer {

    private static final Logger log = LoggerFactory.getLogger(Slf4jHierarchyTracer.class);

    @Override
    public void nodeAttached(HierarchyNode child, HierarchyNode parent, AttachmentKind kind) {
        log.debug("[{}] {} -> {}", kind, parent.getId(), child.getId());
    }

    @Override
    public void fallbackTriggered(String stage, String detail) {
        log.debug("[fallback:{}] {}", stage, detail);
    }

    @Override
    public void rootSelected(HierarchyNode root, int candidateCount) {
        log.debug("[root] {} chosen from {} candidate(s)", root.getId(), candidateCount);
    }
}
