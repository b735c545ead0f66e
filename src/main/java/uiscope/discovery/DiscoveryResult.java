package uiscope.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Groupings produced by one discovery call.
 *
 * <p>An unknown target id or an empty hierarchy yields a result with empty
 * groupings, {@link #isFound()} false and an explanatory {@link #getMessage()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"requestedId", "found", "promoted", "message", "self",
        "parents", "children", "siblings", "recommended"})
public final class DiscoveryResult {

    private final String                  requestedId;
    private final DiscoveredElement       self;
    private final boolean                 promoted;
    private final List<DiscoveredElement> parents;
    private final List<DiscoveredElement> children;
    private final List<DiscoveredElement> siblings;
    private final List<DiscoveredElement> recommended;
    private final String                  message;

    DiscoveryResult(String requestedId,
                    DiscoveredElement self,
                    boolean promoted,
                    List<DiscoveredElement> parents,
                    List<DiscoveredElement> children,
                    List<DiscoveredElement> siblings,
                    List<DiscoveredElement> recommended,
                    String message) {
        this.requestedId = requestedId;
        this.self        = self;
        this.promoted    = promoted;
        this.parents     = List.copyOf(parents);
        this.children    = List.copyOf(children);
        this.siblings    = List.copyOf(siblings);
        this.recommended = List.copyOf(recommended);
        this.message     = message;
    }

    /** Empty result for a target that could not be analysed. */
    public static DiscoveryResult notFound(String requestedId, String message) {
        return new DiscoveryResult(requestedId, null, false,
                List.of(), List.of(), List.of(), List.of(), message);
    }

    /** Id the caller asked about, before any promotion. */
    public String getRequestedId() { return requestedId; }

    /** The analysed target; {@code null} when not found. */
    public DiscoveredElement getSelf() { return self; }

    public boolean isFound() { return self != null; }

    /** True when the requested element was replaced by its nearest clickable ancestor. */
    public boolean isPromoted() { return promoted; }

    public List<DiscoveredElement> getParents()     { return parents; }
    public List<DiscoveredElement> getChildren()    { return children; }
    public List<DiscoveredElement> getSiblings()    { return siblings; }
    public List<DiscoveredElement> getRecommended() { return recommended; }

    /** Explanation for an empty or unusual result; {@code null} otherwise. */
    public String getMessage() { return message; }

    public int totalDiscovered() {
        return parents.size() + children.size() + siblings.size();
    }

    @Override
    public String toString() {
        return String.format("DiscoveryResult{requested=%s, self=%s, promoted=%s, parents=%d, children=%d, siblings=%d, recommended=%d%s}",
                requestedId, self != null ? self.getId() : "none", promoted,
                parents.size(), children.size(), siblings.size(), recommended.size(),
                message != null ? ", message='" + message + "'" : "");
    }
}
