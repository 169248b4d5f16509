package tollgate.core.model.state;

import java.util.Objects;

/**
 * A change an optimization tool wants to make, before it has been diffed.
 *
 * @param path the target address
 * @param proposedContent the content to write
 * @param toolName the identifier of the tool proposing the change
 */
public record ProposedChange(String path, String proposedContent, String toolName) {

    public ProposedChange {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(toolName, "toolName cannot be null");
        proposedContent = proposedContent != null ? proposedContent : "";
    }
}
