package tollgate.core.model.state;

import java.util.Map;
import java.util.Objects;

/**
 * A proposed change to one addressable resource, pairing its current and proposed content.
 *
 * @param path the address of the resource
 * @param originalContent the content at the address when the diff was generated (empty if none)
 * @param proposedContent the content the change would write
 * @param metadata free-form attributes, e.g. the originating tool
 */
public record Diff(String path, String originalContent, String proposedContent, Map<String, String> metadata) {

    public Diff {
        Objects.requireNonNull(path, "path cannot be null");
        originalContent = originalContent != null ? originalContent : "";
        proposedContent = proposedContent != null ? proposedContent : "";
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Returns whether applying this diff would change the resource.
     *
     * @return true if original and proposed content differ
     */
    public boolean changesContent() {
        return !originalContent.equals(proposedContent);
    }
}
