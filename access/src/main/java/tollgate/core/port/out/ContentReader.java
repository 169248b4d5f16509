package tollgate.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for reading the current content of an addressable resource.
 */
public interface ContentReader {

    /**
     * Read the content at an address.
     *
     * @param address the resource address
     * @return the content, or empty if nothing exists there or it cannot be read
     */
    Uni<Optional<String>> read(String address);
}
