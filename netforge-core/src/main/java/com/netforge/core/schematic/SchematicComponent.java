package com.netforge.core.schematic;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * A component placed in a schematic.
 *
 * <p>Every variant, whether it declares named ports or is a plain two-terminal
 * part, exposes its terminals through {@link #ports()}.
 */
public interface SchematicComponent {

    /**
     * Returns the reference designator, empty when none was assigned.
     *
     * @return refdes
     */
    String refdes();

    /**
     * Returns the template kind.
     *
     * @return kind
     */
    String kind();

    /**
     * Returns the value text.
     *
     * @return value, empty when none
     */
    String value();

    /**
     * Returns the ports in declaration order with absolute positions.
     *
     * @return ports
     */
    List<Port> ports();

    /**
     * Returns the nested schematic embedded in a chip instance.
     *
     * @return serialized snapshot, if this instance carries one
     */
    Optional<JsonNode> chipPayload();
}
