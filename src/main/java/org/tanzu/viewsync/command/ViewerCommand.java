package org.tanzu.viewsync.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A validated instruction that every viewer in a session applies to its local state.
 *
 * Instances are immutable and only built through the factories of the concrete
 * command types, which reject out-of-range input. Downstream code never re-validates.
 */
public abstract class ViewerCommand {

    private final Instant timestamp;

    protected ViewerCommand(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Wire name of this command, e.g. {@code changePage}.
     */
    public abstract String getType();

    /**
     * Writes the command specific fields into the outgoing frame.
     *
     * @param frame The JSON object being built for the frame
     */
    public abstract void writePayload(ObjectNode frame);

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Reads a numeric field as a {@link BigDecimal}.
     *
     * @return The value, or null when the field is missing, not a JSON number, or not finite
     */
    protected static BigDecimal numberField(JsonNode body, String field) {
        JsonNode value = body != null ? body.get(field) : null;
        if (value == null || !value.isNumber()) {
            return null;
        }
        // 1e400 parses to an infinite double
        if (value.isFloatingPointNumber() && !value.isBigDecimal() && !Double.isFinite(value.doubleValue())) {
            return null;
        }
        return value.decimalValue();
    }
}
