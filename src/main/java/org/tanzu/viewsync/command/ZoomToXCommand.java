package org.tanzu.viewsync.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Zooms every viewer in the session to a horizontal range.
 */
public final class ZoomToXCommand extends ViewerCommand {

    public static final String TYPE = "zoomToX";

    private final BigDecimal left;
    private final BigDecimal right;

    private ZoomToXCommand(BigDecimal left, BigDecimal right, Instant timestamp) {
        super(timestamp);
        this.left = left;
        this.right = right;
    }

    public static ZoomToXCommand of(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            throw new CommandValidationException("Invalid zoom bounds. Expected { left: number, right: number }");
        }
        if (left.compareTo(right) >= 0) {
            throw new CommandValidationException("Left bound must be less than right bound");
        }
        return new ZoomToXCommand(left, right, Instant.now());
    }

    /**
     * Reads {@code left} and {@code right} from a request body. Both must be JSON numbers;
     * numeric strings are rejected.
     */
    public static ZoomToXCommand fromJson(JsonNode body) {
        BigDecimal left = numberField(body, "left");
        BigDecimal right = numberField(body, "right");
        if (left == null || right == null) {
            throw new CommandValidationException("Invalid zoom bounds. Expected { left: number, right: number }");
        }
        return of(left, right);
    }

    public BigDecimal getLeft() {
        return left;
    }

    public BigDecimal getRight() {
        return right;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void writePayload(ObjectNode frame) {
        ObjectNode bounds = frame.putObject("bounds");
        bounds.put("left", left);
        bounds.put("right", right);
    }
}
