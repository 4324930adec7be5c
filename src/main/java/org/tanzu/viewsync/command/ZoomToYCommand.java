package org.tanzu.viewsync.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Zooms every viewer in the session to a vertical range.
 */
public final class ZoomToYCommand extends ViewerCommand {

    public static final String TYPE = "zoomToY";

    private final BigDecimal top;
    private final BigDecimal bottom;

    private ZoomToYCommand(BigDecimal top, BigDecimal bottom, Instant timestamp) {
        super(timestamp);
        this.top = top;
        this.bottom = bottom;
    }

    public static ZoomToYCommand of(BigDecimal top, BigDecimal bottom) {
        if (top == null || bottom == null) {
            throw new CommandValidationException("Invalid zoom bounds. Expected { top: number, bottom: number }");
        }
        if (top.compareTo(bottom) >= 0) {
            throw new CommandValidationException("Top bound must be less than bottom bound");
        }
        return new ZoomToYCommand(top, bottom, Instant.now());
    }

    public static ZoomToYCommand fromJson(JsonNode body) {
        BigDecimal top = numberField(body, "top");
        BigDecimal bottom = numberField(body, "bottom");
        if (top == null || bottom == null) {
            throw new CommandValidationException("Invalid zoom bounds. Expected { top: number, bottom: number }");
        }
        return of(top, bottom);
    }

    public BigDecimal getTop() {
        return top;
    }

    public BigDecimal getBottom() {
        return bottom;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void writePayload(ObjectNode frame) {
        ObjectNode bounds = frame.putObject("bounds");
        bounds.put("top", top);
        bounds.put("bottom", bottom);
    }
}
