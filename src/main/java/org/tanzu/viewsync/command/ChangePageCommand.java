package org.tanzu.viewsync.command;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Moves every viewer in the session to the given 1-based page.
 */
public final class ChangePageCommand extends ViewerCommand {

    public static final String TYPE = "changePage";

    private final int page;

    private ChangePageCommand(int page, Instant timestamp) {
        super(timestamp);
        this.page = page;
    }

    public static ChangePageCommand of(int page) {
        if (page < 1) {
            throw new CommandValidationException("Invalid page number");
        }
        return new ChangePageCommand(page, Instant.now());
    }

    /**
     * Parses a page number taken from the request path.
     *
     * @param pageValue The raw path segment
     * @return The validated command
     * @throws CommandValidationException if the value is not an integer of at least 1
     */
    public static ChangePageCommand parse(String pageValue) {
        if (pageValue == null) {
            throw new CommandValidationException("Invalid page number");
        }
        try {
            return of(Integer.parseInt(pageValue.trim()));
        } catch (NumberFormatException e) {
            throw new CommandValidationException("Invalid page number");
        }
    }

    public int getPage() {
        return page;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void writePayload(ObjectNode frame) {
        frame.put("page", page);
    }
}
