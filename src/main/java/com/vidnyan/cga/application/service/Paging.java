package com.vidnyan.cga.application.service;

import com.vidnyan.cga.application.error.GraphQueryException;
import com.vidnyan.cga.application.port.in.ToolResponse;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

/**
 * Offset pagination with opaque cursors.
 */
final class Paging {

    private static final String PREFIX = "offset:";

    private Paging() {
    }

    record Page<T>(List<T> items, ToolResponse.Pagination pagination) {}

    static <T> Page<T> page(List<T> all, String cursor, int limit) {
        int offset = decode(cursor);
        if (offset > all.size()) {
            throw GraphQueryException.invalidCursor(cursor);
        }
        int end = Math.min(all.size(), offset + limit);
        List<T> items = List.copyOf(all.subList(offset, end));
        boolean hasMore = end < all.size();
        return new Page<>(items, new ToolResponse.Pagination(all.size(), items.size(), offset, hasMore,
                hasMore ? encode(end) : null));
    }

    static String encode(int offset) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString((PREFIX + offset).getBytes(StandardCharsets.UTF_8));
    }

    static int decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return 0;
        }
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            if (!decoded.startsWith(PREFIX)) {
                throw GraphQueryException.invalidCursor(cursor);
            }
            int offset = Integer.parseInt(decoded.substring(PREFIX.length()));
            if (offset < 0) {
                throw GraphQueryException.invalidCursor(cursor);
            }
            return offset;
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw GraphQueryException.invalidCursor(cursor);
        }
    }
}
