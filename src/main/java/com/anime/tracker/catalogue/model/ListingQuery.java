package com.anime.tracker.catalogue.model;

/**
 * One browse page of the catalogue. Empty filters mean "any".
 */
public record ListingQuery(int page, String type, String status, String order) {
    public ListingQuery {
        if (page < 1) {
            throw new IllegalArgumentException("Listing page must be >= 1, got " + page);
        }
        type = type == null ? "" : type.trim();
        status = status == null ? "" : status.trim();
        order = order == null ? "" : order.trim();
    }

    public static ListingQuery ofPage(int page) {
        return new ListingQuery(page, "", "", "");
    }

    /**
     * Inverse of {@link #keyId()}.
     */
    public static ListingQuery fromKeyId(String keyId) {
        String[] parts = keyId.split(":", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Malformed listing key: " + keyId);
        }
        return new ListingQuery(Integer.parseInt(parts[0].trim()), parts[1], parts[2], parts[3]);
    }

    public String keyId() {
        return page + ":" + type + ":" + status + ":" + order;
    }
}
