package com.pharmanio.duty.ingestion.model;

import java.util.List;

/**
 * One scraped table row. Lives for a single ingest run only.
 */
public record RawListing(String name, String address, String cityToken, List<String> contactNumbers) {

    public RawListing {
        name = name == null ? "" : name;
        address = address == null ? "" : address;
        cityToken = cityToken == null ? "" : cityToken;
        contactNumbers = contactNumbers == null ? List.of() : List.copyOf(contactNumbers);
    }

    public boolean isMatchable() {
        return !name.isBlank() && !cityToken.isBlank();
    }
}
