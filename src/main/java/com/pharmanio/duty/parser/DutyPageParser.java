package com.pharmanio.duty.parser;

import com.pharmanio.duty.ingestion.model.ParsedDutyPage;

public interface DutyPageParser {

    /**
     * Extracts the validity period and the raw listings. Structural gaps in the markup
     * degrade to an absent period or fewer listings; this never throws for malformed input.
     */
    ParsedDutyPage parse(String html);
}
