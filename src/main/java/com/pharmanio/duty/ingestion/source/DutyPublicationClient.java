package com.pharmanio.duty.ingestion.source;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fetches the on-duty publication page from its fixed URL.
 */
@Component
public class DutyPublicationClient {

    private static final Map<String, String> HTML_ACCEPT = Map.of("Accept", "text/html,*/*;q=0.8");

    private final DutySourceClient dutySourceClient;
    private final String url;

    public DutyPublicationClient(
            DutySourceClient dutySourceClient,
            @Value("${pharmanio.ingestion.url:https://www.opham.com/urgence/pharmacie}") String url
    ) {
        this.dutySourceClient = dutySourceClient;
        this.url = url;
    }

    public DutySourceClient.FetchedPage fetch() {
        return dutySourceClient.fetch(url, HTML_ACCEPT);
    }

    public String url() {
        return url;
    }
}
