package com.pharmanio.duty.ingestion.source;

import java.util.Map;

public interface DutySourceClient {

    /**
     * Downloads {@code url} and returns its decoded body.
     *
     * @throws com.pharmanio.common.exception.IngestionFailureException with reason FETCH_FAILED on
     *         network failure, timeout, non-2xx status or an oversized body
     */
    FetchedPage fetch(String url, Map<String, String> headers);

    record FetchedPage(String body, String contentType, String finalUrl, int statusCode) {}
}
