package com.mirrorup.mirror.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorup.mirror.http.StatusHttpClient;
import com.mirrorup.mirror.model.HttpFetchResult;
import com.mirrorup.mirror.model.MirrorCatalog;
import com.mirrorup.mirror.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class MirrorStatusService {
    private static final Logger log = LoggerFactory.getLogger(MirrorStatusService.class);

    private final StatusHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public MirrorStatusService(StatusHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Downloads and parses the mirror status document.
     *
     * @throws StatusFetchException when the document could not be retrieved, after retries
     * @throws StatusParseException when the body is not a valid status document
     */
    public MirrorCatalog fetch(String sourceUrl) {
        HttpFetchResult result = httpClient.get(sourceUrl);
        if (StatusHttpClient.DECODE_ERROR.equals(result.errorCode())) {
            throw new StatusParseException(
                "Malformed mirrors status document from `" + sourceUrl + "`: " + result.errorMessage(),
                null
            );
        }
        if (!result.isSuccessful()) {
            String reason = result.errorCode() != null
                ? ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage())
                : ReasonCodeClassifier.fromHttpStatus(result.statusCode());
            String detail = result.errorCode() != null
                ? result.errorMessage()
                : "HTTP " + result.statusCode();
            throw new StatusFetchException(
                "Failed to fetch mirrors status from `" + sourceUrl + "`: " + reason
                    + (detail == null ? "" : " (" + detail + ")"),
                reason
            );
        }

        MirrorCatalog catalog = parse(sourceUrl, result.bodyBytes());
        log.info(
            "Fetched mirrors status: version={}, last_check={}, num_checks={}, check_frequency={}, cutoff={}, mirrors={}",
            catalog.version(),
            catalog.lastCheck(),
            catalog.numChecks(),
            catalog.checkFrequency(),
            catalog.cutoff(),
            catalog.urls().size()
        );
        return catalog;
    }

    MirrorCatalog parse(String sourceUrl, byte[] body) {
        if (body == null || body.length == 0) {
            throw new StatusParseException("Empty mirrors status document from `" + sourceUrl + "`", null);
        }
        MirrorCatalog catalog;
        try {
            catalog = objectMapper.readValue(body, MirrorCatalog.class);
        } catch (IOException e) {
            throw new StatusParseException("Malformed mirrors status document from `" + sourceUrl + "`", e);
        }
        if (catalog == null) {
            throw new StatusParseException("Mirrors status document from `" + sourceUrl + "` is null", null);
        }
        return catalog;
    }
}
