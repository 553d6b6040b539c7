package in.signaltruth.application.port.output;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Producer of signal declarations.
 *
 * Each call returns only declarations not returned before during this process's life,
 * so ingestion can poll it repeatedly. A declaration that cannot be parsed is reported
 * by the implementation and never returned.
 */
public interface SignalSource {

    List<SignalDocument> pollNew();

    /**
     * One parsed declaration.
     *
     * @param origin where it came from (file name), for logging
     * @param body parsed JSON document
     * @param modifiedAt fallback creation time when the document carries none
     */
    record SignalDocument(String origin, JsonNode body, Instant modifiedAt) {}
}
