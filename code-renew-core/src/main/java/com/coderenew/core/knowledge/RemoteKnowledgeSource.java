package com.coderenew.core.knowledge;

import com.coderenew.core.model.DeprecatedItem;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remote service publishing deprecation records.
 *
 * <p>Implementations report every transport or payload problem as an
 * {@link IOException}; {@link HybridKnowledgeBase} turns those into local-only results.
 *
 * @see HttpRemoteKnowledgeSource
 * @since 1.0.0
 */
public interface RemoteKnowledgeSource {

    /**
     * Fetches deprecation records for a version range.
     *
     * @param from lower version bound
     * @param to upper version bound
     * @return records published by the service
     * @throws IOException on timeout, non-2xx response or malformed payload
     */
    List<DeprecatedItem> fetchDeprecations(String from, String to) throws IOException;

    /**
     * Fetches free-form detail about a single identifier.
     *
     * @param name identifier name
     * @return detail object, or empty if the service does not know the identifier
     * @throws IOException on transport failure
     */
    Optional<Map<String, Object>> fetchFunctionInfo(String name) throws IOException;
}
