package com.coderenew.core.ai;

import com.coderenew.core.exception.AnalysisServiceException;

/**
 * Sends requests to the external code-analysis service.
 *
 * @see AnthropicMessagesTransport
 */
@FunctionalInterface
public interface AnalysisTransport {

    /**
     * Performs one blocking request.
     *
     * @param request request to send
     * @return service response
     * @throws AnalysisServiceException on any transport or service failure, classified for retry
     * @throws InterruptedException if interrupted while waiting for the response
     */
    AnalysisResponse send(AnalysisRequest request) throws InterruptedException;
}
