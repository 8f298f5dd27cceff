package ca.weblite.qrstudio;

/**
 * Entry point the interactive surface uses to ask for a new symbol.
 */
public interface RequestSubmitter {

    /**
     * Submits a request. Never blocks and is always accepted; an earlier request
     * that has not been picked up yet is discarded.
     *
     * @param request the request, never null
     */
    void submit(GenerationRequest request);
}
