package com.refinery.orchestrator.collaborator;

/**
 * The external collaborator that rewrites a document for one pass.
 */
public interface PassRefiner {

    /**
     * @return the refined content for this pass
     * @throws com.refinery.orchestrator.error.PassException TRANSIENT to request a retry,
     *         FATAL to fail the job at once
     */
    String runPass(PassRequest request);
}
