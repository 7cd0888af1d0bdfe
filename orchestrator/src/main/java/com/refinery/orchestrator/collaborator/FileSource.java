package com.refinery.orchestrator.collaborator;

/**
 * Where the original (pass 0) content of a file comes from.
 */
public interface FileSource {

    /**
     * @throws FileSourceException if the file cannot be fetched
     */
    String fetchOriginal(String fileId);
}
