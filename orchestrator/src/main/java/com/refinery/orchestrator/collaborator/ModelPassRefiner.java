package com.refinery.orchestrator.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.refinery.orchestrator.collaborator.ModelClient.Message;
import com.refinery.orchestrator.error.PassException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Runs one refinement pass as a single chat completion.
 *
 * The job's metadata may carry a "config" object; "instructions" is appended
 * to the system prompt and "temperature" is forwarded as-is.
 */
@Component
public class ModelPassRefiner implements PassRefiner {

    private static final Logger log = LoggerFactory.getLogger(ModelPassRefiner.class);

    private static final String SYSTEM_PROMPT = """
            You are a careful editor refining a document over several passes.
            Improve clarity, flow and correctness while keeping the author's meaning,
            voice and structure. Keep paragraphs separated by a blank line.
            Reply with the full refined document and nothing else.
            """;

    private final ModelClient client;

    public ModelPassRefiner(ModelClient client) {
        this.client = client;
    }

    @Override
    public String runPass(PassRequest request) {
        JsonNode config = request.config();
        String system = SYSTEM_PROMPT;
        if (config != null && config.hasNonNull("instructions")) {
            system = system + "\nAdditional instructions: " + config.get("instructions").asText();
        }
        Double temperature = config != null && config.hasNonNull("temperature")
                ? config.get("temperature").asDouble()
                : null;

        String user = "Pass " + request.passNumber() + " of " + request.totalPasses() + ".\n\n"
                + request.currentContent();

        try {
            String refined = client.complete(request.model(),
                    List.of(new Message("system", system), new Message("user", user)),
                    temperature);
            if (refined == null || refined.isBlank()) {
                throw PassException.transientFailure("Model returned an empty document");
            }
            return refined.strip();
        } catch (ModelClient.ModelApiException e) {
            log.warn("Model call failed for file {} pass {}: HTTP {}",
                    request.fileId(), request.passNumber(), e.statusCode());
            throw new PassException(e.isRetryable() ? PassException.Kind.TRANSIENT : PassException.Kind.FATAL,
                    e.getMessage(), e);
        } catch (IOException e) {
            throw new PassException(PassException.Kind.TRANSIENT, "Model endpoint unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PassException(PassException.Kind.TRANSIENT, "Model call interrupted", e);
        }
    }
}
