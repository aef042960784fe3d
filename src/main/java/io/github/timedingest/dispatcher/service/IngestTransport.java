package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.domain.model.IngestCommand;
import io.github.timedingest.dispatcher.domain.model.IngestSubmission;

/**
 * Live connection to the analytical store. Implementations must be safe for concurrent {@link #submit} calls.
 */
public interface IngestTransport {

    IngestSubmission submit(IngestCommand command);
}
