package net.upcscan.support.debug;

import net.upcscan.model.scan.Candidate;

/**
 * Side channel receiving every candidate image the pipeline generates.
 *
 * <p>Implementations must not retain or modify the candidate's image; the
 * orchestrator releases it right after the decode attempt. Failures are the
 * sink's own concern and never influence which candidate runs next.</p>
 */
@FunctionalInterface
public interface DebugSink {

    /**
     * @param scanId identifier shared by all candidates of one scan
     * @param sequence 1-based position of the candidate within the scan
     * @param candidate the candidate about to be decoded
     */
    void accept(String scanId, int sequence, Candidate candidate);
}
