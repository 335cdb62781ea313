package com.buildmender.llm;

import com.buildmender.core.diagnostics.DiagnosticExcerpt;
import com.buildmender.core.proposal.TargetFile;

import java.util.Map;

/**
 * External fix-suggestion capability, consulted once per failed build.
 *
 * Stateless from the caller's view and possibly nondeterministic. The raw text
 * it returns is interpreted only by FixResponseParser. Callers construct the
 * oracle and pass it to each repair session; nothing looks it up globally.
 */
public interface FixOracle {

    /**
     * @param diagnostic      excerpt of the failed build's output
     * @param currentContents current text of each configuration file ("" when absent)
     * @return the oracle's raw answer
     * @throws OracleTimeoutException no answer within the call timeout
     * @throws OracleException        the call failed
     * @throws InterruptedException   the caller was interrupted while waiting
     */
    String propose(DiagnosticExcerpt diagnostic, Map<TargetFile, String> currentContents)
            throws OracleTimeoutException, OracleException, InterruptedException;
}
