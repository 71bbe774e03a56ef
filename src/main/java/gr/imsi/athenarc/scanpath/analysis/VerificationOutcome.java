package gr.imsi.athenarc.scanpath.analysis;

/** Classification of a scanpath by the verification automaton. **/
public enum VerificationOutcome {
    COMPLETE,    // Accepted: verification opened and closed by a final overview
    INCOMPLETE,  // Rejected: verification absent, unfinished or out of order
}
