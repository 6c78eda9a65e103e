package nl.nfi.djlearn.diagnose;

public enum Mode {

    // mine candidates from the given inputs only
    LEARN,
    // mine candidates, then refine them with generated inputs
    EXPLAIN
}
