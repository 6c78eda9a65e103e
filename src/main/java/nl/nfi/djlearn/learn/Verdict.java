package nl.nfi.djlearn.learn;

public enum Verdict {
    FAILING,
    PASSING,
    UNDEFINED
}
