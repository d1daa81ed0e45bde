package in.co.vedicwisdom.services;

/**
 * Failure kinds of a calendar or recommendation computation. Every one of them aborts the whole operation.
 */
public enum ErrorCode {
    /** The ephemeris provider could not be reached or returned invalid data. */
    EPHEMERIS_UNAVAILABLE,
    /** The date has no valid mapping, e.g. the sun does not rise at that latitude. */
    INVALID_DATE,
    /** No verse is available, so not even the default verse can be returned. */
    CORPUS_EMPTY
}
