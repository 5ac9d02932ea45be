package com.contentforge.types.common;

/**
 * Global constants shared by every module.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public class Constants {

    /** Comma separator used when splitting configured lists. */
    public final static String SPLIT = ",";

    /** Separator between step name and message in the run error list. */
    public final static String ERROR_SEPARATOR = ": ";

    /** Minimum credibility score for a source to count as high quality. */
    public final static double HIGH_CREDIBILITY_THRESHOLD = 0.7D;

    /** Minimum brand voice score accepted by the consistency gate. */
    public final static double VOICE_SCORE_THRESHOLD = 0.7D;

    /** Minimum trimmed draft length, in characters. */
    public final static int MIN_DRAFT_LENGTH = 100;

}
