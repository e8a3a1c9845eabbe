package dev.resumescanner.model;

/**
 * A date range found in resume text together with its context decision.
 *
 * @param text          matched text, e.g. "Jan 2018 - Present"
 * @param start         start offset of the match in the normalized text
 * @param end           end offset (exclusive)
 * @param startYear     year parsed from the start token
 * @param endYear       year parsed from the end token, or the current year when open-ended
 * @param openEnded     true when the range ends with Present/Current/Now
 * @param context       work / education / ambiguous classification
 * @param included      whether the range counts towards years of experience
 * @param durationYears counted duration, 0 when not included
 */
public record DateRangeMatch(
        String text,
        int start,
        int end,
        int startYear,
        int endYear,
        boolean openEnded,
        DateContext context,
        boolean included,
        int durationYears) {
}
