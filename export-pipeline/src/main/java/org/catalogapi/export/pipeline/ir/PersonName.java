package org.catalogapi.export.pipeline.ir;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * A personal name parsed from a MARC X00 field. String values are empty, never null, when
 * the heading does not have them; the two years are null when unknown.
 */
@Value
@Builder
public class PersonName {
    public static final String DATES_LIVED = "dates lived";
    public static final String DATES_FLOURISHED = "dates flourished";
    public static final String APPROXIMATE_CENTURIES = "approximate centuries";
    public static final String UNKNOWN_DATE_TYPES = "unknown date types";
    public static final String CIRCA = "circa";
    public static final String UNSURE = "unsure";

    @Builder.Default
    String forename = "";

    @Builder.Default
    String surname = "";

    @Builder.Default
    String familyName = "";

    @Builder.Default
    String fullerFormOfName = "";

    List<String> titles;

    /**
     * Year; negative for BCE
     */
    Integer startDate;

    @Builder.Default
    String startDateQualifier = "";

    /**
     * Year; negative for BCE
     */
    Integer endDate;

    @Builder.Default
    String endDateQualifier = "";

    @Builder.Default
    String dateType = "";

    /**
     * The dates as written in the heading, cleaned of trailing punctuation
     */
    @Builder.Default
    String fullDates = "";

    @Builder.Default
    String relationToWork = "";

    @Builder.Default
    String attributionQualifier = "";

    @Builder.Default
    String affiliation = "";

    @Builder.Default
    String authorizedHeading = "";

    public static class PersonNameBuilder {
        private List<String> titles = List.of();

        public PersonNameBuilder titles(List<String> titles) {
            this.titles = List.copyOf(titles);
            return this;
        }
    }
}
