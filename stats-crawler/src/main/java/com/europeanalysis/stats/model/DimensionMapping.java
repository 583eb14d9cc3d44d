package com.europeanalysis.stats.model;

import lombok.Builder;
import lombok.Value;

/**
 * Names of the upstream fields that carry each unified axis.
 *
 * geo and time are mandatory. Any other axis left null is simply absent from
 * the dataset and stays null on every fact. Age is either a single code field
 * ("Y0-4", "65+", "TOTAL") or a pair of numeric bound fields.
 *
 * Wide population tables carry one column per sex instead of a sex axis;
 * male and female name those columns and are set together or not at all.
 */
@Value
@Builder(toBuilder = true)
public class DimensionMapping {

    String geo;
    String time;
    String sex;
    String age;
    String ageMin;
    String ageMax;
    String industry;
    String unit;
    String male;
    String female;

    public boolean hasSex() {
        return sex != null;
    }

    public boolean hasAgeCode() {
        return age != null;
    }

    public boolean hasAgeBounds() {
        return ageMin != null;
    }

    public boolean hasIndustry() {
        return industry != null;
    }

    public boolean hasUnit() {
        return unit != null;
    }

    public boolean hasSexSplit() {
        return male != null && female != null;
    }
}
