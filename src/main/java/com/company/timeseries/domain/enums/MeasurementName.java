package com.company.timeseries.domain.enums;

import java.util.Arrays;
import java.util.Optional;

public enum MeasurementName {
    COVERAGE("coverage"),
    FLAG_COVERAGE("flag_coverage"),
    COMPONENT_COVERAGE("component_coverage"),
    // whole size of a bundle report, by report name
    BUNDLE_ANALYSIS_REPORT_SIZE("bundle_analysis_report_size"),
    BUNDLE_ANALYSIS_JAVASCRIPT_SIZE("bundle_analysis_javascript_size"),
    BUNDLE_ANALYSIS_STYLESHEET_SIZE("bundle_analysis_stylesheet_size"),
    BUNDLE_ANALYSIS_FONT_SIZE("bundle_analysis_font_size"),
    BUNDLE_ANALYSIS_IMAGE_SIZE("bundle_analysis_image_size"),
    // individual asset size, by asset UUID
    BUNDLE_ANALYSIS_ASSET_SIZE("bundle_analysis_asset_size");

    private final String value;

    MeasurementName(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<MeasurementName> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(name -> name.value.equals(value) || name.name().equals(value))
                .findFirst();
    }
}
