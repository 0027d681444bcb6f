package org.linecalc.config;

import com.typesafe.config.Config;

/**
 * Report rendering options read from the {@code linecalc.report} block.
 *
 * @param echoInput Whether the text report starts with the raw input.
 * @param separator The rule printed between report sections.
 * @param format The output format.
 */
public record ReportSettings(boolean echoInput, String separator, Format format) {

    private static final String PATH = "linecalc.report";

    /** The supported report formats. */
    public enum Format { TEXT, JSON }

    /**
     * Reads the report settings.
     * @param config The resolved application configuration (must include reference.conf).
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static ReportSettings fromConfig(Config config) {
        Config report = config.getConfig(PATH);
        return new ReportSettings(
                report.getBoolean("echo-input"),
                report.getString("separator"),
                report.getEnum(Format.class, "format"));
    }

    public ReportSettings withFormat(Format newFormat) {
        return new ReportSettings(echoInput, separator, newFormat);
    }
}
