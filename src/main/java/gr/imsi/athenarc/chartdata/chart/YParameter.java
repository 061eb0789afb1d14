package gr.imsi.athenarc.chartdata.chart;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * A Y-axis parameter of a chart. The parameter key may carry a unit suffix
 * ({@code "Temperature|degC"}); only the part before the separator names the
 * column to fetch.
 */
public final class YParameter {

    public static final String DEFAULT_TYPE = "parameter";
    private static final char UNIT_SEPARATOR = '|';

    private final String type;
    private final String parameter;
    private final String label;

    public YParameter(String type, String parameter, String label) {
        this.type = type != null ? type : DEFAULT_TYPE;
        this.parameter = parameter;
        this.label = label;
    }

    public static YParameter of(String parameter) {
        return new YParameter(DEFAULT_TYPE, parameter, null);
    }

    public static YParameter of(String type, String parameter) {
        return new YParameter(type, parameter, null);
    }

    public String getType() {
        return type;
    }

    public String getParameter() {
        return parameter;
    }

    public String getLabel() {
        return label != null ? label : parameter;
    }

    public boolean isBlank() {
        return parameter == null || parameter.isBlank();
    }

    /**
     * @return the column name to fetch, without any unit suffix
     */
    public String getColumn() {
        return cleanParameter(parameter);
    }

    static String cleanParameter(String parameter) {
        if (parameter == null) {
            return null;
        }
        int separator = parameter.indexOf(UNIT_SEPARATOR);
        return separator >= 0 ? parameter.substring(0, separator) : parameter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof YParameter)) return false;
        YParameter that = (YParameter) o;
        return type.equals(that.type) && Objects.equals(parameter, that.parameter) && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, parameter, label);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("type", type)
                .add("parameter", parameter)
                .toString();
    }
}
