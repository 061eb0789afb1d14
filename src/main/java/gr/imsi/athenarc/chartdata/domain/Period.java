package gr.imsi.athenarc.chartdata.domain;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A selected data source: one logical time series dataset with a stable id and a
 * display label.
 */
public final class Period {

    private final String id;
    private final String label;

    public Period(String id, String label) {
        this.id = Preconditions.checkNotNull(id, "id");
        this.label = label != null ? label : id;
    }

    public static Period of(String id) {
        return new Period(id, id);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Period)) return false;
        Period period = (Period) o;
        return id.equals(period.id) && label.equals(period.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label);
    }

    @Override
    public String toString() {
        return label.equals(id) ? id : label + " (" + id + ")";
    }
}
