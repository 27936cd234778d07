package flexibleBatchProduction.models;

import java.util.Objects;

/**
 * Time step of the planning horizon. Steps are numbered from 0 and all have the
 * duration {@code minutesPerStep}.
 */
public class Period implements Comparable<Period> {
	final int t;

	public Period(int t) {
		if (t < 0) {
			throw new IllegalArgumentException("Period number must not be negative.");
		}
		this.t = t;
	}

	public int getT() {
		return t;
	}

	@Override
	public int compareTo(Period other) {
		return Integer.compare(t, other.t);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		Period period = (Period) obj;
		return t == period.t;
	}

	@Override
	public int hashCode() {
		return Objects.hash(t);
	}

	@Override
	public String toString() {
		return "Period{" + "t=" + t + '}';
	}
}
