package flexibleBatchProduction.construct;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row of the flat key-value export of a model: set member, parameter value or solved
 * variable value, keyed by name and index tuple (empty for scalars).
 */
public class ExportEntry {
	private final String name;
	private final List<Object> index;
	private final Object value;

	public ExportEntry(String name, List<Object> index, Object value) {
		this.name = Objects.requireNonNull(name);
		this.index = Collections.unmodifiableList(index);
		this.value = value;
	}

	public static ExportEntry scalar(String name, Object value) {
		return new ExportEntry(name, Collections.emptyList(), value);
	}

	public static ExportEntry indexed(String name, Object value, Object... index) {
		return new ExportEntry(name, Arrays.asList(index), value);
	}

	public String getName() {
		return name;
	}

	public List<Object> getIndex() {
		return index;
	}

	public Object getValue() {
		return value;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		ExportEntry other = (ExportEntry) obj;
		return name.equals(other.name) && index.equals(other.index) && Objects.equals(value, other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, index, value);
	}

	@Override
	public String toString() {
		return name + index + "=" + value;
	}
}
