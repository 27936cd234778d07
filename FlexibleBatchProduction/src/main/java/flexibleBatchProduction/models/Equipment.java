package flexibleBatchProduction.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Steelmaking unit (electric arc furnace, ladle oven and caster) with its rolling unit.
 */
public class Equipment {
	private final String id;
	private Integer pauseDuration; // minimum downtime after a batch [steps]
	private Integer rollingDuration; // [steps]
	private Double rollingCapacity; // [MW]
	private Double rollingMassEfficiency;
	private final List<VirtualEquipment> virtualEquipments = new ArrayList<>();

	public Equipment(String id) {
		this.id = Objects.requireNonNull(id);
	}

	public Equipment(String id, int pauseDuration, int rollingDuration, double rollingCapacity,
					 double rollingMassEfficiency) {
		this(id);
		this.pauseDuration = pauseDuration;
		this.rollingDuration = rollingDuration;
		this.rollingCapacity = rollingCapacity;
		this.rollingMassEfficiency = rollingMassEfficiency;
	}

	public String getId() {
		return id;
	}

	public Integer getPauseDuration() {
		return pauseDuration;
	}

	public void setPauseDuration(Integer pauseDuration) {
		this.pauseDuration = pauseDuration;
	}

	public Integer getRollingDuration() {
		return rollingDuration;
	}

	public void setRollingDuration(Integer rollingDuration) {
		this.rollingDuration = rollingDuration;
	}

	public Double getRollingCapacity() {
		return rollingCapacity;
	}

	public void setRollingCapacity(Double rollingCapacity) {
		this.rollingCapacity = rollingCapacity;
	}

	public Double getRollingMassEfficiency() {
		return rollingMassEfficiency;
	}

	public void setRollingMassEfficiency(Double rollingMassEfficiency) {
		this.rollingMassEfficiency = rollingMassEfficiency;
	}

	public List<VirtualEquipment> getVirtualEquipments() {
		return Collections.unmodifiableList(virtualEquipments);
	}

	public Equipment addVirtualEquipment(VirtualEquipment virtualEquipment) {
		virtualEquipments.add(virtualEquipment);
		return this;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return id.equals(((Equipment) obj).id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}

	@Override
	public String toString() {
		return "Equipment{" + id + '}';
	}
}
