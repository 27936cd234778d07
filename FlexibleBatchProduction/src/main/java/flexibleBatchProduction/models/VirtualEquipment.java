package flexibleBatchProduction.models;

import java.util.Arrays;
import java.util.Objects;

/**
 * Operating mode of an equipment. Identity is the pair (equipment id, mode id); the
 * remaining fields describe one batch run in this mode.
 */
public class VirtualEquipment {
	private final String equipmentId;
	private final String modeId;
	private double[] batchLoadProfile; // MW per batch step
	private Integer duration; // batch steps
	private Double driDemand; // tons per batch
	private Double outputSteelProducts; // tons per batch

	public VirtualEquipment(String equipmentId, String modeId) {
		this.equipmentId = Objects.requireNonNull(equipmentId);
		this.modeId = Objects.requireNonNull(modeId);
	}

	public VirtualEquipment(String equipmentId, String modeId, double[] batchLoadProfile, double driDemand,
							double outputSteelProducts) {
		this(equipmentId, modeId);
		this.batchLoadProfile = batchLoadProfile;
		this.duration = batchLoadProfile == null ? null : batchLoadProfile.length;
		this.driDemand = driDemand;
		this.outputSteelProducts = outputSteelProducts;
	}

	public String getEquipmentId() {
		return equipmentId;
	}

	public String getModeId() {
		return modeId;
	}

	public double[] getBatchLoadProfile() {
		return batchLoadProfile;
	}

	public void setBatchLoadProfile(double[] batchLoadProfile) {
		this.batchLoadProfile = batchLoadProfile;
	}

	public Integer getDuration() {
		return duration;
	}

	public void setDuration(Integer duration) {
		this.duration = duration;
	}

	public Double getDriDemand() {
		return driDemand;
	}

	public void setDriDemand(Double driDemand) {
		this.driDemand = driDemand;
	}

	public Double getOutputSteelProducts() {
		return outputSteelProducts;
	}

	public void setOutputSteelProducts(Double outputSteelProducts) {
		this.outputSteelProducts = outputSteelProducts;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		VirtualEquipment other = (VirtualEquipment) obj;
		return equipmentId.equals(other.equipmentId) && modeId.equals(other.modeId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(equipmentId, modeId);
	}

	@Override
	public String toString() {
		return "VirtualEquipment{" + equipmentId + ", " + modeId + ", profile="
				+ Arrays.toString(batchLoadProfile) + '}';
	}
}
