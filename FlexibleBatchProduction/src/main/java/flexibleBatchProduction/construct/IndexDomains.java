package flexibleBatchProduction.construct;

import flexibleBatchProduction.models.Boundary;
import flexibleBatchProduction.models.Equipment;
import flexibleBatchProduction.models.Period;
import flexibleBatchProduction.models.PlantConfiguration;
import flexibleBatchProduction.models.VirtualEquipment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index sets of the batch production model.
 * <ul>
 * <li>T: time steps 0..N-1, N being the length of the generation series</li>
 * <li>E: equipments</li>
 * <li>V: virtual equipments, pairs of equipment id and mode id</li>
 * <li>Z: batch steps 0..len(profile)-1 of each virtual equipment</li>
 * <li>B: load jump boundaries</li>
 * </ul>
 */
public class IndexDomains {

	private final List<Period> periods;
	private final List<String> equipmentIds;
	private final List<VirtualEquipment> virtualEquipments;
	private final Map<String, List<VirtualEquipment>> virtualEquipmentsByEquipment;
	private final Map<VirtualEquipment, Integer> batchStepCounts;
	private final List<String> boundaryIds;

	private IndexDomains(List<Period> periods, List<String> equipmentIds, List<VirtualEquipment> virtualEquipments,
			Map<String, List<VirtualEquipment>> virtualEquipmentsByEquipment,
			Map<VirtualEquipment, Integer> batchStepCounts, List<String> boundaryIds) {
		this.periods = periods;
		this.equipmentIds = equipmentIds;
		this.virtualEquipments = virtualEquipments;
		this.virtualEquipmentsByEquipment = virtualEquipmentsByEquipment;
		this.batchStepCounts = batchStepCounts;
		this.boundaryIds = boundaryIds;
	}

	public static IndexDomains build(PlantConfiguration config, double[] generation, double[] price)
			throws DomainException {
		if (generation == null || generation.length == 0) {
			throw new DomainException("Renewable generation series is empty, no time horizon can be derived");
		}
		if (price == null || price.length != generation.length) {
			throw new DomainException("Electricity price series has " + (price == null ? 0 : price.length)
					+ " values, the generation series " + generation.length);
		}
		List<Period> periods = new ArrayList<>(generation.length);
		for (int t = 0; t < generation.length; t++) {
			periods.add(new Period(t));
		}

		if (config.getEquipments().isEmpty()) {
			throw new DomainException("No equipment declared");
		}
		List<String> equipmentIds = new ArrayList<>();
		List<VirtualEquipment> virtualEquipments = new ArrayList<>();
		Map<String, List<VirtualEquipment>> byEquipment = new LinkedHashMap<>();
		Map<VirtualEquipment, Integer> batchStepCounts = new LinkedHashMap<>();

		for (Equipment e : config.getEquipments()) {
			checkId("Equipment", e.getId());
			if (byEquipment.containsKey(e.getId())) {
				throw new DomainException("Equipment " + e.getId() + " declared twice");
			}
			if (e.getVirtualEquipments().isEmpty()) {
				throw new DomainException("Equipment " + e.getId() + " has no virtual equipment");
			}
			List<VirtualEquipment> modes = new ArrayList<>();
			for (VirtualEquipment v : e.getVirtualEquipments()) {
				if (!e.getId().equals(v.getEquipmentId())) {
					throw new DomainException("Virtual equipment " + v.getModeId() + " references equipment "
							+ v.getEquipmentId() + " but is declared under " + e.getId());
				}
				checkId("Virtual equipment", v.getModeId());
				if (batchStepCounts.containsKey(v)) {
					throw new DomainException(
							"Virtual equipment " + v.getModeId() + " of " + e.getId() + " declared twice");
				}
				double[] profile = v.getBatchLoadProfile();
				if (profile == null || profile.length == 0) {
					throw new DomainException(
							"Batch load profile missing for virtual equipment " + v.getModeId() + " of " + e.getId());
				}
				if (v.getDuration() != null && v.getDuration() != profile.length) {
					throw new DomainException("Virtual equipment " + v.getModeId() + " of " + e.getId()
							+ " declares duration " + v.getDuration() + " but its load profile has "
							+ profile.length + " steps");
				}
				modes.add(v);
				virtualEquipments.add(v);
				batchStepCounts.put(v, profile.length);
			}
			equipmentIds.add(e.getId());
			byEquipment.put(e.getId(), Collections.unmodifiableList(modes));
		}

		List<String> boundaryIds = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (Boundary b : config.getBoundaries()) {
			checkId("Boundary", b.getId());
			if (!seen.add(b.getId())) {
				throw new DomainException("Boundary " + b.getId() + " declared twice");
			}
			boundaryIds.add(b.getId());
		}

		return new IndexDomains(Collections.unmodifiableList(periods), Collections.unmodifiableList(equipmentIds),
				Collections.unmodifiableList(virtualEquipments), Collections.unmodifiableMap(byEquipment),
				Collections.unmodifiableMap(batchStepCounts), Collections.unmodifiableList(boundaryIds));
	}

	/**
	 * Ids end up inside variable and constraint names such as {@code intermediateStorage(EAF,v1,3)},
	 * so they must not contain the characters those names are delimited with.
	 */
	private static void checkId(String kind, String id) throws DomainException {
		if (id == null || id.isEmpty()) {
			throw new DomainException(kind + " without id");
		}
		for (int i = 0; i < id.length(); i++) {
			char c = id.charAt(i);
			if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ',') {
				throw new DomainException(kind + " id '" + id + "' contains '" + c
						+ "'; whitespace, parentheses and commas are not allowed in ids");
			}
		}
	}

	public List<Period> getPeriods() {
		return periods;
	}

	/** Horizon length N. */
	public int getHorizon() {
		return periods.size();
	}

	public Period getLastPeriod() {
		return periods.get(periods.size() - 1);
	}

	public List<String> getEquipmentIds() {
		return equipmentIds;
	}

	public List<VirtualEquipment> getVirtualEquipments() {
		return virtualEquipments;
	}

	public List<VirtualEquipment> getVirtualEquipments(String equipmentId) {
		List<VirtualEquipment> modes = virtualEquipmentsByEquipment.get(equipmentId);
		if (modes == null) {
			throw new IllegalArgumentException("Unknown equipment " + equipmentId);
		}
		return modes;
	}

	/** Number of batch steps |Z| of a virtual equipment. */
	public int getBatchStepCount(VirtualEquipment v) {
		Integer count = batchStepCounts.get(v);
		if (count == null) {
			throw new IllegalArgumentException("Unknown virtual equipment " + v);
		}
		return count;
	}

	public List<String> getBoundaryIds() {
		return boundaryIds;
	}
}
