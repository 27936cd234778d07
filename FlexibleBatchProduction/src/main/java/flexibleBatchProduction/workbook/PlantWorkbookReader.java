package flexibleBatchProduction.workbook;

import flexibleBatchProduction.construct.ConfigurationException;
import flexibleBatchProduction.models.Boundary;
import flexibleBatchProduction.models.Equipment;
import flexibleBatchProduction.models.PlantConfiguration;
import flexibleBatchProduction.models.PlantInput;
import flexibleBatchProduction.models.VirtualEquipment;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a plant input from an Excel workbook. Row 0 of every sheet is a header, blank rows
 * are skipped. Values missing from a row stay unset on the configuration and are reported
 * when the model is built.
 */
public class PlantWorkbookReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(PlantWorkbookReader.class);

	public static final String GLOBAL_PARAMETERS_SHEET = "GlobalParameters";
	public static final String EQUIPMENT_SHEET = "Equipment";
	public static final String VIRTUAL_EQUIPMENT_SHEET = "VirtualEquipment";
	public static final String BATCH_LOAD_PROFILE_SHEET = "BatchLoadProfile";
	public static final String PERIODS_SHEET = "Periods";
	public static final String BOUNDARIES_SHEET = "Boundaries";

	private final DataFormatter formatter = new DataFormatter();

	public PlantInput read(Path path) throws IOException, ConfigurationException {
		try (InputStream in = Files.newInputStream(path)) {
			PlantInput input = read(in);
			LOGGER.info("Read plant input from {}", path);
			return input;
		}
	}

	public PlantInput read(InputStream in) throws IOException, ConfigurationException {
		try (Workbook workbook = new XSSFWorkbook(in)) {
			return read(workbook);
		}
	}

	public PlantInput read(Workbook workbook) throws ConfigurationException {
		PlantConfiguration config = new PlantConfiguration();
		readGlobalParameters(requireSheet(workbook, GLOBAL_PARAMETERS_SHEET), config);

		Map<String, Equipment> equipments = readEquipment(requireSheet(workbook, EQUIPMENT_SHEET));
		Map<String, VirtualEquipment> virtualEquipments = readVirtualEquipment(
				requireSheet(workbook, VIRTUAL_EQUIPMENT_SHEET), equipments);
		readBatchLoadProfiles(requireSheet(workbook, BATCH_LOAD_PROFILE_SHEET), virtualEquipments);
		for (Equipment e : equipments.values()) {
			config.addEquipment(e);
		}

		Sheet boundaries = workbook.getSheet(BOUNDARIES_SHEET);
		if (boundaries != null) {
			readBoundaries(boundaries, config);
		}

		TreeMap<Integer, double[]> periods = readPeriods(requireSheet(workbook, PERIODS_SHEET));
		double[] generation = new double[periods.size()];
		double[] price = new double[periods.size()];
		int expected = 0;
		for (Map.Entry<Integer, double[]> period : periods.entrySet()) {
			if (period.getKey() != expected) {
				throw new ConfigurationException(PERIODS_SHEET + ": steps must run from 0 without gaps, missing step "
						+ expected);
			}
			generation[expected] = period.getValue()[0];
			price[expected] = period.getValue()[1];
			expected++;
		}
		LOGGER.debug("Workbook holds {} equipments, {} virtual equipments, {} periods", equipments.size(),
				virtualEquipments.size(), periods.size());
		return new PlantInput(config, generation, price);
	}

	private void readGlobalParameters(Sheet sheet, PlantConfiguration config) throws ConfigurationException {
		for (Row row : sheet) {
			if (row.getRowNum() == 0 || isBlank(row)) {
				continue;
			}
			String key = text(row, 0);
			Cell value = row.getCell(1);
			switch (key) {
			case "minutes_per_step":
				config.setMinutesPerStep(number(value, key));
				break;
			case "steel_demand":
				config.setSteelDemand(number(value, key));
				break;
			case "max_capacity_electrolyser":
				config.setMaxCapacityElectrolyser(number(value, key));
				break;
			case "min_consumption_electrolyser":
				config.setMinConsumptionElectrolyser(number(value, key));
				break;
			case "efficiency_electrolyser":
				config.setEfficiencyElectrolyser(number(value, key));
				break;
			case "capacity_h2_tank":
				config.setCapacityH2Tank(number(value, key));
				break;
			case "initial_h2_tank_filling":
				config.setInitialH2TankFilling(number(value, key));
				break;
			case "DRI_init_content":
				config.setInitialDriContent(number(value, key));
				break;
			case "h2_MWh_per_DRI":
				config.setH2MWhPerDri(number(value, key));
				break;
			case "fuel_cell_capacity":
				config.setFuelCellCapacity(number(value, key));
				break;
			case "fuel_cell_efficiency":
				config.setFuelCellEfficiency(number(value, key));
				break;
			case "use_storage_goals":
				config.setUseStorageGoals(flag(value, key));
				break;
			case "goal_h2_content":
				config.setGoalH2Content(number(value, key));
				break;
			case "goal_DRI_content":
				config.setGoalDriContent(number(value, key));
				break;
			case "draw_power_from_grid":
				config.setDrawPowerFromGrid(flag(value, key));
				break;
			case "grid_charge_power_price":
				config.setGridChargePowerPrice(number(value, key));
				break;
			case "grid_charge_energy_price":
				config.setGridChargeEnergyPrice(number(value, key));
				break;
			case "given_goal_load":
				config.setGivenGoalLoad(flag(value, key));
				break;
			case "goal_load":
				config.setGoalLoad(number(value, key));
				break;
			default:
				throw new ConfigurationException(GLOBAL_PARAMETERS_SHEET + ": unknown parameter '" + key + "' in row "
						+ (row.getRowNum() + 1));
			}
		}
	}

	private Map<String, Equipment> readEquipment(Sheet sheet) throws ConfigurationException {
		Map<String, Equipment> equipments = new LinkedHashMap<>();
		for (Row row : sheet) {
			if (row.getRowNum() == 0 || isBlank(row)) {
				continue;
			}
			String id = text(row, 0);
			Equipment equipment = new Equipment(id);
			equipment.setPauseDuration(integer(row.getCell(1), "T_down[" + id + "]"));
			equipment.setRollingDuration(integer(row.getCell(2), "rolling_duration[" + id + "]"));
			equipment.setRollingCapacity(number(row.getCell(3), "rolling_cap[" + id + "]"));
			equipment.setRollingMassEfficiency(number(row.getCell(4), "rolling_mass_efficiency[" + id + "]"));
			if (equipments.put(id, equipment) != null) {
				throw new ConfigurationException(EQUIPMENT_SHEET + ": duplicate equipment " + id);
			}
		}
		return equipments;
	}

	private Map<String, VirtualEquipment> readVirtualEquipment(Sheet sheet, Map<String, Equipment> equipments)
			throws ConfigurationException {
		Map<String, VirtualEquipment> virtualEquipments = new LinkedHashMap<>();
		for (Row row : sheet) {
			if (row.getRowNum() == 0 || isBlank(row)) {
				continue;
			}
			String equipmentId = text(row, 0);
			String modeId = text(row, 1);
			Equipment equipment = equipments.get(equipmentId);
			if (equipment == null) {
				throw new ConfigurationException(VIRTUAL_EQUIPMENT_SHEET + ": mode " + modeId
						+ " refers to unknown equipment " + equipmentId);
			}
			String key = "[" + equipmentId + "][" + modeId + "]";
			VirtualEquipment v = new VirtualEquipment(equipmentId, modeId);
			v.setDuration(integer(row.getCell(2), "virtual_equipment_duration" + key));
			v.setDriDemand(number(row.getCell(3), "DRI_demand" + key));
			v.setOutputSteelProducts(number(row.getCell(4), "output_steel_products" + key));
			if (virtualEquipments.put(key, v) != null) {
				throw new ConfigurationException(VIRTUAL_EQUIPMENT_SHEET + ": duplicate virtual equipment " + key);
			}
			equipment.addVirtualEquipment(v);
		}
		return virtualEquipments;
	}

	private void readBatchLoadProfiles(Sheet sheet, Map<String, VirtualEquipment> virtualEquipments)
			throws ConfigurationException {
		Map<String, TreeMap<Integer, Double>> profiles = new LinkedHashMap<>();
		for (Row row : sheet) {
			if (row.getRowNum() == 0 || isBlank(row)) {
				continue;
			}
			String key = "[" + text(row, 0) + "][" + text(row, 1) + "]";
			if (!virtualEquipments.containsKey(key)) {
				throw new ConfigurationException(BATCH_LOAD_PROFILE_SHEET + ": unknown virtual equipment " + key);
			}
			Integer step = integer(row.getCell(2), "batch step" + key);
			Double load = number(row.getCell(3), "batch_load_profile" + key);
			if (step == null || load == null) {
				throw new ConfigurationException(BATCH_LOAD_PROFILE_SHEET + ": incomplete row " + (row.getRowNum() + 1));
			}
			TreeMap<Integer, Double> profile = profiles.computeIfAbsent(key, k -> new TreeMap<>());
			if (profile.put(step, load) != null) {
				throw new ConfigurationException(BATCH_LOAD_PROFILE_SHEET + ": duplicate step " + step + " for " + key);
			}
		}

		for (Map.Entry<String, TreeMap<Integer, Double>> profile : profiles.entrySet()) {
			double[] loads = new double[profile.getValue().size()];
			int expected = 0;
			for (Map.Entry<Integer, Double> step : profile.getValue().entrySet()) {
				if (step.getKey() != expected) {
					throw new ConfigurationException(BATCH_LOAD_PROFILE_SHEET + ": steps of " + profile.getKey()
							+ " must run from 0 without gaps, missing step " + expected);
				}
				loads[expected++] = step.getValue();
			}
			virtualEquipments.get(profile.getKey()).setBatchLoadProfile(loads);
		}
	}

	private void readBoundaries(Sheet sheet, PlantConfiguration config) throws ConfigurationException {
		for (Row row : sheet) {
			if (row.getRowNum() == 0 || isBlank(row)) {
				continue;
			}
			String id = text(row, 0);
			Double limit = number(row.getCell(1), "boundary_limit[" + id + "]");
			Double penalty = number(row.getCell(2), "boundary_penalty[" + id + "]");
			if (limit == null || penalty == null) {
				throw new ConfigurationException(BOUNDARIES_SHEET + ": boundary " + id + " needs limit and penalty");
			}
			config.addBoundary(new Boundary(id, limit, penalty));
		}
	}

	private TreeMap<Integer, double[]> readPeriods(Sheet sheet) throws ConfigurationException {
		TreeMap<Integer, double[]> periods = new TreeMap<>();
		for (Row row : sheet) {
			if (row.getRowNum() == 0 || isBlank(row)) {
				continue;
			}
			Integer step = integer(row.getCell(0), "step");
			Double generation = number(row.getCell(1), "renewable_generation");
			Double price = number(row.getCell(2), "electricity_price");
			if (step == null || generation == null || price == null) {
				throw new ConfigurationException(PERIODS_SHEET + ": incomplete row " + (row.getRowNum() + 1));
			}
			if (periods.put(step, new double[] { generation, price }) != null) {
				throw new ConfigurationException(PERIODS_SHEET + ": duplicate step " + step);
			}
		}
		return periods;
	}

	private static Sheet requireSheet(Workbook workbook, String name) throws ConfigurationException {
		Sheet sheet = workbook.getSheet(name);
		if (sheet == null) {
			throw new ConfigurationException("Workbook has no sheet " + name);
		}
		return sheet;
	}

	private boolean isBlank(Row row) {
		Cell first = row.getCell(0);
		return first == null || formatter.formatCellValue(first).trim().isEmpty();
	}

	private String text(Row row, int column) throws ConfigurationException {
		Cell cell = row.getCell(column);
		String value = cell == null ? "" : formatter.formatCellValue(cell).trim();
		if (value.isEmpty()) {
			throw new ConfigurationException(row.getSheet().getSheetName() + ": missing identifier in row "
					+ (row.getRowNum() + 1) + ", column " + (column + 1));
		}
		return value;
	}

	private static Double number(Cell cell, String key) throws ConfigurationException {
		if (cell == null) {
			return null;
		}
		CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
		switch (type) {
		case NUMERIC:
			return cell.getNumericCellValue();
		case BLANK:
			return null;
		case STRING:
			String text = cell.getStringCellValue().trim();
			if (text.isEmpty()) {
				return null;
			}
			try {
				return Double.valueOf(text);
			} catch (NumberFormatException e) {
				throw new ConfigurationException("Parameter " + key + " is not a number: " + text, e);
			}
		default:
			throw new ConfigurationException("Parameter " + key + " is not a number (cell type " + type + ")");
		}
	}

	private static Integer integer(Cell cell, String key) throws ConfigurationException {
		Double value = number(cell, key);
		if (value == null) {
			return null;
		}
		if (value != Math.rint(value)) {
			throw new ConfigurationException("Parameter " + key + " must be a whole number, got " + value);
		}
		return value.intValue();
	}

	private static boolean flag(Cell cell, String key) throws ConfigurationException {
		if (cell == null) {
			throw new ConfigurationException("Switch " + key + " has no value");
		}
		CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
		switch (type) {
		case BOOLEAN:
			return cell.getBooleanCellValue();
		case NUMERIC:
			return cell.getNumericCellValue() != 0;
		case STRING:
			String text = cell.getStringCellValue().trim();
			if ("true".equalsIgnoreCase(text)) {
				return true;
			}
			if ("false".equalsIgnoreCase(text)) {
				return false;
			}
			throw new ConfigurationException("Switch " + key + " must be true or false, got " + text);
		default:
			throw new ConfigurationException("Switch " + key + " has no value");
		}
	}
}
