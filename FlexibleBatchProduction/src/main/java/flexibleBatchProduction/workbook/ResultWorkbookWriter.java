package flexibleBatchProduction.workbook;

import flexibleBatchProduction.construct.ExportEntry;
import flexibleBatchProduction.solve.SolvedModel;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes a solved model to an Excel workbook: one row (name, index, value) per set element,
 * parameter and variable, followed by the solver status and the objective value.
 */
public class ResultWorkbookWriter {

	private static final Logger LOGGER = LoggerFactory.getLogger(ResultWorkbookWriter.class);

	public static final String RESULTS_SHEET = "Results";
	public static final String STATUS_LABEL = "Status";
	public static final String OBJECTIVE_LABEL = "Objective Value";

	public void write(SolvedModel solved, Path path) throws IOException {
		try (OutputStream out = Files.newOutputStream(path)) {
			write(solved, out);
		}
		LOGGER.info("Results successfully written to Excel file: {}", path);
	}

	public void write(SolvedModel solved, OutputStream out) throws IOException {
		try (Workbook workbook = new XSSFWorkbook()) {
			fill(workbook, solved);
			workbook.write(out);
		}
	}

	void fill(Workbook workbook, SolvedModel solved) {
		Sheet sheet = workbook.createSheet(RESULTS_SHEET);
		Row headerRow = sheet.createRow(0);
		headerRow.createCell(0).setCellValue("Name");
		headerRow.createCell(1).setCellValue("Index");
		headerRow.createCell(2).setCellValue("Value");

		int rowIndex = 1;
		for (ExportEntry entry : solved.entries()) {
			Row row = sheet.createRow(rowIndex++);
			row.createCell(0).setCellValue(entry.getName());
			row.createCell(1).setCellValue(formatIndex(entry.getIndex()));
			Object value = entry.getValue();
			if (value instanceof Number) {
				row.createCell(2).setCellValue(((Number) value).doubleValue());
			} else if (value instanceof Boolean) {
				row.createCell(2).setCellValue((Boolean) value);
			} else {
				row.createCell(2).setCellValue(String.valueOf(value));
			}
		}

		Row statusRow = sheet.createRow(rowIndex++);
		statusRow.createCell(0).setCellValue(STATUS_LABEL);
		statusRow.createCell(2).setCellValue(solved.getStatus().name());

		Row objectiveRow = sheet.createRow(rowIndex);
		objectiveRow.createCell(0).setCellValue(OBJECTIVE_LABEL);
		if (solved.getObjectiveValue().isPresent()) {
			objectiveRow.createCell(2).setCellValue(solved.getObjectiveValue().get());
		}
	}

	/** Index tuple as {@code a,b,c}; empty for scalars. */
	static String formatIndex(List<Object> index) {
		return index.stream().map(String::valueOf).collect(Collectors.joining(","));
	}
}
