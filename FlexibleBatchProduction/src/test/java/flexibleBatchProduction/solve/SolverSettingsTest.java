package flexibleBatchProduction.solve;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SolverSettingsTest {

	@Test
	void testDefaults() {
		SolverSettings settings = SolverSettings.fromEnvironment(new HashMap<>());
		assertFalse(settings.getTimeLimit().isPresent());
		assertFalse(settings.getMipGap().isPresent());
		assertFalse(settings.isVerbose());
	}

	@Test
	void testFromEnvironment() {
		Map<String, String> env = new HashMap<>();
		env.put(SolverSettings.TIME_LIMIT_VARIABLE, "600");
		env.put(SolverSettings.MIP_GAP_VARIABLE, " 0.0001 ");
		env.put(SolverSettings.VERBOSE_VARIABLE, "true");
		SolverSettings settings = SolverSettings.fromEnvironment(env);
		assertEquals(600.0, settings.getTimeLimit().get());
		assertEquals(0.0001, settings.getMipGap().get());
		assertTrue(settings.isVerbose());
	}

	@Test
	void testBlankVariablesKeepDefaults() {
		Map<String, String> env = new HashMap<>();
		env.put(SolverSettings.TIME_LIMIT_VARIABLE, "  ");
		assertFalse(SolverSettings.fromEnvironment(env).getTimeLimit().isPresent());
	}

	@Test
	void testMalformedValues() {
		Map<String, String> env = new HashMap<>();
		env.put(SolverSettings.MIP_GAP_VARIABLE, "one percent");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
			() -> SolverSettings.fromEnvironment(env));
		assertTrue(e.getMessage().contains(SolverSettings.MIP_GAP_VARIABLE));

		assertThrows(IllegalArgumentException.class, () -> new SolverSettings(0.0, null, false));
		assertThrows(IllegalArgumentException.class, () -> new SolverSettings(null, -0.1, false));
	}
}
