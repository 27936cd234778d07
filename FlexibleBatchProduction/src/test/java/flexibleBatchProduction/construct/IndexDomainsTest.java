package flexibleBatchProduction.construct;

import flexibleBatchProduction.PlantFixtures;
import flexibleBatchProduction.models.Boundary;
import flexibleBatchProduction.models.Equipment;
import flexibleBatchProduction.models.PlantConfiguration;
import flexibleBatchProduction.models.VirtualEquipment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexDomainsTest {

	@Test
	void testDomains() throws DomainException {
		PlantConfiguration config = PlantFixtures.configuration();
		Equipment second = new Equipment("EAF2", 0, 2, 1.0, 1.0);
		second.addVirtualEquipment(new VirtualEquipment("EAF2", "low", new double[] { 1.0, 1.0, 1.0 }, 1.0, 5.0));
		second.addVirtualEquipment(new VirtualEquipment("EAF2", "high", new double[] { 2.0 }, 1.0, 5.0));
		config.addEquipment(second);
		config.addBoundary(new Boundary("b1", 5.0, 10.0));

		IndexDomains domains = IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price());

		assertEquals(PlantFixtures.HORIZON, domains.getHorizon());
		assertEquals(0, domains.getPeriods().get(0).getT());
		assertEquals(PlantFixtures.HORIZON - 1, domains.getLastPeriod().getT());
		assertEquals(List.of(PlantFixtures.EAF, "EAF2"), domains.getEquipmentIds());
		assertEquals(3, domains.getVirtualEquipments().size());
		assertEquals(2, domains.getVirtualEquipments("EAF2").size());
		assertEquals(3, domains.getBatchStepCount(new VirtualEquipment("EAF2", "low")));
		assertEquals(1, domains.getBatchStepCount(new VirtualEquipment("EAF2", "high")));
		assertEquals(List.of("b1"), domains.getBoundaryIds());
		assertThrows(IllegalArgumentException.class, () -> domains.getVirtualEquipments("unknown"));
	}

	@Test
	void testEmptyGeneration() {
		DomainException e = assertThrows(DomainException.class,
			() -> IndexDomains.build(PlantFixtures.configuration(), new double[0], new double[0]));
		assertTrue(e.getMessage().contains("empty"));
	}

	@Test
	void testPriceLengthMismatch() {
		assertThrows(DomainException.class,
			() -> IndexDomains.build(PlantFixtures.configuration(), PlantFixtures.generation(), new double[3]));
	}

	@Test
	void testNoEquipment() {
		assertThrows(DomainException.class,
			() -> IndexDomains.build(new PlantConfiguration(), PlantFixtures.generation(), PlantFixtures.price()));
	}

	@Test
	void testEquipmentWithoutVirtualEquipment() {
		PlantConfiguration config = PlantFixtures.configuration();
		config.addEquipment(new Equipment("EAF2", 0, 1, 1.0, 1.0));
		assertThrows(DomainException.class,
			() -> IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price()));
	}

	@Test
	void testDuplicateEquipment() {
		PlantConfiguration config = PlantFixtures.configuration();
		Equipment duplicate = new Equipment(PlantFixtures.EAF, 0, 1, 1.0, 1.0);
		duplicate.addVirtualEquipment(new VirtualEquipment(PlantFixtures.EAF, "v2", new double[] { 1.0 }, 1.0, 1.0));
		config.addEquipment(duplicate);
		assertThrows(DomainException.class,
			() -> IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price()));
	}

	@Test
	void testDuplicateVirtualEquipment() {
		PlantConfiguration config = PlantFixtures.configuration();
		config.getEquipments().get(0).addVirtualEquipment(
			new VirtualEquipment(PlantFixtures.EAF, PlantFixtures.MODE, new double[] { 1.0 }, 1.0, 1.0));
		assertThrows(DomainException.class,
			() -> IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price()));
	}

	@Test
	void testVirtualEquipmentOfOtherEquipment() {
		PlantConfiguration config = PlantFixtures.configuration();
		config.getEquipments().get(0).addVirtualEquipment(
			new VirtualEquipment("EAF2", "v2", new double[] { 1.0 }, 1.0, 1.0));
		assertThrows(DomainException.class,
			() -> IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price()));
	}

	@Test
	void testMissingProfile() {
		PlantConfiguration config = PlantFixtures.configuration();
		VirtualEquipment v = new VirtualEquipment(PlantFixtures.EAF, "v2");
		v.setDuration(2);
		v.setDriDemand(1.0);
		v.setOutputSteelProducts(1.0);
		config.getEquipments().get(0).addVirtualEquipment(v);
		assertThrows(DomainException.class,
			() -> IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price()));
	}

	@Test
	void testDurationDiffersFromProfile() {
		PlantConfiguration config = PlantFixtures.configuration();
		config.getEquipments().get(0).getVirtualEquipments().get(0).setDuration(3);
		DomainException e = assertThrows(DomainException.class,
			() -> IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price()));
		assertTrue(e.getMessage().contains("duration 3"));
	}

	@Test
	void testDuplicateBoundary() {
		PlantConfiguration config = PlantFixtures.configuration();
		config.addBoundary(new Boundary("b1", 1.0, 1.0));
		config.addBoundary(new Boundary("b1", 2.0, 1.0));
		assertThrows(DomainException.class,
			() -> IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price()));
	}

	@Test
	void testIdsMustNotContainNameDelimiters() {
		for (String id : List.of("EAF,1", "EAF(1)", "EAF 1")) {
			PlantConfiguration config = new PlantConfiguration();
			Equipment eaf = new Equipment(id, 1, 1, 3.0, 0.9);
			eaf.addVirtualEquipment(new VirtualEquipment(id, "v1", new double[] { 4.0 }, 1.0, 5.0));
			config.addEquipment(eaf);
			DomainException e = assertThrows(DomainException.class,
				() -> IndexDomains.build(config, PlantFixtures.generation(), PlantFixtures.price()), id);
			assertTrue(e.getMessage().contains(id), e.getMessage());
		}

		PlantConfiguration badMode = new PlantConfiguration();
		Equipment eaf = new Equipment("EAF", 1, 1, 3.0, 0.9);
		eaf.addVirtualEquipment(new VirtualEquipment("EAF", "v,1", new double[] { 4.0 }, 1.0, 5.0));
		badMode.addEquipment(eaf);
		assertThrows(DomainException.class,
			() -> IndexDomains.build(badMode, PlantFixtures.generation(), PlantFixtures.price()));

		PlantConfiguration badBoundary = PlantFixtures.configuration();
		badBoundary.addBoundary(new Boundary("b(1)", 5.0, 10.0));
		assertThrows(DomainException.class,
			() -> IndexDomains.build(badBoundary, PlantFixtures.generation(), PlantFixtures.price()));
	}

	@Test
	void testUnderscoresInIdsKeepNamesApart() throws ModelConstructionException {
		// EAF_1 with mode v and EAF with mode 1_v must not share variable names
		PlantConfiguration config = PlantFixtures.configuration();
		Equipment first = new Equipment("EAF_1", 1, 1, 3.0, 0.9);
		first.addVirtualEquipment(new VirtualEquipment("EAF_1", "v", new double[] { 4.0 }, 1.0, 5.0));
		config.addEquipment(first);
		config.getEquipments().get(0)
			.addVirtualEquipment(new VirtualEquipment(PlantFixtures.EAF, "1_v", new double[] { 4.0 }, 1.0, 5.0));

		BatchProductionModel model = BatchProductionModelBuilder.build(PlantFixtures.input(config),
			ObjectiveType.MAX_PROFIT);
		IndexedModel indexedModel = model.getIndexedModel();
		assertTrue(indexedModel.getVariable(ModelVariables.INTERMEDIATE_STORAGE, "EAF_1", "v", 0).isPresent());
		assertTrue(indexedModel.getVariable(ModelVariables.INTERMEDIATE_STORAGE, PlantFixtures.EAF, "1_v", 0)
			.isPresent());
	}
}
