package org.javai.cellsim.datamodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.cellsim.datamodel.testsupport.FlatDocument.region;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.engine.SimulationEngine;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.internal.resolve.ScenarioResolver;
import org.javai.cellsim.datamodel.model.Reaction;
import org.javai.cellsim.datamodel.model.ReleaseSite;
import org.javai.cellsim.datamodel.model.Species;
import org.javai.cellsim.datamodel.testsupport.FlatDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DataModelImporter")
class DataModelImporterTest {

	private static Path fixture(String name) {
		try {
			return Path.of(DataModelImporterTest.class.getResource("/datamodels/" + name).toURI());
		}
		catch (URISyntaxException e) {
			throw new IllegalStateException(e);
		}
	}

	/**
	 * A layout-independent rendering of a scenario, for comparing imports of the same model.
	 */
	private static List<String> summary(ImportedScenario scenario) {
		return List.of(
				scenario.species().values().toString(),
				scenario.reactions().stream().map(Reaction::equation).toList().toString(),
				scenario.reactions().stream().map(Reaction::forwardRate).toList().toString(),
				scenario.meshObjects().values().toString(),
				scenario.surfaceClasses().values().toString(),
				scenario.surfaceRegionAssignments().stream()
						.map(a -> a.surfaceClass().name() + "@" + a.region().qualifiedName()).toList().toString(),
				scenario.releaseSites().stream()
						.map(s -> s.name() + ":" + s.quantity() + "x" + s.species().name() + "->"
								+ s.targetRegion().map(r -> r.qualifiedName()).orElse(s.object().name()) + "/" + s.oriented())
						.toList().toString(),
				scenario.countRequests().stream()
						.map(c -> c.species().name() + "@" + c.scope().tag()).toList().toString(),
				scenario.visualization().species().stream().map(Species::name).toList().toString(),
				scenario.initialization().toString());
	}

	@Nested
	@DisplayName("CellBlender layout")
	class CellBlender {

		private final DataModelImporter importer = DataModelImporter.builder().build();

		@Test
		@DisplayName("should resolve the full scenario from a JSON export")
		void shouldImportJsonExport() {
			ImportedScenario scenario = importer.importFile(fixture("cell_cellblender.json"));

			assertThat(scenario.species()).containsOnlyKeys("A", "B", "C");
			assertThat(scenario.species().get("B").surface()).isTrue();
			assertThat(scenario.reactions()).extracting(Reaction::equation)
					.containsExactly("A' + B, -> C", "C' -> A, + B'");
			assertThat(scenario.reactions().get(0).name()).isEqualTo("binding");

			ReleaseSite relB = scenario.releaseSites().get(1);
			assertThat(relB.targetRegion()).containsSame(scenario.meshObjects().get("Cell").findRegion("Top").orElseThrow());
			assertThat(relB.oriented()).isFalse();
			assertThat(scenario.releaseSites().get(0).oriented()).isTrue();

			assertThat(scenario.countRequests()).extracting(c -> c.scope().tag())
					.containsExactly("World", "Object", "Region");
			assertThat(scenario.visualization().species()).extracting(Species::name).containsExactly("B");
			assertThat(scenario.initialization()).hasValueSatisfying(init -> {
				assertThat(init.iterations()).isEqualTo(1000);
				assertThat(init.timeStep()).isEqualTo(1e-6);
			});
		}

		@Test
		@DisplayName("should read the same file from a stream")
		void shouldImportStream() throws Exception {
			ImportedScenario fromFile = importer.importFile(fixture("cell_cellblender.json"));
			try (InputStream in = DataModelImporterTest.class.getResourceAsStream("/datamodels/cell_cellblender.json")) {
				ImportedScenario fromStream = importer.importStream(in, DocumentFormat.JSON);

				assertThat(summary(fromStream)).isEqualTo(summary(fromFile));
			}
		}

		@Test
		@DisplayName("should find nothing in a flat document")
		void shouldNotReadFlatSections() {
			ImportedScenario scenario = importer.importDocument(FlatDocument.create().species("A", "1", "3D").toMap());

			assertThat(scenario.species()).isEmpty();
		}
	}

	@Nested
	@DisplayName("flat layout")
	class Flat {

		private final DataModelImporter importer = DataModelImporter.builder()
				.layout(DataModelLayout.FLAT)
				.build();

		@Test
		@DisplayName("should resolve the same scenario as the CellBlender export")
		void shouldMatchCellBlenderImport() {
			ImportedScenario flat = importer.importFile(fixture("cell_flat.yaml"));
			ImportedScenario cellBlender = DataModelImporter.builder().build().importFile(fixture("cell_cellblender.json"));

			assertThat(summary(flat)).isEqualTo(summary(cellBlender));
			assertThat(flat.plan().size()).isEqualTo(cellBlender.plan().size());
		}

		@Test
		@DisplayName("should give equal results when importing twice")
		void shouldBeIdempotent() {
			ImportedScenario first = importer.importFile(fixture("cell_flat.yaml"));
			ImportedScenario second = importer.importFile(fixture("cell_flat.yaml"));

			assertThat(summary(second)).isEqualTo(summary(first));
			assertThat(second.plan().size()).isEqualTo(first.plan().size());
		}

		@Test
		void resultPlanCannotBeExtendedAfterImport() {
			ImportedScenario scenario = importer.importString("""
					species:
					  - { mol_name: A, mol_type: 3D, diffusion_constant: 1 }
					""", DocumentFormat.YAML);
			int recorded = scenario.plan().size();

			assertThatThrownBy(() -> scenario.plan().add(
					new ConstructionCommand.ConstructSpecies(new Species("Injected", 1, false))))
					.isInstanceOf(IllegalStateException.class);
			assertThat(scenario.plan().size()).isEqualTo(recorded);

			SimulationEngine target = mock(SimulationEngine.class);
			scenario.applyTo(target);
			verify(target, never()).constructSpecies(new Species("Injected", 1, false));
		}

		@Test
		@DisplayName("should import YAML text")
		void shouldImportString() {
			ImportedScenario scenario = importer.importString("""
					species:
					  - { mol_name: A, mol_type: 3D, diffusion_constant: 1.0e-6 }
					""", DocumentFormat.YAML);

			assertThat(scenario.species().get("A").diffusionConstant()).isEqualTo(1e-6);
		}
	}

	@Nested
	@DisplayName("engine construction")
	class EngineConstruction {

		private final SimulationEngine engine = mock(SimulationEngine.class);

		@Test
		@DisplayName("should construct the scenario after a successful import")
		void shouldApplyOnSuccess() {
			ImportedScenario scenario = DataModelImporter.builder().build()
					.importInto(fixture("cell_cellblender.json"), engine);

			verify(engine).constructSpecies(scenario.species().get("A"));
			verify(engine).setIterations(1000);
		}

		@Test
		@DisplayName("should not touch the engine when the import fails")
		void shouldNotApplyOnFailure() {
			DataModelImporter importer = DataModelImporter.builder().layout(DataModelLayout.FLAT).build();
			Map<String, Object> document = FlatDocument.create()
					.species("A", "1", "3D")
					.cube("Cell", region("Top", 0))
					.release("rel", "Cell[Bottom]", "A", "10", false)
					.toMap();

			assertThatThrownBy(() -> importer.importDocument(document).applyTo(engine))
					.isInstanceOf(UnresolvedReferenceException.class);
			verifyNoInteractions(engine);
		}

		@Test
		@DisplayName("should not touch the engine when the file cannot be read")
		void shouldNotApplyUnreadableFile() {
			assertThatThrownBy(() -> DataModelImporter.builder().build().importInto(fixture("truncated.json"), engine))
					.isInstanceOf(DocumentReadException.class);
			verifyNoInteractions(engine);
		}
	}

	@Test
	@DisplayName("should reject a reversible reaction under the reject policy")
	void shouldApplyBackwardRatePolicy() {
		DataModelImporter importer = DataModelImporter.builder()
				.layout(DataModelLayout.FLAT)
				.backwardRatePolicy(BackwardRatePolicy.REJECT)
				.build();
		Map<String, Object> document = FlatDocument.create()
				.species("A", "1", "3D")
				.reaction(FlatDocument.entry("reactants", "A", "products", "A", "fwd_rate", "1", "bkwd_rate", "2"))
				.toMap();

		assertThatThrownBy(() -> importer.importDocument(document))
				.isInstanceOf(UnsupportedFeatureException.class);
	}

	@Test
	@DisplayName("should delegate to a custom resolver")
	void shouldUseCustomResolver() {
		ScenarioResolver resolver = mock(ScenarioResolver.class);
		DataModelImporter importer = DataModelImporter.builder().resolver(resolver).build();

		importer.importDocument(Map.of());

		verify(resolver).resolve(any(DataModelNode.class), eq(ImportOptions.defaults()));
	}
}
