package org.javai.cellsim.datamodel.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScenarioModelTest {

	private final Species a = new Species("A", 1e-6, false);
	private final Species b = new Species("B", 0, true);
	private final MeshObject cell = MeshObject.builder("Cell").region("Top", List.of(0)).build();
	private final MeshObject other = MeshObject.builder("Other").build();

	@Test
	void reactionRendersItsEquation() {
		Reaction reaction = new Reaction(null,
				List.of(new MoleculeReference(a, Orientation.UP), new MoleculeReference(b, Orientation.DOWN)),
				List.of(new MoleculeReference(a, Orientation.MIX)),
				1e5);

		assertThat(reaction.equation()).isEqualTo("A' + B, -> A");
	}

	@Test
	void reactionNeedsBothSides() {
		assertThatThrownBy(() -> new Reaction(null, List.of(), List.of(new MoleculeReference(a, null)), 1.0))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void moleculeReferenceDefaultsToMix() {
		assertThat(new MoleculeReference(a, null).orientation()).isEqualTo(Orientation.MIX);
	}

	@Test
	void orientationSuffixesRoundTrip() {
		for (Orientation orientation : Orientation.values()) {
			assertThat(Orientation.fromSuffix(orientation.symbol())).contains(orientation);
		}
		assertThat(Orientation.fromSuffix('x')).isEmpty();
	}

	@Test
	void countRequestFactoriesMatchScope() {
		Region top = cell.findRegion("Top").orElseThrow();

		assertThat(CountRequest.world(a).targetObject()).isEmpty();
		assertThat(CountRequest.object(a, cell).targetObject()).containsSame(cell);
		CountRequest regional = CountRequest.region(a, top);
		assertThat(regional.scope()).isEqualTo(CountScope.REGION);
		assertThat(regional.targetObject()).containsSame(cell);
		assertThat(regional.targetRegion()).containsSame(top);
	}

	@Test
	void countRequestRejectsInconsistentTargets() {
		Region top = cell.findRegion("Top").orElseThrow();

		assertThatThrownBy(() -> new CountRequest(a, CountScope.WORLD, cell, null))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new CountRequest(a, CountScope.REGION, other, top))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void releaseSiteRegionMustBelongToObject() {
		Region top = cell.findRegion("Top").orElseThrow();

		assertThat(new ReleaseSite("r", cell, top, a, 10, false).targetRegion()).containsSame(top);
		assertThatThrownBy(() -> new ReleaseSite("r", other, top, a, 10, false))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ReleaseSite("r", cell, null, a, 0, false))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void vizSelectionDropsDuplicatesKeepingOrder() {
		VizSelection selection = new VizSelection(List.of(b, a, b));

		assertThat(selection.species()).containsExactly(b, a);
		assertThat(VizSelection.none().isEmpty()).isTrue();
	}

	@Test
	void countScopeTags() {
		assertThat(CountScope.fromTag("Region")).contains(CountScope.REGION);
		assertThat(CountScope.fromTag("region")).isEmpty();
	}

	@Test
	void collectiveSelectorsAreRecognized() {
		assertThat(MoleculeSelector.collective("ALL_MOLECULES")).containsInstanceOf(MoleculeSelector.AllMolecules.class);
		assertThat(MoleculeSelector.collective("ALL_VOLUME_MOLECULES")).containsInstanceOf(MoleculeSelector.AllVolumeMolecules.class);
		assertThat(MoleculeSelector.collective("ALL_SURFACE_MOLECULES")).containsInstanceOf(MoleculeSelector.AllSurfaceMolecules.class);
		assertThat(MoleculeSelector.collective("SINGLE")).isEmpty();
	}
}
