package org.javai.cellsim.datamodel.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Which molecules a surface class property applies to, as tagged by {@code affected_mols}.
 * Sealed so new collective selectors are added here without changing callers.
 */
public sealed interface MoleculeSelector {

	/**
	 * The data model tag for this selector.
	 */
	String tag();

	/**
	 * A property bound to one named species.
	 */
	record SingleMolecule(String moleculeName) implements MoleculeSelector {
		public static final String TAG = "SINGLE";

		public SingleMolecule {
			Objects.requireNonNull(moleculeName, "moleculeName must not be null");
		}

		@Override
		public String tag() {
			return TAG;
		}
	}

	record AllMolecules() implements MoleculeSelector {
		public static final String TAG = "ALL_MOLECULES";

		@Override
		public String tag() {
			return TAG;
		}
	}

	record AllVolumeMolecules() implements MoleculeSelector {
		public static final String TAG = "ALL_VOLUME_MOLECULES";

		@Override
		public String tag() {
			return TAG;
		}
	}

	record AllSurfaceMolecules() implements MoleculeSelector {
		public static final String TAG = "ALL_SURFACE_MOLECULES";

		@Override
		public String tag() {
			return TAG;
		}
	}

	/**
	 * Build a collective selector from its tag. {@code SINGLE} is not handled here because it needs a
	 * molecule name.
	 *
	 * @return the selector, or empty when the tag is not a known collective selector
	 */
	static Optional<MoleculeSelector> collective(String tag) {
		return switch (tag) {
			case AllMolecules.TAG -> Optional.of(new AllMolecules());
			case AllVolumeMolecules.TAG -> Optional.of(new AllVolumeMolecules());
			case AllSurfaceMolecules.TAG -> Optional.of(new AllSurfaceMolecules());
			default -> Optional.empty();
		};
	}
}
