package org.javai.cellsim.datamodel.internal.parse;

import java.util.Optional;
import org.javai.cellsim.datamodel.DataModelParseException;
import org.javai.cellsim.datamodel.internal.bind.NameRegistry;
import org.javai.cellsim.datamodel.model.MoleculeReference;
import org.javai.cellsim.datamodel.model.Orientation;
import org.javai.cellsim.datamodel.model.Species;

/**
 * Parses orientation-annotated molecule tokens such as {@code A'}, {@code B,} or {@code C}.
 * <p>
 * Grammar: a bare species name optionally followed, with no separator, by one orientation suffix:
 * {@code '} (up), {@code ,} (down) or {@code ;} (mix). Without a suffix the whole token is the
 * species name and the orientation is mix.
 */
public class MoleculeTokenParser {

	private final NameRegistry<Species> species;

	public MoleculeTokenParser(NameRegistry<Species> species) {
		this.species = species;
	}

	/**
	 * Parse a token and resolve its species.
	 *
	 * @param token the token text
	 * @param path document path used in error reports
	 * @throws DataModelParseException if the token is empty, contains whitespace, or is only a suffix
	 * @throws org.javai.cellsim.datamodel.UnresolvedReferenceException if the species is not registered
	 */
	public MoleculeReference parse(String token, String path) {
		MoleculeToken parsed = tokenize(token, path);
		Species resolved = species.require(parsed.speciesName(), path);
		return new MoleculeReference(resolved, parsed.orientation());
	}

	/**
	 * Split a token into species name and orientation without resolving the name.
	 */
	public static MoleculeToken tokenize(String token, String path) {
		if (token.isEmpty()) {
			throw new DataModelParseException(path, token, "Empty molecule token");
		}
		for (int i = 0; i < token.length(); i++) {
			if (Character.isWhitespace(token.charAt(i))) {
				throw new DataModelParseException(path, token, "Molecule token contains whitespace");
			}
		}
		char last = token.charAt(token.length() - 1);
		Optional<Orientation> suffix = Orientation.fromSuffix(last);
		if (suffix.isEmpty()) {
			return new MoleculeToken(token, Orientation.MIX);
		}
		String name = token.substring(0, token.length() - 1);
		if (name.isEmpty()) {
			throw new DataModelParseException(path, token, "Orientation suffix without a species name");
		}
		return new MoleculeToken(name, suffix.get());
	}
}
