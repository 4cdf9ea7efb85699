package org.javai.cellsim.datamodel.internal.parse;

import java.util.Optional;
import org.springframework.lang.Nullable;

/**
 * A parsed release-site target: a mesh object name and, optionally, one of its region names.
 */
public record ObjectExpression(String objectName, @Nullable String regionName) {

	public Optional<String> region() {
		return Optional.ofNullable(regionName);
	}

	@Override
	public String toString() {
		return regionName == null ? objectName : objectName + "[" + regionName + "]";
	}
}
