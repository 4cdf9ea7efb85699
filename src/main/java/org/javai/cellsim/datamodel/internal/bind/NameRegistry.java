package org.javai.cellsim.datamodel.internal.bind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.cellsim.datamodel.DuplicateNameException;
import org.javai.cellsim.datamodel.ReferenceKind;
import org.javai.cellsim.datamodel.UnresolvedReferenceException;

/**
 * A name-keyed namespace of entities, in registration order.
 * <p>
 * Each import run owns its own registries. Exactly one builder writes a registry; later builders
 * only read it.
 */
public final class NameRegistry<T> {

	private final ReferenceKind kind;
	private final Map<String, T> entries = new LinkedHashMap<>();

	public NameRegistry(ReferenceKind kind) {
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	/**
	 * Register a new entity.
	 *
	 * @throws DuplicateNameException if the name is already taken
	 */
	public void register(String name, T entity, String path) {
		Objects.requireNonNull(entity, "entity must not be null");
		if (entries.containsKey(name)) {
			throw new DuplicateNameException(path, kind, name);
		}
		entries.put(name, entity);
	}

	/**
	 * Resolve a name.
	 *
	 * @throws UnresolvedReferenceException if nothing is registered under the name
	 */
	public T require(String name, String path) {
		T entity = entries.get(name);
		if (entity == null) {
			throw new UnresolvedReferenceException(path, kind, name);
		}
		return entity;
	}

	public int size() {
		return entries.size();
	}

	/**
	 * Read-only view in registration order.
	 */
	public Map<String, T> asMap() {
		return Collections.unmodifiableMap(entries);
	}
}
