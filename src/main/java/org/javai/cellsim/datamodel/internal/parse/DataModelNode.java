package org.javai.cellsim.datamodel.internal.parse;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.javai.cellsim.datamodel.MalformedFieldException;
import org.springframework.lang.Nullable;

/**
 * A mapping in the decoded data model, tagged with its document path.
 * <p>
 * The accessors accept scalars either as strings or as already-decoded numbers and booleans,
 * since JSON and YAML documents differ in how they carry them. Every conversion failure is
 * reported as a {@link MalformedFieldException} naming this node's path and the field.
 */
public final class DataModelNode {

	private final String path;
	private final Map<?, ?> values;

	private DataModelNode(String path, Map<?, ?> values) {
		this.path = path;
		this.values = values;
	}

	public static DataModelNode root(Map<?, ?> values) {
		return new DataModelNode("", values);
	}

	public static DataModelNode of(String path, Map<?, ?> values) {
		return new DataModelNode(path, values);
	}

	public String path() {
		return path;
	}

	/**
	 * Path of a field of this node, e.g. {@code species[0].mol_name}.
	 */
	public String pathOf(String key) {
		return path.isEmpty() ? key : path + "." + key;
	}

	/**
	 * Follow a dotted path of nested mappings, e.g. {@code mcell.define_molecules}.
	 *
	 * @return the mapping at the end of the path, or empty if any step is absent
	 */
	public Optional<DataModelNode> descend(String dottedPath) {
		DataModelNode current = this;
		for (String key : dottedPath.split("\\.")) {
			Optional<DataModelNode> next = current.child(key);
			if (next.isEmpty()) {
				return Optional.empty();
			}
			current = next.get();
		}
		return Optional.of(current);
	}

	/**
	 * The list of mappings at a dotted path; absent sections read as an empty list.
	 */
	public List<DataModelNode> listAt(String dottedPath) {
		int lastDot = dottedPath.lastIndexOf('.');
		if (lastDot < 0) {
			return children(dottedPath);
		}
		return descend(dottedPath.substring(0, lastDot))
				.map(parent -> parent.children(dottedPath.substring(lastDot + 1)))
				.orElse(List.of());
	}

	/**
	 * A nested mapping, or empty when the field is absent.
	 */
	public Optional<DataModelNode> child(String key) {
		Object raw = values.get(key);
		if (raw == null) {
			return Optional.empty();
		}
		if (!(raw instanceof Map<?, ?> map)) {
			throw new MalformedFieldException(path, key, "must be a mapping but was " + describe(raw));
		}
		return Optional.of(new DataModelNode(pathOf(key), map));
	}

	/**
	 * A list of mappings, or an empty list when the field is absent.
	 */
	public List<DataModelNode> children(String key) {
		List<?> raw = optionalList(key);
		List<DataModelNode> nodes = new ArrayList<>(raw.size());
		for (int i = 0; i < raw.size(); i++) {
			Object element = raw.get(i);
			String elementPath = pathOf(key) + "[" + i + "]";
			if (!(element instanceof Map<?, ?> map)) {
				throw new MalformedFieldException(path, key + "[" + i + "]", "must be a mapping but was " + describe(element));
			}
			nodes.add(new DataModelNode(elementPath, map));
		}
		return nodes;
	}

	public String requireString(String key) {
		Object raw = values.get(key);
		if (raw == null) {
			throw missing(key);
		}
		return scalarText(key, raw);
	}

	public Optional<String> optionalString(String key) {
		Object raw = values.get(key);
		return raw == null ? Optional.empty() : Optional.of(scalarText(key, raw));
	}

	/**
	 * A real-valued field, given as a number or a plain decimal string such as {@code 1e-6}.
	 * Non-finite values are rejected, as are Java literal forms like {@code 5d} or {@code 0x1p3}.
	 */
	public double requireDouble(String key) {
		Object raw = values.get(key);
		if (raw == null) {
			throw missing(key);
		}
		return toDouble(key, raw);
	}

	/**
	 * An integer field, given as an integral number or an integer string.
	 */
	public int requireInt(String key) {
		Object raw = values.get(key);
		if (raw == null) {
			throw missing(key);
		}
		return toInt(key, raw);
	}

	public boolean optionalBoolean(String key, boolean defaultValue) {
		Object raw = values.get(key);
		if (raw == null) {
			return defaultValue;
		}
		if (raw instanceof Boolean b) {
			return b;
		}
		if (raw instanceof String s) {
			String normalized = s.trim().toLowerCase(Locale.ROOT);
			if (normalized.equals("true")) {
				return true;
			}
			if (normalized.equals("false")) {
				return false;
			}
		}
		throw new MalformedFieldException(path, key, "is not a boolean: " + describe(raw));
	}

	/**
	 * The raw value of a field, for callers that interpret several shapes themselves.
	 */
	@Nullable
	public Object raw(String key) {
		return values.get(key);
	}

	public List<Integer> requireIntList(String key) {
		List<?> raw = requireList(key);
		List<Integer> result = new ArrayList<>(raw.size());
		for (int i = 0; i < raw.size(); i++) {
			result.add(toInt(key + "[" + i + "]", raw.get(i)));
		}
		return result;
	}

	public List<List<Double>> requireDoubleTuples(String key) {
		List<?> raw = requireList(key);
		List<List<Double>> result = new ArrayList<>(raw.size());
		for (int i = 0; i < raw.size(); i++) {
			String field = key + "[" + i + "]";
			List<?> tuple = asList(field, raw.get(i));
			List<Double> converted = new ArrayList<>(tuple.size());
			for (int j = 0; j < tuple.size(); j++) {
				converted.add(toDouble(field + "[" + j + "]", tuple.get(j)));
			}
			result.add(converted);
		}
		return result;
	}

	public List<List<Integer>> requireIntTuples(String key) {
		List<?> raw = requireList(key);
		List<List<Integer>> result = new ArrayList<>(raw.size());
		for (int i = 0; i < raw.size(); i++) {
			String field = key + "[" + i + "]";
			List<?> tuple = asList(field, raw.get(i));
			List<Integer> converted = new ArrayList<>(tuple.size());
			for (int j = 0; j < tuple.size(); j++) {
				converted.add(toInt(field + "[" + j + "]", tuple.get(j)));
			}
			result.add(converted);
		}
		return result;
	}

	private List<?> requireList(String key) {
		Object raw = values.get(key);
		if (raw == null) {
			throw missing(key);
		}
		return asList(key, raw);
	}

	private List<?> optionalList(String key) {
		Object raw = values.get(key);
		return raw == null ? List.of() : asList(key, raw);
	}

	private List<?> asList(String field, @Nullable Object raw) {
		if (raw instanceof List<?> list) {
			return list;
		}
		throw new MalformedFieldException(path, field, "must be a list but was " + describe(raw));
	}

	private String scalarText(String field, Object raw) {
		if (raw instanceof String s) {
			return s;
		}
		if (raw instanceof Number || raw instanceof Boolean) {
			return raw.toString();
		}
		throw new MalformedFieldException(path, field, "must be a scalar but was " + describe(raw));
	}

	private double toDouble(String field, @Nullable Object raw) {
		double value;
		if (raw instanceof Number n) {
			value = n.doubleValue();
		}
		else if (raw instanceof String s) {
			try {
				value = new BigDecimal(s.trim()).doubleValue();
			}
			catch (NumberFormatException e) {
				throw new MalformedFieldException(path, field, "is not a number: '" + s + "'", e);
			}
		}
		else {
			throw new MalformedFieldException(path, field, "is not a number: " + describe(raw));
		}
		if (!Double.isFinite(value)) {
			throw new MalformedFieldException(path, field, "must be finite but was " + raw);
		}
		return value;
	}

	private int toInt(String field, @Nullable Object raw) {
		if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
			return ((Number) raw).intValue();
		}
		if (raw instanceof Long || raw instanceof BigInteger) {
			return narrow(field, new BigDecimal(raw.toString()));
		}
		if (raw instanceof Number n) {
			if (!Double.isFinite(n.doubleValue())) {
				throw new MalformedFieldException(path, field, "is not an integer: " + n);
			}
			return narrow(field, new BigDecimal(n.toString()));
		}
		if (raw instanceof String s) {
			try {
				return Integer.parseInt(s.trim());
			}
			catch (NumberFormatException e) {
				throw new MalformedFieldException(path, field, "is not an integer: '" + s + "'", e);
			}
		}
		throw new MalformedFieldException(path, field, "is not an integer: " + describe(raw));
	}

	private int narrow(String field, BigDecimal value) {
		try {
			return value.intValueExact();
		}
		catch (ArithmeticException e) {
			throw new MalformedFieldException(path, field, "is not an integer in range: " + value, e);
		}
	}

	private MalformedFieldException missing(String key) {
		return new MalformedFieldException(path, key, "is missing");
	}

	private static String describe(@Nullable Object raw) {
		if (raw == null) {
			return "null";
		}
		if (raw instanceof Map) {
			return "a mapping";
		}
		if (raw instanceof List) {
			return "a list";
		}
		return raw.getClass().getSimpleName() + " '" + raw + "'";
	}

	@Override
	public String toString() {
		return "DataModelNode[" + (path.isEmpty() ? "<root>" : path) + "]";
	}
}
