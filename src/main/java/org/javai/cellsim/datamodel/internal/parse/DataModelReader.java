package org.javai.cellsim.datamodel.internal.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.javai.cellsim.datamodel.DocumentFormat;
import org.javai.cellsim.datamodel.DocumentReadException;
import org.yaml.snakeyaml.Yaml;

/**
 * Decodes a data model document into a tree of maps, lists and scalars.
 * JSON goes through Jackson, YAML through SnakeYAML.
 */
public class DataModelReader {

	private final ObjectMapper mapper;

	public DataModelReader() {
		this(new ObjectMapper());
	}

	public DataModelReader(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * Read a document from a path, inferring the format from its extension.
	 */
	public DataModelNode read(Path path) {
		return read(path, DocumentFormat.fromFileName(path.getFileName().toString()));
	}

	public DataModelNode read(Path path, DocumentFormat format) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return toRoot(decode(reader, format));
		}
		catch (DocumentReadException e) {
			throw e;
		}
		catch (Exception e) {
			throw new DocumentReadException("Failed to read data model from path: " + path, e);
		}
	}

	public DataModelNode read(InputStream inputStream, DocumentFormat format) {
		try {
			Object decoded = switch (format) {
				case JSON -> mapper.readValue(inputStream, Object.class);
				case YAML -> newYaml().load(inputStream);
			};
			return toRoot(decoded);
		}
		catch (DocumentReadException e) {
			throw e;
		}
		catch (Exception e) {
			throw new DocumentReadException("Failed to read data model from input stream", e);
		}
	}

	public DataModelNode readString(String content, DocumentFormat format) {
		try {
			Object decoded = switch (format) {
				case JSON -> mapper.readValue(content, Object.class);
				case YAML -> newYaml().load(content);
			};
			return toRoot(decoded);
		}
		catch (DocumentReadException e) {
			throw e;
		}
		catch (Exception e) {
			throw new DocumentReadException("Failed to read data model from string", e);
		}
	}

	private Object decode(Reader reader, DocumentFormat format) throws Exception {
		return switch (format) {
			case JSON -> mapper.readValue(reader, Object.class);
			case YAML -> newYaml().load(reader);
		};
	}

	// Yaml instances are not thread-safe
	private static Yaml newYaml() {
		return new Yaml();
	}

	private static DataModelNode toRoot(Object decoded) {
		if (!(decoded instanceof Map<?, ?> map)) {
			String found = decoded == null ? "an empty document" : decoded.getClass().getSimpleName();
			throw new DocumentReadException("Data model root must be a mapping, found " + found);
		}
		return DataModelNode.root(map);
	}
}
