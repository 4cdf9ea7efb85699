package org.javai.cellsim.datamodel;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.javai.cellsim.datamodel.engine.SimulationEngine;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.internal.parse.DataModelReader;
import org.javai.cellsim.datamodel.internal.resolve.DefaultScenarioResolver;
import org.javai.cellsim.datamodel.internal.resolve.ScenarioResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that turns a reaction-diffusion data model into a resolved scenario.
 * <p>
 * Typical use:
 * <pre>{@code
 * DataModelImporter importer = DataModelImporter.builder()
 *         .layout(DataModelLayout.CELLBLENDER)
 *         .build();
 * ImportedScenario scenario = importer.importFile(Path.of("model.json"));
 * scenario.applyTo(engine);
 * }</pre>
 * Imports are all-or-nothing: a {@link DataModelException} is thrown on the first defect and no
 * engine call has been made at that point. Each import uses fresh registries, so one importer can
 * be reused for any number of documents.
 */
public final class DataModelImporter {

	private static final Logger logger = LoggerFactory.getLogger(DataModelImporter.class);

	private final ImportOptions options;
	private final DataModelReader reader;
	private final ScenarioResolver resolver;

	private DataModelImporter(Builder builder) {
		this.options = builder.options;
		this.reader = builder.reader != null ? builder.reader : new DataModelReader();
		this.resolver = builder.resolver != null ? builder.resolver : new DefaultScenarioResolver();
	}

	public static Builder builder() {
		return new Builder();
	}

	public ImportOptions options() {
		return options;
	}

	/**
	 * Import a JSON or YAML file; the format is inferred from the file extension.
	 */
	public ImportedScenario importFile(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		logger.info("Importing data model {} ({} layout)", path, options.layout());
		return resolve(reader.read(path));
	}

	public ImportedScenario importStream(InputStream inputStream, DocumentFormat format) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		return resolve(reader.read(inputStream, format));
	}

	public ImportedScenario importString(String content, DocumentFormat format) {
		Objects.requireNonNull(content, "content must not be null");
		return resolve(reader.readString(content, format));
	}

	/**
	 * Import a document that has already been decoded into maps, lists and scalars.
	 */
	public ImportedScenario importDocument(Map<String, ?> document) {
		Objects.requireNonNull(document, "document must not be null");
		return resolve(DataModelNode.root(document));
	}

	/**
	 * Import a file and, only if the whole import succeeds, construct the scenario in the engine.
	 */
	public ImportedScenario importInto(Path path, SimulationEngine engine) {
		Objects.requireNonNull(engine, "engine must not be null");
		ImportedScenario scenario = importFile(path);
		scenario.applyTo(engine);
		return scenario;
	}

	private ImportedScenario resolve(DataModelNode document) {
		try {
			return resolver.resolve(document, options);
		}
		catch (DataModelException e) {
			logger.debug("Data model import failed: {}", e.getMessage());
			throw e;
		}
	}

	public static final class Builder {

		private ImportOptions options = ImportOptions.defaults();
		private DataModelReader reader;
		private ScenarioResolver resolver;

		private Builder() {
		}

		public Builder options(ImportOptions options) {
			this.options = Objects.requireNonNull(options, "options must not be null");
			return this;
		}

		public Builder layout(DataModelLayout layout) {
			this.options = options.withLayout(layout);
			return this;
		}

		public Builder backwardRatePolicy(BackwardRatePolicy policy) {
			this.options = options.withBackwardRatePolicy(policy);
			return this;
		}

		public Builder reader(DataModelReader reader) {
			this.reader = reader;
			return this;
		}

		public Builder resolver(ScenarioResolver resolver) {
			this.resolver = resolver;
			return this;
		}

		public DataModelImporter build() {
			return new DataModelImporter(this);
		}
	}
}
