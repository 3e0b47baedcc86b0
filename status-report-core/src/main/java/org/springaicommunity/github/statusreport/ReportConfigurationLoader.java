package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Loads a {@link ReportConfiguration} from YAML.
 *
 * <p>
 * The bundled {@code default.yml} is applied first, then every configured location in
 * order. A location is either a file or a directory; directories contribute their
 * {@code *.yml} and {@code *.yaml} files sorted by name. Later files override earlier
 * ones key by key, except for {@code sections}, which is replaced as a whole. Keys left
 * empty in a file keep their earlier value.
 *
 * <p>
 * String values may reference environment variables as {@code ${NAME}}. They are resolved
 * through {@link EnvironmentSupport} unless another lookup is supplied.
 *
 * <p>
 * Unknown keys, malformed YAML and missing locations fail with
 * {@link ReportConfigurationException}.
 */
public class ReportConfigurationLoader {

	private static final Logger logger = LoggerFactory.getLogger(ReportConfigurationLoader.class);

	/**
	 * Classpath resource holding the built-in defaults.
	 */
	public static final String DEFAULTS_RESOURCE = "default.yml";

	private static final String MASKED = "****";

	private final ObjectMapper yamlMapper;

	private final Function<String, @Nullable String> environment;

	private final List<String> sources = new ArrayList<>();

	public ReportConfigurationLoader() {
		this(ObjectMapperFactory.createYaml(), EnvironmentSupport::get);
	}

	/**
	 * Create a loader with a custom mapper and variable lookup.
	 * @param yamlMapper mapper created by {@link ObjectMapperFactory#createYaml()}
	 * @param environment resolves {@code ${NAME}} placeholders
	 */
	public ReportConfigurationLoader(ObjectMapper yamlMapper, Function<String, @Nullable String> environment) {
		this.yamlMapper = yamlMapper;
		this.environment = environment;
	}

	/**
	 * Load the defaults followed by the given locations.
	 * @param locations configuration files or directories, in increasing priority
	 * @return the merged configuration
	 * @throws ReportConfigurationException if a location is missing or unreadable
	 */
	public ReportConfiguration load(List<Path> locations) {
		sources.clear();
		ReportConfiguration config = new ReportConfiguration();
		applyDefaults(config);
		for (Path location : locations) {
			for (Path file : expand(location)) {
				try (InputStream in = Files.newInputStream(file)) {
					apply(config, file.toString(), in);
				}
				catch (IOException e) {
					throw new ReportConfigurationException("Failed to read configuration file " + file, e);
				}
			}
		}
		logger.debug("Configuration loaded from {}", sources);
		return config;
	}

	/**
	 * The sources applied by the last {@link #load(List)} call, in order.
	 * @return source names
	 */
	public List<String> sources() {
		return List.copyOf(sources);
	}

	/**
	 * Render a configuration as YAML with the token masked.
	 * @param config the configuration to render
	 * @return YAML text
	 */
	public String toYaml(ReportConfiguration config) {
		ObjectNode tree = yamlMapper.valueToTree(config);
		if (tree.path("token").asText("").length() > 0) {
			tree.put("token", MASKED);
		}
		try {
			return yamlMapper.writeValueAsString(tree);
		}
		catch (JsonProcessingException e) {
			throw new ReportConfigurationException("Failed to render configuration", e);
		}
	}

	private void applyDefaults(ReportConfiguration config) {
		try (InputStream in = ReportConfigurationLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (in == null) {
				logger.warn("Bundled {} not found, using built-in values", DEFAULTS_RESOURCE);
				return;
			}
			apply(config, DEFAULTS_RESOURCE, in);
		}
		catch (IOException e) {
			throw new ReportConfigurationException("Failed to read bundled " + DEFAULTS_RESOURCE, e);
		}
	}

	private List<Path> expand(Path location) {
		if (Files.isRegularFile(location)) {
			return List.of(location);
		}
		if (!Files.isDirectory(location)) {
			throw new ReportConfigurationException("Configuration location not found: " + location);
		}
		try (Stream<Path> files = Files.list(location)) {
			return files.filter(Files::isRegularFile).filter(ReportConfigurationLoader::isYaml).sorted().toList();
		}
		catch (IOException e) {
			throw new ReportConfigurationException("Failed to list configuration directory " + location, e);
		}
	}

	private static boolean isYaml(Path path) {
		String name = path.getFileName().toString();
		return name.endsWith(".yml") || name.endsWith(".yaml");
	}

	private void apply(ReportConfiguration config, String source, InputStream in) throws IOException {
		JsonNode tree;
		try {
			tree = yamlMapper.readTree(in);
		}
		catch (JsonProcessingException e) {
			throw new ReportConfigurationException("Malformed YAML in " + source + ": " + e.getOriginalMessage(), e);
		}
		if (tree == null || tree.isMissingNode() || tree.isNull()) {
			logger.debug("Configuration source {} is empty", source);
			sources.add(source);
			return;
		}
		if (!tree.isObject()) {
			throw new ReportConfigurationException("Configuration in " + source + " must be a mapping");
		}

		JsonNode expanded = expandPlaceholders(tree);
		try {
			yamlMapper.readerForUpdating(config).readValue(expanded);
		}
		catch (JsonProcessingException e) {
			throw new ReportConfigurationException("Invalid configuration in " + source + ": " + e.getOriginalMessage(),
					e);
		}
		sources.add(source);
	}

	private JsonNode expandPlaceholders(JsonNode node) {
		if (node.isTextual()) {
			return TextNode.valueOf(EnvironmentSupport.expand(node.asText(), environment));
		}
		if (node instanceof ObjectNode object) {
			Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				if (isEmptyScalar(field.getValue())) {
					logger.debug("Ignoring empty configuration key '{}'", field.getKey());
					fields.remove();
				}
				else {
					field.setValue(expandPlaceholders(field.getValue()));
				}
			}
			return object;
		}
		if (node instanceof ArrayNode array) {
			for (int i = 0; i < array.size(); i++) {
				array.set(i, expandPlaceholders(array.get(i)));
			}
			return array;
		}
		return node;
	}

	/**
	 * Keys written without a value ({@code owner:}) keep the value of earlier sources.
	 */
	private static boolean isEmptyScalar(JsonNode value) {
		return value.isNull() || (value.isTextual() && value.asText().isEmpty());
	}

}
