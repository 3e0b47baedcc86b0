package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for consistently configured Jackson mappers.
 *
 * <p>
 * Both mappers use {@link PropertyNamingStrategies#SNAKE_CASE} so that Java camelCase
 * properties appear as snake_case keys (e.g.&nbsp;{@code renderOrder} &rarr;
 * {@code render_order}) in the item cache and in configuration files.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a JSON mapper, used for GraphQL payloads and the item cache.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		return configure(new ObjectMapper());
	}

	/**
	 * Create a YAML mapper for configuration files. Nested configuration objects are
	 * merged when a file is read on top of an existing configuration, and explicit nulls
	 * never replace a previous value.
	 * @return configured ObjectMapper reading and writing YAML
	 */
	public static ObjectMapper createYaml() {
		YAMLFactory factory = YAMLFactory.builder().enable(YAMLGenerator.Feature.MINIMIZE_QUOTES).build();
		ObjectMapper mapper = configure(new ObjectMapper(factory));
		mapper.setDefaultMergeable(true);
		mapper.setDefaultSetterInfo(JsonSetter.Value.forValueNulls(Nulls.SKIP));
		return mapper;
	}

	private static ObjectMapper configure(ObjectMapper mapper) {
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
