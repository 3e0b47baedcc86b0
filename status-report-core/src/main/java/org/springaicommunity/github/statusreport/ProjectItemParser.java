package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts ProjectV2 item nodes of the GraphQL API into {@link Item}s.
 *
 * <p>
 * The items query requests the content three times under the aliases {@code di}
 * (DraftIssue), {@code iss} (Issue) and {@code pr} (PullRequest); only the alias matching
 * the actual content type is populated, the others come back as empty objects. Field
 * values arrive as a union: each node carries the payload of exactly one value type, or
 * nothing at all for types the query does not select.
 *
 * <p>
 * Malformed values are skipped with a warning so that one odd item cannot fail a run.
 */
public class ProjectItemParser {

	private static final Logger logger = LoggerFactory.getLogger(ProjectItemParser.class);

	/**
	 * Parse one item node.
	 * @param node an element of {@code items.nodes}
	 * @return the item, or null if the node carries no id
	 */
	public @Nullable Item parse(JsonNode node) {
		String id = node.path("id").asText("");
		if (id.isEmpty()) {
			logger.warn("Skipping project item without id");
			return null;
		}

		Map<String, Field> fields = new LinkedHashMap<>();
		List<String> labels = new ArrayList<>();
		for (JsonNode value : node.path("fieldValues").path("nodes")) {
			parseFieldValue(id, value, fields, labels);
		}

		JsonNode pr = node.path("pr");
		JsonNode issue = node.path("iss");
		JsonNode draft = node.path("di");
		if (isPresent(pr)) {
			RepositoryInfo repository = parseRepository(pr.path("repository"))
				.withBranch(pr.path("baseRefName").asText(""));
			return new Item(id, node.path("isArchived").asBoolean(false), ItemType.PULL_REQUEST,
					pr.path("number").asInt(0), pr.path("url").asText(""), repository, labels, fields,
					completionTime(id, pr));
		}
		if (isPresent(issue)) {
			return new Item(id, node.path("isArchived").asBoolean(false), ItemType.ISSUE,
					issue.path("number").asInt(0), issue.path("url").asText(""),
					parseRepository(issue.path("repository")), labels, fields, completionTime(id, issue));
		}
		return new Item(id, node.path("isArchived").asBoolean(false), ItemType.DRAFT_ISSUE, 0, "",
				RepositoryInfo.NONE, labels, fields, completionTime(id, draft));
	}

	/**
	 * Parse every item of an {@code items} connection.
	 * @param nodes the {@code items.nodes} array
	 * @return the parsed items in response order
	 */
	public List<Item> parseAll(JsonNode nodes) {
		List<Item> items = new ArrayList<>();
		for (JsonNode node : nodes) {
			Item item = parse(node);
			if (item != null) {
				items.add(item);
			}
		}
		return items;
	}

	private void parseFieldValue(String itemId, JsonNode value, Map<String, Field> fields, List<String> labels) {
		if (value.has("labels")) {
			for (JsonNode label : value.path("labels").path("nodes")) {
				String name = label.path("name").asText("");
				if (!name.isEmpty()) {
					labels.add(name);
				}
			}
			return;
		}

		String name = value.path("field").path("name").asText("");
		if (name.isEmpty()) {
			return;
		}

		try {
			Field field = toField(value);
			if (field != null) {
				fields.put(name, field);
			}
		}
		catch (DateTimeParseException | IllegalArgumentException e) {
			logger.warn("Skipping field '{}' of item {}: {}", name, itemId, e.getMessage());
		}
	}

	private static @Nullable Field toField(JsonNode value) {
		if (value.hasNonNull("date")) {
			return new Field.Date(parseDate(value.path("date").asText()));
		}
		if (value.hasNonNull("duration") || value.hasNonNull("iterationId")) {
			return new Field.Iteration(Duration.ofDays(value.path("duration").asLong(0)),
					value.path("iterationId").asText(""), parseDate(value.path("startDate").asText()),
					value.path("title").asText(""));
		}
		if (value.hasNonNull("number")) {
			JsonNode number = value.path("number");
			if (!number.isNumber()) {
				throw new IllegalArgumentException("not a number: " + number.asText());
			}
			return new Field.Number(number.asDouble());
		}
		if (value.hasNonNull("name")) {
			return new Field.Text(value.path("name").asText());
		}
		if (value.hasNonNull("text")) {
			return new Field.Text(value.path("text").asText());
		}
		return null;
	}

	/**
	 * Dates are plain {@code yyyy-MM-dd} values, but full timestamps are accepted too.
	 */
	private static LocalDate parseDate(String text) {
		if (text.indexOf('T') > 0) {
			return OffsetDateTime.parse(text).toLocalDate();
		}
		return LocalDate.parse(text);
	}

	private static RepositoryInfo parseRepository(JsonNode repository) {
		if (repository.isMissingNode() || repository.isNull()) {
			return RepositoryInfo.NONE;
		}
		return RepositoryInfo.of(repository.path("name").asText(""), repository.path("nameWithOwner").asText(""),
				repository.path("url").asText(""));
	}

	/**
	 * Closed time, else merge time, else last update.
	 */
	private static @Nullable Instant completionTime(String itemId, JsonNode content) {
		for (String key : List.of("closedAt", "mergedAt", "updatedAt")) {
			if (content.hasNonNull(key)) {
				String text = content.path(key).asText();
				try {
					return Instant.parse(text);
				}
				catch (DateTimeParseException e) {
					logger.warn("Ignoring malformed {} '{}' of item {}", key, text, itemId);
				}
			}
		}
		return null;
	}

	private static boolean isPresent(JsonNode content) {
		return content.isObject() && content.size() > 0;
	}

}
