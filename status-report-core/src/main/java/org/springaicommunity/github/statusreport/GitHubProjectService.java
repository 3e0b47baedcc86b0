package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ProjectService} backed by the GitHub GraphQL API.
 *
 * <p>
 * Responses carrying an {@code errors} array are turned into
 * {@link GitHubHttpClient.GitHubApiException}s; GraphQL reports most failures (unknown
 * project, missing scopes) with HTTP 200.
 */
public class GitHubProjectService implements ProjectService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubProjectService.class);

	static final String PROJECT_ID_QUERY = """
			query($owner: String!, $number: Int!) {
			    organization(login: $owner) {
			        projectV2(number: $number) {
			            id
			        }
			    }
			}
			""";

	static final String ITEMS_QUERY = """
			query($projectId: ID!, $count: Int!, $after: String, $labelCount: Int!, $fieldValuesCount: Int!) {
			    node(id: $projectId) {
			        ... on ProjectV2 {
			            items(first: $count, after: $after) {
			                nodes {
			                    id
			                    isArchived
			                    fieldValues(first: $fieldValuesCount) {
			                        nodes {
			                            ... on ProjectV2ItemFieldDateValue {
			                                field { ... on ProjectV2FieldCommon { name } }
			                                date
			                            }
			                            ... on ProjectV2ItemFieldIterationValue {
			                                field { ... on ProjectV2FieldCommon { name } }
			                                duration
			                                iterationId
			                                startDate
			                                title
			                            }
			                            ... on ProjectV2ItemFieldLabelValue {
			                                labels(first: $labelCount) { nodes { name } }
			                            }
			                            ... on ProjectV2ItemFieldNumberValue {
			                                field { ... on ProjectV2FieldCommon { name } }
			                                number
			                            }
			                            ... on ProjectV2ItemFieldSingleSelectValue {
			                                field { ... on ProjectV2FieldCommon { name } }
			                                name
			                            }
			                            ... on ProjectV2ItemFieldTextValue {
			                                field { ... on ProjectV2FieldCommon { name } }
			                                text
			                            }
			                        }
			                    }
			                    di: content {
			                        ... on DraftIssue { updatedAt }
			                    }
			                    iss: content {
			                        ... on Issue {
			                            updatedAt
			                            closedAt
			                            number
			                            url
			                            repository { name nameWithOwner url }
			                        }
			                    }
			                    pr: content {
			                        ... on PullRequest {
			                            updatedAt
			                            closedAt
			                            mergedAt
			                            number
			                            url
			                            baseRefName
			                            repository { name nameWithOwner url }
			                        }
			                    }
			                }
			                pageInfo {
			                    hasNextPage
			                    endCursor
			                }
			            }
			        }
			    }
			}
			""";

	static final String ARCHIVE_MUTATION = """
			mutation($projectId: ID!, $id: ID!) {
			    archiveProjectV2Item(input: {projectId: $projectId, itemId: $id}) {
			        clientMutationId
			    }
			}
			""";

	static final String UNARCHIVE_MUTATION = """
			mutation($projectId: ID!, $id: ID!) {
			    unarchiveProjectV2Item(input: {projectId: $projectId, itemId: $id}) {
			        clientMutationId
			    }
			}
			""";

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final ProjectItemParser parser;

	private final boolean logQueries;

	public GitHubProjectService(GitHubClient client, ObjectMapper objectMapper) {
		this(client, objectMapper, new ProjectItemParser(), false);
	}

	/**
	 * Create a service.
	 * @param client the GraphQL transport
	 * @param objectMapper JSON mapper for requests and responses
	 * @param parser converts item nodes
	 * @param logQueries log every query and its variables at DEBUG
	 */
	public GitHubProjectService(GitHubClient client, ObjectMapper objectMapper, ProjectItemParser parser,
			boolean logQueries) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.parser = parser;
		this.logQueries = logQueries;
	}

	@Override
	public String findProjectId(String owner, int number) {
		JsonNode response = execute("project lookup", PROJECT_ID_QUERY, Map.of("owner", owner, "number", number));
		String id = response.path("data").path("organization").path("projectV2").path("id").asText("");
		if (id.isEmpty()) {
			throw new GitHubHttpClient.GitHubApiException(
					"Project " + number + " of organization '" + owner + "' not found", 200, response.toString());
		}
		logger.info("Resolved project {}/{} to {}", owner, number, id);
		return id;
	}

	@Override
	public List<Item> fetchItems(String projectId, ReportConfiguration.Tuning tuning) {
		List<Item> items = new ArrayList<>();
		Map<String, @Nullable Object> variables = new HashMap<>();
		variables.put("projectId", projectId);
		variables.put("count", tuning.getIssueCount());
		variables.put("labelCount", tuning.getLabelCount());
		variables.put("fieldValuesCount", tuning.getFieldValueCount());
		variables.put("after", null);

		int page = 0;
		boolean hasNextPage = true;
		while (hasNextPage) {
			page++;
			JsonNode connection = execute("items page " + page, ITEMS_QUERY, variables).path("data")
				.path("node")
				.path("items");
			items.addAll(parser.parseAll(connection.path("nodes")));

			JsonNode pageInfo = connection.path("pageInfo");
			hasNextPage = pageInfo.path("hasNextPage").asBoolean(false);
			String cursor = pageInfo.path("endCursor").asText("");
			if (hasNextPage && cursor.isEmpty()) {
				logger.warn("Page {} reports more items but no cursor, stopping", page);
				hasNextPage = false;
			}
			variables.put("after", cursor);
			logger.debug("Fetched page {} ({} items so far)", page, items.size());
		}

		logger.info("Fetched {} items in {} pages", items.size(), page);
		return items;
	}

	@Override
	public void archiveItem(String projectId, String itemId) {
		execute("archive " + itemId, ARCHIVE_MUTATION, Map.of("projectId", projectId, "id", itemId));
		logger.debug("Archived item {}", itemId);
	}

	@Override
	public void unarchiveItem(String projectId, String itemId) {
		execute("unarchive " + itemId, UNARCHIVE_MUTATION, Map.of("projectId", projectId, "id", itemId));
		logger.debug("Unarchived item {}", itemId);
	}

	private JsonNode execute(String description, String query, Map<String, ?> variables) {
		String requestBody;
		try {
			requestBody = objectMapper.writeValueAsString(Map.of("query", query, "variables", variables));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot encode GraphQL request for " + description, e);
		}
		if (logQueries) {
			logger.debug("GraphQL {} request:\n{}\nvariables: {}", description, query, variables);
		}

		String responseBody = client.postGraphQL(requestBody);
		JsonNode response;
		try {
			response = objectMapper.readTree(responseBody);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed GraphQL response for " + description, e);
		}

		JsonNode errors = response.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			List<String> messages = new ArrayList<>();
			errors.forEach(error -> messages.add(error.path("message").asText(error.toString())));
			throw new GitHubHttpClient.GitHubApiException("GraphQL " + description + " failed: " + messages, 200,
					responseBody);
		}
		return response;
	}

}
