package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A project item (issue, pull request or draft issue) in normalized form.
 *
 * <p>
 * Items are produced by {@link ProjectItemParser} (or read back from an {@link ItemCache})
 * and are never modified afterwards.
 *
 * @param id the project item id, used for archiving
 * @param archived whether the item is already archived on the board
 * @param type the kind of content behind the item
 * @param number the issue or pull request number, 0 for drafts
 * @param url the web URL of the issue or pull request, empty for drafts
 * @param repository the owning repository, {@link RepositoryInfo#NONE} for drafts
 * @param labels the labels in the order GitHub reports them
 * @param fields the custom field values keyed by field name
 * @param updatedAt when the content was closed, merged or last updated (null if unknown)
 */
public record Item(String id, boolean archived, ItemType type, int number, String url, RepositoryInfo repository,
		List<String> labels, Map<String, Field> fields, @Nullable Instant updatedAt) {

	/**
	 * Name of the field holding the board column.
	 */
	public static final String STATUS_FIELD = "Status";

	/**
	 * Name of the field holding the item title.
	 */
	public static final String TITLE_FIELD = "Title";

	private static final String DONE = "done";

	public Item {
		labels = List.copyOf(labels);
		fields = Map.copyOf(fields);
	}

	/**
	 * Returns true if the {@code Status} field is a text field equal to "done", ignoring
	 * case.
	 * @return true if the item is complete
	 */
	@JsonIgnore
	public boolean isDone() {
		return fields.get(STATUS_FIELD) instanceof Field.Text status
				&& DONE.equals(status.text().toLowerCase(Locale.ROOT));
	}

	/**
	 * The time the item was completed. Only defined for done items with a known timestamp;
	 * everything else is excluded from time based grouping.
	 * @return the completion time, or empty if the item is not done
	 */
	@JsonIgnore
	public Optional<Instant> completedAt() {
		if (!isDone()) {
			return Optional.empty();
		}
		return Optional.ofNullable(updatedAt);
	}

	/**
	 * The title of the item.
	 * @return the {@code Title} text field, or the empty string
	 */
	@JsonIgnore
	public String title() {
		if (fields.get(TITLE_FIELD) instanceof Field.Text title) {
			return title.text();
		}
		return "";
	}

}
