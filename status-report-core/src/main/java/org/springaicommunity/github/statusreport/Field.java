package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Duration;
import java.time.LocalDate;

/**
 * A custom field value attached to a project item.
 *
 * <p>
 * GitHub project fields are one of several types. Each variant is its own record so that
 * only the payload of the actual type can be read:
 *
 * <pre>{@code
 * if (field instanceof Field.Text text) {
 *     return text.text();
 * }
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({ @JsonSubTypes.Type(value = Field.Empty.class, name = "empty"),
		@JsonSubTypes.Type(value = Field.Text.class, name = "text"),
		@JsonSubTypes.Type(value = Field.Date.class, name = "date"),
		@JsonSubTypes.Type(value = Field.Number.class, name = "number"),
		@JsonSubTypes.Type(value = Field.Iteration.class, name = "iteration") })
public sealed interface Field permits Field.Empty, Field.Text, Field.Date, Field.Number, Field.Iteration {

	/**
	 * A field that exists on the board but has no value for the item.
	 */
	record Empty() implements Field {

	}

	/**
	 * A text or single select value.
	 *
	 * @param text the value (for single select fields, the selected option name)
	 */
	record Text(String text) implements Field {

	}

	/**
	 * A date value.
	 *
	 * @param date the date
	 */
	record Date(LocalDate date) implements Field {

	}

	/**
	 * A numeric value.
	 *
	 * @param number the value
	 */
	record Number(double number) implements Field {

	}

	/**
	 * An iteration (sprint) assignment.
	 *
	 * @param duration the length of the iteration
	 * @param iterationId the GitHub id of the iteration
	 * @param startDate the first day of the iteration
	 * @param title the iteration title
	 */
	record Iteration(Duration duration, String iterationId, LocalDate startDate, String title) implements Field {

	}

}
