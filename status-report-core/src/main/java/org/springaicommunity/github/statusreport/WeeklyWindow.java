package org.springaicommunity.github.statusreport;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * One week of completed items.
 *
 * <p>
 * The window covers {@code [start, end)}: an item completed exactly at {@code start}
 * belongs to this window, one completed exactly at {@code end} to the next one.
 *
 * @param start first instant of the window (00:00 UTC of the anchor weekday)
 * @param end first instant after the window, exactly seven days after start
 * @param items the items completed inside the window, oldest first
 */
public record WeeklyWindow(Instant start, Instant end, List<Item> items) {

	public WeeklyWindow {
		items = List.copyOf(items);
	}

	/**
	 * Returns true if the instant falls inside {@code [start, end)}.
	 * @param instant the instant to test
	 * @return true if inside the window
	 */
	public boolean contains(Instant instant) {
		return !instant.isBefore(start) && instant.isBefore(end);
	}

	/**
	 * The first day covered by the window.
	 * @return the UTC date of {@code start}
	 */
	public LocalDate firstDay() {
		return start.atZone(ZoneOffset.UTC).toLocalDate();
	}

	/**
	 * The last day covered by the window.
	 * @return the UTC date of the day before {@code end}
	 */
	public LocalDate lastDay() {
		return end.atZone(ZoneOffset.UTC).toLocalDate().minusDays(1);
	}

}
