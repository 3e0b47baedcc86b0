package org.springaicommunity.github.statusreport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits completed items into contiguous weekly windows.
 *
 * <p>
 * Windows are laid out backward from "now". The most recent window ends at 00:00 UTC of
 * the latest anchor weekday on or before now; each earlier window ends where the next one
 * starts. Windows are produced until every candidate item has been placed, including empty
 * weeks in between, so the result has no gaps.
 *
 * <p>
 * Items that are not done, and items completed at or after the end of the most recent
 * window (the week still in progress), are left out.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * var builder = new WeeklyWindowBuilder(DayOfWeek.SUNDAY);
 * List<WeeklyWindow> weeks = builder.splitByWeeks(items, Instant.now());
 * }</pre>
 */
public class WeeklyWindowBuilder {

	private static final Logger logger = LoggerFactory.getLogger(WeeklyWindowBuilder.class);

	/**
	 * Length of every window.
	 */
	public static final Duration WEEK = Duration.ofDays(7);

	private final DayOfWeek anchor;

	public WeeklyWindowBuilder() {
		this(DayOfWeek.SUNDAY);
	}

	/**
	 * Create a builder whose windows end on the given weekday.
	 * @param anchor the weekday on which every window ends (and starts)
	 */
	public WeeklyWindowBuilder(DayOfWeek anchor) {
		this.anchor = anchor;
	}

	/**
	 * The end of the most recent complete window for the given instant.
	 * @param now the reference instant
	 * @return 00:00 UTC of the latest anchor weekday on or before {@code now}
	 */
	public Instant currentWindowEnd(Instant now) {
		LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
		return today.with(TemporalAdjusters.previousOrSame(anchor)).atStartOfDay(ZoneOffset.UTC).toInstant();
	}

	/**
	 * Group items into weekly windows, most recent window first.
	 * @param items the items to group, in discovery order
	 * @param now the reference instant
	 * @return contiguous windows, most recent first; empty if no item qualifies
	 */
	public List<WeeklyWindow> splitByWeeks(List<Item> items, Instant now) {
		Instant end = currentWindowEnd(now);

		List<Candidate> candidates = new ArrayList<>();
		for (Item item : items) {
			item.completedAt().filter(at -> at.isBefore(end)).ifPresent(at -> candidates.add(new Candidate(item, at)));
		}

		// List.sort is stable, equal timestamps keep discovery order
		candidates.sort(Comparator.comparing(Candidate::completedAt));

		List<WeeklyWindow> windows = new ArrayList<>();
		int upper = candidates.size();
		Instant windowEnd = end;
		while (upper > 0) {
			Instant windowStart = windowEnd.minus(WEEK);
			int lower = upper;
			while (lower > 0 && !candidates.get(lower - 1).completedAt().isBefore(windowStart)) {
				lower--;
			}

			List<Item> windowItems = candidates.subList(lower, upper).stream().map(Candidate::item).toList();
			windows.add(new WeeklyWindow(windowStart, windowEnd, windowItems));
			logger.debug("Window {} .. {}: {} items", windowStart, windowEnd, windowItems.size());

			upper = lower;
			windowEnd = windowStart;
		}

		logger.info("Grouped {} of {} items into {} weekly windows ending {}", candidates.size(), items.size(),
				windows.size(), end);
		return windows;
	}

	private record Candidate(Item item, Instant completedAt) {

	}

}
