package org.springaicommunity.github.statusreport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;

/**
 * Writes each report to {@code <directory>/<first day>-<last day>.md}, for example
 * {@code 2022.07.31-2022.08.06.md}. An existing file for the same week is overwritten.
 */
public class FileSystemReportRepository implements ReportRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemReportRepository.class);

	private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy.MM.dd");

	private final Path directory;

	public FileSystemReportRepository(Path directory) {
		this.directory = directory;
	}

	/**
	 * The file name used for a window.
	 * @param window the window
	 * @return the file name, without directory
	 */
	public static String fileName(WeeklyWindow window) {
		return FILE_DATE.format(window.firstDay()) + "-" + FILE_DATE.format(window.lastDay()) + ".md";
	}

	@Override
	public Path save(WeeklyWindow window, String content) {
		Path target = directory.resolve(fileName(window));
		try {
			Files.createDirectories(directory);
			Files.writeString(target, content, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write report " + target, e);
		}
		logger.info("Wrote report {} ({} items)", target, window.items().size());
		return target;
	}

}
