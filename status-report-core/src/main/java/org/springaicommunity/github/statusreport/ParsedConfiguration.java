package org.springaicommunity.github.statusreport;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Configuration files and directories, in increasing priority
	public List<String> configFiles = new ArrayList<>();

	// Mode flags
	public boolean show = false;

	public boolean dryRun = false;

	public boolean debug = false;

	public boolean helpRequested = false;

	@Nullable
	public String cacheFile = null;

	/**
	 * The configuration locations as paths.
	 * @return paths in command line order
	 */
	public List<Path> configPaths() {
		return configFiles.stream().map(Path::of).toList();
	}

}
