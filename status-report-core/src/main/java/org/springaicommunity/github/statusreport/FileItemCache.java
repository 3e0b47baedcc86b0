package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ItemCache} stored as a JSON array in a single file.
 */
public class FileItemCache implements ItemCache {

	private static final Logger logger = LoggerFactory.getLogger(FileItemCache.class);

	private static final TypeReference<List<Item>> ITEM_LIST = new TypeReference<>() {
	};

	private final Path file;

	private final ObjectMapper objectMapper;

	public FileItemCache(Path file, ObjectMapper objectMapper) {
		this.file = file;
		this.objectMapper = objectMapper;
	}

	public Path file() {
		return file;
	}

	@Override
	public boolean exists() {
		return Files.isRegularFile(file);
	}

	@Override
	public List<Item> read() {
		try {
			List<Item> items = objectMapper.readValue(file.toFile(), ITEM_LIST);
			logger.info("Read {} items from cache {}", items.size(), file);
			return items;
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read item cache " + file, e);
		}
	}

	@Override
	public void write(List<Item> items) {
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), items);
			logger.info("Wrote {} items to cache {}", items.size(), file);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write item cache " + file, e);
		}
	}

}
