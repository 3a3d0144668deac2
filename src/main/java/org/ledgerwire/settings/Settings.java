package org.ledgerwire.settings;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Node settings, read from a JSON file such as:
 *
 * <pre>
 * {
 *   "maxFramesPerMessage": 1048576,
 *   "maxFrameSize": 16777216,
 *   "maxHashesPerMessage": 500
 * }
 * </pre>
 *
 * Missing keys keep their defaults.
 */
public class Settings {

	private static final Logger LOGGER = LogManager.getLogger(Settings.class);

	private static final String SETTINGS_FILENAME = "settings.json";

	// Properties
	private static Settings instance;

	/** Reject incoming frame sequences with more frames than this. */
	private int maxFramesPerMessage = 1024 * 1024;
	/** Reject incoming frame sequences containing a single frame larger than this, in bytes. */
	private int maxFrameSize = 16 * 1024 * 1024;
	/** Maximum number of block hashes or transaction IDs listed in a single inventory/request message. */
	private int maxHashesPerMessage = 500;

	// Constructors

	private Settings() {
	}

	// Other methods

	public static synchronized Settings getInstance() {
		if (instance == null)
			fileInstance(SETTINGS_FILENAME);

		return instance;
	}

	/**
	 * Parse settings from given file.
	 * <p>
	 * A missing file yields default settings. A file that can't be parsed, or that holds invalid values, is fatal.
	 */
	public static synchronized void fileInstance(String filename) {
		Path path = Paths.get(filename);

		if (!Files.exists(path)) {
			LOGGER.info("Settings file {} not found, using defaults", path.toAbsolutePath());
			instance = new Settings();
			return;
		}

		ObjectMapper mapper = new ObjectMapper()
				.setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

		Settings settings;
		try {
			settings = mapper.readValue(path.toFile(), Settings.class);
		} catch (IOException e) {
			LOGGER.error("Unable to parse settings file {}: {}", path, e.getMessage());
			throw new RuntimeException("Unable to parse settings file", e);
		}

		settings.validate();

		LOGGER.info("Using settings file {}", path.toAbsolutePath());
		instance = settings;
	}

	/** Discards any loaded settings in favour of defaults. */
	public static synchronized void defaultInstance() {
		instance = new Settings();
	}

	private void validate() {
		if (this.maxFramesPerMessage < 4)
			throwValidationError("maxFramesPerMessage must be at least 4");

		if (this.maxFrameSize < 1)
			throwValidationError("maxFrameSize must be positive");

		if (this.maxHashesPerMessage < 1)
			throwValidationError("maxHashesPerMessage must be positive");
	}

	private static void throwValidationError(String message) {
		LOGGER.error(message);
		throw new IllegalStateException(message);
	}

	// Getters

	public int getMaxFramesPerMessage() {
		return this.maxFramesPerMessage;
	}

	public int getMaxFrameSize() {
		return this.maxFrameSize;
	}

	public int getMaxHashesPerMessage() {
		return this.maxHashesPerMessage;
	}

}
