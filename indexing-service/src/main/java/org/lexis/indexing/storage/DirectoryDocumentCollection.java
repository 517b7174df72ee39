package org.lexis.indexing.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Documents stored as files of one extension in a single directory. The file name
 * (with extension) is the document id.
 */
public class DirectoryDocumentCollection implements DocumentCollection<String> {
	private static final Logger logger = LoggerFactory.getLogger(DirectoryDocumentCollection.class);
	private final String directoryPath;
	private final String extension;

	public DirectoryDocumentCollection(String directoryPath, String extension) {
		this.directoryPath = directoryPath;
		this.extension = extension.startsWith(".") ? extension.substring(1) : extension;
	}

	@Override
	public SortedMap<String, String> documents() throws IOException {
		Path directory = Paths.get(directoryPath);

		if (!Files.isDirectory(directory)) {
			throw new DocumentLoadException("Document directory not found: " + directory);
		}

		List<Path> files;
		try (Stream<Path> paths = Files.list(directory)) {
			files = paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith("." + extension))
					.collect(Collectors.toList());
		}

		SortedMap<String, String> documents = new TreeMap<>();
		for (Path file : files) {
			try {
				documents.put(file.getFileName().toString(), Files.readString(file, StandardCharsets.UTF_8));
			} catch (IOException e) {
				throw new DocumentLoadException("Failed to read document " + file, e);
			}
		}

		logger.info("Loaded {} documents (*.{}) from {}", documents.size(), extension, directory);
		return documents;
	}
}
